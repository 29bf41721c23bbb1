package io.github.drompincen.remindpal.gateway.controller;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.protocol.api.CreateReminderRequest;
import io.github.drompincen.remindpal.protocol.api.ReminderDto;
import io.github.drompincen.remindpal.protocol.api.SnoozeRequest;
import io.github.drompincen.remindpal.runtime.notify.NotificationService;
import io.github.drompincen.remindpal.runtime.notify.ReminderMessages;
import io.github.drompincen.remindpal.runtime.reminder.ReminderLifecycle;
import io.github.drompincen.remindpal.runtime.reminder.ReminderService;
import io.github.drompincen.remindpal.runtime.reminder.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-09T14:00:00Z");

    @Mock private ReminderService reminderService;
    @Mock private ReminderLifecycle lifecycle;
    @Mock private NotificationService notifications;

    private ReminderController controller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        controller = new ReminderController(reminderService, lifecycle, notifications,
                new ReminderMessages(clock), clock, 10);
    }

    private static ReminderDocument reminder(String id) {
        ReminderDocument doc = new ReminderDocument();
        doc.setId(id);
        doc.setOwner("alice");
        doc.setMessage("call mom");
        doc.setTriggerTime(NOW.plusSeconds(3600));
        doc.setActive(true);
        doc.setCreatedAt(NOW);
        return doc;
    }

    @Test
    void createReturns201AndConfirms() {
        when(reminderService.create("alice", "@remind call mom in 1 hour")).thenReturn(Optional.of(reminder("r1")));

        ResponseEntity<?> response = controller.create(new CreateReminderRequest("alice", "@remind call mom in 1 hour"));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getHeaders().getLocation()).hasToString("/api/reminders/r1");
        assertThat(((ReminderDto) response.getBody()).message()).isEqualTo("call mom");
        verify(notifications).sendText(eq("alice"), anyString());
    }

    @Test
    void createReturns422WhenTextHasNoTime() {
        when(reminderService.create("alice", "@remind something")).thenReturn(Optional.empty());

        ResponseEntity<?> response = controller.create(new CreateReminderRequest("alice", "@remind something"));

        assertThat(response.getStatusCode().value()).isEqualTo(422);
        assertThat(response.getBody()).isEqualTo(Map.of("error", ReminderMessages.PARSE_HELP));
        verifyNoInteractions(notifications);
    }

    @Test
    void createRejectsMissingFields() {
        assertThat(controller.create(new CreateReminderRequest(" ", "x")).getStatusCode().value()).isEqualTo(400);
        assertThat(controller.create(new CreateReminderRequest("alice", null)).getStatusCode().value()).isEqualTo(400);
        verifyNoInteractions(reminderService);
    }

    @Test
    void listReturnsActiveReminders() {
        when(reminderService.listActive("alice")).thenReturn(List.of(reminder("r1"), reminder("r2")));

        assertThat(controller.listActive("alice")).extracting(ReminderDto::id).containsExactly("r1", "r2");
    }

    @Test
    void getReturns404WhenMissing() {
        when(reminderService.find("nope")).thenReturn(Optional.empty());

        assertThat(controller.get("nope").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void deleteMapsTransitionToStatus() {
        when(lifecycle.cancelOne("r1")).thenReturn(new Transition(Transition.Status.APPLIED, reminder("r1")));
        when(lifecycle.cancelOne("nope")).thenReturn(Transition.notFound());

        assertThat(controller.delete("r1").getStatusCode().value()).isEqualTo(204);
        assertThat(controller.delete("nope").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void completeOfCompletedReminderIsConflict() {
        ReminderDocument done = reminder("r1");
        done.setCompleted(true);
        when(lifecycle.complete("r1")).thenReturn(new Transition(Transition.Status.ALREADY_COMPLETED, done));

        assertThat(controller.complete("r1").getStatusCode().value()).isEqualTo(409);
    }

    @Test
    void snoozeDefaultsToConfiguredMinutes() {
        when(lifecycle.snooze("r1", 10, NOW)).thenReturn(new Transition(Transition.Status.APPLIED, reminder("r1")));
        when(lifecycle.snooze("r1", 45, NOW)).thenReturn(new Transition(Transition.Status.APPLIED, reminder("r1")));

        assertThat(controller.snooze("r1", null).getStatusCode().value()).isEqualTo(200);
        assertThat(controller.snooze("r1", new SnoozeRequest(45)).getStatusCode().value()).isEqualTo(200);
    }

    @Test
    void unsavedChangeIsReportedAsServerError() {
        when(lifecycle.complete("r1")).thenReturn(new Transition(Transition.Status.APPLIED, reminder("r1"), true));
        when(lifecycle.cancelOne("r2")).thenReturn(new Transition(Transition.Status.APPLIED, reminder("r2"), true));

        ResponseEntity<ReminderDto> response = controller.complete("r1");

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().id()).isEqualTo("r1");
        assertThat(controller.delete("r2").getStatusCode().value()).isEqualTo(500);
    }
}
