package io.github.drompincen.remindpal.runtime.reminder;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import io.github.drompincen.remindpal.protocol.api.ParsedReminder;
import io.github.drompincen.remindpal.protocol.api.ReminderAction;
import io.github.drompincen.remindpal.protocol.api.SessionState;
import io.github.drompincen.remindpal.runtime.notify.NotificationService;
import io.github.drompincen.remindpal.runtime.notify.ReminderMessages;
import io.github.drompincen.remindpal.runtime.recurrence.RecurrenceEngine;
import io.github.drompincen.remindpal.runtime.session.SessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderActionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-09T14:00:00Z");

    @TempDir
    Path dataDir;

    @Mock
    private NotificationService notifications;

    private ReminderStore store;
    private ReminderLifecycle lifecycle;
    private SessionRegistry sessions;
    private ReminderMessages messages;
    private ReminderActionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new ReminderStore(dataDir, clock);
        store.load();
        lifecycle = new ReminderLifecycle(store, new RecurrenceEngine(clock));
        sessions = new SessionRegistry(clock, 3_600_000);
        messages = new ReminderMessages(clock);
        service = new ReminderActionService(store, lifecycle, sessions, notifications, messages, clock, 10);
    }

    private ReminderDocument firedOneShot(String owner) {
        ReminderDocument r = store.create(owner,
                new ParsedReminder("stretch", "@remind stretch", NOW, false, null), NOW);
        lifecycle.fire(r.getId(), NOW);
        return r;
    }

    @Test
    void completedButtonCompletesTheReminder() {
        ReminderDocument r = firedOneShot("alice");

        String reply = service.handle("alice", ReminderAction.parse("completed_reminder_" + r.getId()));

        assertThat(reply).contains("Marked \"stretch\" as completed");
        assertThat(store.findById(r.getId()).orElseThrow().isCompleted()).isTrue();
        verify(notifications).sendText("alice", reply);
    }

    @Test
    void snoozeButtonUsesConfiguredMinutes() {
        ReminderDocument r = firedOneShot("alice");

        String reply = service.handle("alice", ReminderAction.snooze(r.getId()));

        assertThat(reply).startsWith("😴 Snoozed \"stretch\" for 10 minutes");
        assertThat(store.findById(r.getId()).orElseThrow().getTriggerTime())
                .isEqualTo(NOW.plus(10, ChronoUnit.MINUTES));
    }

    @Test
    void snoozingCompletedReminderIsRefused() {
        ReminderDocument r = firedOneShot("alice");
        lifecycle.complete(r.getId());

        String reply = service.handle("alice", ReminderAction.snooze(r.getId()));

        assertThat(reply).isEqualTo(messages.alreadyCompleted(store.findById(r.getId()).orElseThrow()));
        assertThat(store.findById(r.getId()).orElseThrow().isActive()).isFalse();
    }

    @Test
    void unknownOrForeignReminderIsNotFound() {
        ReminderDocument bobs = firedOneShot("bob");

        assertThat(service.handle("alice", ReminderAction.completed("nope"))).isEqualTo(messages.notFound());
        assertThat(service.handle("alice", ReminderAction.completed(bobs.getId()))).isEqualTo(messages.notFound());
        assertThat(store.findById(bobs.getId()).orElseThrow().isCompleted()).isFalse();
    }

    @Test
    void cancellationFlowConfirmsAndResetsSession() {
        store.create("alice", new ParsedReminder("a", "a", NOW.plus(1, ChronoUnit.HOURS), false, null), NOW);
        store.create("alice", new ParsedReminder("b", "b", NOW.plus(2, ChronoUnit.HOURS), false, null), NOW);

        String prompt = service.startCancellation("alice");

        assertThat(prompt).isEqualTo(messages.cancelPrompt(2));
        assertThat(sessions.stateOf("alice")).isEqualTo(SessionState.AWAITING_CANCEL_CONFIRMATION);
        verify(notifications).sendChoice("alice", prompt, messages.cancelOptions());

        String reply = service.handle("alice", ReminderAction.confirmCancelAll());

        assertThat(reply).isEqualTo(messages.cancelledAll(2));
        assertThat(store.listActiveByOwner("alice")).isEmpty();
        assertThat(sessions.stateOf("alice")).isEqualTo(SessionState.IDLE);
    }

    @Test
    void declineKeepsReminders() {
        store.create("alice", new ParsedReminder("a", "a", NOW.plus(1, ChronoUnit.HOURS), false, null), NOW);
        service.startCancellation("alice");

        assertThat(service.handle("alice", ReminderAction.declineCancelAll())).isEqualTo(messages.keptAll());
        assertThat(store.listActiveByOwner("alice")).hasSize(1);
        assertThat(sessions.stateOf("alice")).isEqualTo(SessionState.IDLE);
    }

    @Test
    void startCancellationWithNothingActiveStaysIdle() {
        assertThat(service.startCancellation("alice")).isEqualTo(messages.nothingToCancel());
        assertThat(sessions.stateOf("alice")).isEqualTo(SessionState.IDLE);
        verify(notifications, never()).sendChoice(anyString(), anyString(), anyList());
        verify(notifications).sendText(eq("alice"), anyString());
    }
}
