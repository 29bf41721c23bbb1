package io.github.drompincen.remindpal.runtime.reminder;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import io.github.drompincen.remindpal.protocol.api.ChoiceOption;
import io.github.drompincen.remindpal.protocol.api.ParsedReminder;
import io.github.drompincen.remindpal.protocol.api.RecurrencePattern;
import io.github.drompincen.remindpal.runtime.notify.NotificationService;
import io.github.drompincen.remindpal.runtime.notify.Notifier;
import io.github.drompincen.remindpal.runtime.notify.ReminderMessages;
import io.github.drompincen.remindpal.runtime.recurrence.RecurrenceEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReminderSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-09T14:00:00Z");

    @TempDir
    Path dataDir;

    @Mock
    private Notifier notifier;

    @Captor
    private ArgumentCaptor<List<ChoiceOption>> options;

    private Clock clock;
    private ReminderStore store;
    private ReminderLifecycle lifecycle;
    private NotificationService notifications;
    private ReminderScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new ReminderStore(dataDir, clock);
        store.load();
        lifecycle = new ReminderLifecycle(store, new RecurrenceEngine(clock));
        notifications = new NotificationService(notifier, 2000);
        scheduler = new ReminderScheduler(store, lifecycle, notifications, new ReminderMessages(clock), clock, 10);
    }

    @AfterEach
    void tearDown() {
        notifications.shutdown();
    }

    private ReminderDocument oneShot(String owner, String message, Instant trigger) {
        return store.create(owner, new ParsedReminder(message, "@remind " + message, trigger, false, null), NOW);
    }

    @Test
    void firesDueOneShotExactlyOnce() {
        ReminderDocument r = oneShot("alice", "stretch", NOW.minus(1, ChronoUnit.MINUTES));
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenReturn(true);

        assertThat(scheduler.tick(NOW)).isEqualTo(1);
        assertThat(scheduler.tick(NOW.plus(1, ChronoUnit.MINUTES))).isZero();

        verify(notifier, times(1)).sendChoice(eq("alice"), anyString(), options.capture());
        assertThat(options.getValue()).extracting(ChoiceOption::id)
                .containsExactly("completed_reminder_" + r.getId(), "snooze_reminder_" + r.getId());
        assertThat(store.findById(r.getId()).orElseThrow().isActive()).isFalse();
    }

    @Test
    void futureRemindersAreNotFired() {
        oneShot("alice", "later", NOW.plus(5, ChronoUnit.MINUTES));

        assertThat(scheduler.tick(NOW)).isZero();

        verifyNoInteractions(notifier);
    }

    @Test
    void completedReminderIsNeverTouchedAgain() {
        ReminderDocument r = oneShot("alice", "stretch", NOW);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenReturn(true);
        scheduler.tick(NOW);
        lifecycle.complete(r.getId());
        ReminderDocument afterComplete = store.findById(r.getId()).orElseThrow();

        scheduler.tick(NOW.plus(1, ChronoUnit.HOURS));
        scheduler.tick(NOW.plus(2, ChronoUnit.DAYS));

        verify(notifier, times(1)).sendChoice(anyString(), anyString(), anyList());
        assertThat(store.findById(r.getId()).orElseThrow())
                .usingRecursiveComparison().isEqualTo(afterComplete);
    }

    @Test
    void snoozeAllowsExactlyOneMoreFiring() {
        ReminderDocument r = oneShot("alice", "stretch", NOW);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenReturn(true);
        scheduler.tick(NOW);

        Instant snoozedAt = NOW.plus(2, ChronoUnit.MINUTES);
        lifecycle.snooze(r.getId(), 10, snoozedAt);
        Instant dueAgain = snoozedAt.plus(10, ChronoUnit.MINUTES);
        assertThat(store.findById(r.getId()).orElseThrow().getTriggerTime()).isEqualTo(dueAgain);

        assertThat(scheduler.tick(dueAgain.minusSeconds(1))).isZero();
        assertThat(scheduler.tick(dueAgain)).isEqualTo(1);
        assertThat(scheduler.tick(dueAgain.plus(1, ChronoUnit.HOURS))).isZero();

        verify(notifier, times(2)).sendChoice(eq("alice"), anyString(), anyList());
    }

    @Test
    void recurringReminderIsRescheduled() {
        ReminderDocument r = store.create("alice",
                new ParsedReminder("pills", "@remind pills every day at 9am", Instant.parse("2026-03-09T09:00:00Z"),
                        true, RecurrencePattern.daily()), NOW);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenReturn(true);

        assertThat(scheduler.tick(NOW)).isEqualTo(1);

        ReminderDocument live = store.findById(r.getId()).orElseThrow();
        assertThat(live.isActive()).isTrue();
        assertThat(live.getTriggerTime()).isEqualTo(Instant.parse("2026-03-10T09:00:00Z"));
        assertThat(scheduler.tick(NOW.plus(1, ChronoUnit.HOURS))).isZero();
    }

    @Test
    void deliveryFailureDoesNotStopTheTick() {
        ReminderDocument alices = oneShot("alice", "stretch", NOW);
        ReminderDocument bobs = oneShot("bob", "walk", NOW);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenThrow(new IllegalStateException("down"));
        when(notifier.sendChoice(eq("bob"), anyString(), anyList())).thenReturn(true);

        assertThat(scheduler.tick(NOW)).isEqualTo(2);

        verify(notifier).sendText(eq("alice"), contains("(Option ID: completed_reminder_" + alices.getId() + ")"));
        assertThat(store.findById(bobs.getId()).orElseThrow().isActive()).isFalse();
    }

    @Test
    void reminderCancelledMidTickIsSkipped() {
        ReminderDocument first = oneShot("alice", "stretch", NOW);
        ReminderDocument second = oneShot("alice", "walk", NOW);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenAnswer(inv -> {
            lifecycle.cancelOne(second.getId());
            return true;
        });

        assertThat(scheduler.tick(NOW)).isEqualTo(1);

        verify(notifier, times(1)).sendChoice(anyString(), anyString(), anyList());
        assertThat(store.findById(first.getId()).orElseThrow().isActive()).isFalse();
        assertThat(store.findById(second.getId())).isEmpty();
    }

    @Test
    void snoozeDuringDeliveryKeepsTheReminderScheduled() {
        ReminderDocument r = oneShot("alice", "stretch", NOW);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenAnswer(inv -> {
            lifecycle.snooze(r.getId(), 10, NOW);
            return true;
        });

        assertThat(scheduler.tick(NOW)).isZero();

        ReminderDocument live = store.findById(r.getId()).orElseThrow();
        assertThat(live.isActive()).isTrue();
        assertThat(live.isSnoozed()).isTrue();
        assertThat(live.getTriggerTime()).isEqualTo(NOW.plus(10, ChronoUnit.MINUTES));
        assertThat(store.findProfile("alice").orElseThrow().getActiveReminders()).isEqualTo(1);

        reset(notifier);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenReturn(true);
        assertThat(scheduler.tick(NOW.plus(11, ChronoUnit.MINUTES))).isEqualTo(1);
        assertThat(store.findById(r.getId()).orElseThrow().isActive()).isFalse();
    }

    @Test
    void tickChangesAreSavedOnce() {
        ReminderDocument r = oneShot("alice", "stretch", NOW);
        when(notifier.sendChoice(eq("alice"), anyString(), anyList())).thenReturn(true);

        scheduler.tick(NOW);

        ReminderStore reloaded = new ReminderStore(dataDir, clock);
        reloaded.load();
        assertThat(reloaded.findById(r.getId()).orElseThrow().isActive()).isFalse();
        assertThat(reloaded.findProfile("alice").orElseThrow().getActiveReminders()).isZero();
    }
}
