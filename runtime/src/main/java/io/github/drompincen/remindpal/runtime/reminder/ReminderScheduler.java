package io.github.drompincen.remindpal.runtime.reminder;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import io.github.drompincen.remindpal.runtime.notify.NotificationService;
import io.github.drompincen.remindpal.runtime.notify.ReminderMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Component
public class ReminderScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    private final ReminderStore store;
    private final ReminderLifecycle lifecycle;
    private final NotificationService notifications;
    private final ReminderMessages messages;
    private final Clock clock;
    private final int snoozeMinutes;

    public ReminderScheduler(ReminderStore store, ReminderLifecycle lifecycle,
                             NotificationService notifications, ReminderMessages messages, Clock clock,
                             @Value("${remindpal.reminders.snooze-minutes:10}") int snoozeMinutes) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.notifications = notifications;
        this.messages = messages;
        this.clock = clock;
        this.snoozeMinutes = snoozeMinutes;
    }

    @Scheduled(fixedDelayString = "${remindpal.scheduler.tick-interval-ms:60000}",
            initialDelayString = "${remindpal.scheduler.initial-delay-ms:5000}")
    public void checkReminders() {
        tick(clock.instant());
    }

    /**
     * Fires every reminder due at {@code now} and saves once if anything changed.
     *
     * @return the number of reminders fired
     */
    public synchronized int tick(Instant now) {
        int fired = 0;
        boolean changed = false;

        for (ReminderDocument due : store.snapshot()) {
            if (!due.isActive() || due.getTriggerTime() == null || due.getTriggerTime().isAfter(now)) {
                continue;
            }
            try {
                Optional<ReminderDocument> live = store.findById(due.getId());
                if (live.isEmpty() || !live.get().isActive()) {
                    log.debug("Reminder {} no longer active, skipping", due.getId());
                    continue;
                }

                ReminderDocument reminder = live.get();
                if (!notifications.sendChoice(reminder.getOwner(), messages.alert(reminder),
                        messages.alertOptions(reminder, snoozeMinutes))) {
                    log.warn("Could not deliver reminder {} to {}", reminder.getId(), reminder.getOwner());
                }

                Transition t = lifecycle.fire(reminder.getId(), now);
                if (t.changed()) {
                    changed = true;
                    fired++;
                    log.info("Triggered reminder {} for {} ({})", reminder.getId(), reminder.getOwner(), t.status());
                }
            } catch (Exception e) {
                log.error("Failed to trigger reminder {}", due.getId(), e);
            }
        }

        if (changed && !store.save()) {
            log.error("Tick changes kept in memory only, save failed");
        }
        return fired;
    }
}
