package io.github.drompincen.remindpal.runtime.reminder;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import io.github.drompincen.remindpal.runtime.recurrence.RecurrenceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * State transitions of a reminder: fire, complete, snooze and cancel.
 *
 * <p>Every transition re-reads the live record by id inside the store lock, so
 * a stale copy taken earlier (for example by a scheduler snapshot) is never
 * written back. Owner counters are adjusted in the same critical section.
 * All operations except {@link #fire} save the store before returning.
 */
@Service
public class ReminderLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ReminderLifecycle.class);

    private final ReminderStore store;
    private final RecurrenceEngine recurrence;

    public ReminderLifecycle(ReminderStore store, RecurrenceEngine recurrence) {
        this.store = store;
        this.recurrence = recurrence;
    }

    /**
     * Marks a due reminder as fired. One-shot reminders become inactive and wait
     * for an acknowledgement; recurring ones move to their next occurrence.
     * A reminder whose trigger moved past {@code now} in the meantime is skipped.
     * Does not save; the caller batches.
     */
    public Transition fire(String id, Instant now) {
        return store.update(id, live -> {
            if (!live.isActive() || live.getTriggerTime() == null || live.getTriggerTime().isAfter(now)) {
                return new Transition(Transition.Status.SKIPPED, live.copy());
            }
            if (!live.isRecurring()) {
                live.setActive(false);
                adjustActive(live.getOwner(), -1);
                return new Transition(Transition.Status.APPLIED, live.copy());
            }

            Optional<Instant> next = recurrence.advance(live.getPattern(), live.getTriggerTime(), now);
            if (next.isEmpty()) {
                log.warn("Deactivating recurring reminder {} with pattern '{}'", live.getId(), live.getPattern());
                live.setActive(false);
                live.setAcknowledgementPending(true);
                adjustActive(live.getOwner(), -1);
                return new Transition(Transition.Status.DEACTIVATED, live.copy());
            }
            live.setTriggerTime(next.get());
            live.setSnoozed(false);
            live.setAcknowledgementPending(true);
            return new Transition(Transition.Status.RESCHEDULED, live.copy());
        }).orElseGet(Transition::notFound);
    }

    /**
     * Acknowledges a reminder as done. For a recurring reminder only the
     * owner's completed counter moves, once per fired occurrence; the schedule
     * is left alone.
     */
    public Transition complete(String id) {
        Transition result = store.update(id, live -> {
            if (live.isRecurring()) {
                if (!live.isAcknowledgementPending()) {
                    return new Transition(Transition.Status.ALREADY_COMPLETED, live.copy());
                }
                live.setAcknowledgementPending(false);
                store.updateProfile(live.getOwner(), p -> p.setCompletedReminders(p.getCompletedReminders() + 1));
                return new Transition(Transition.Status.APPLIED, live.copy());
            }
            if (live.isCompleted()) {
                return new Transition(Transition.Status.ALREADY_COMPLETED, live.copy());
            }
            boolean wasActive = live.isActive();
            live.setCompleted(true);
            live.setActive(false);
            store.updateProfile(live.getOwner(), p -> {
                p.setCompletedReminders(p.getCompletedReminders() + 1);
                if (wasActive) p.adjustActiveReminders(-1);
            });
            return new Transition(Transition.Status.APPLIED, live.copy());
        }).orElseGet(Transition::notFound);

        return saveIfChanged(result);
    }

    /**
     * Pushes the reminder {@code minutes} past {@code now} and makes it active
     * again. Completed reminders cannot be snoozed.
     */
    public Transition snooze(String id, int minutes, Instant now) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Snooze minutes must be positive: " + minutes);
        }
        Transition result = store.update(id, live -> {
            if (live.isCompleted()) {
                return new Transition(Transition.Status.ALREADY_COMPLETED, live.copy());
            }
            boolean wasActive = live.isActive();
            live.setTriggerTime(now.plus(Duration.ofMinutes(minutes)));
            live.setSnoozed(true);
            live.setActive(true);
            if (!wasActive) {
                adjustActive(live.getOwner(), 1);
            }
            return new Transition(Transition.Status.APPLIED, live.copy());
        }).orElseGet(Transition::notFound);

        return saveIfChanged(result);
    }

    public Transition cancelOne(String id) {
        Optional<ReminderDocument> removed = store.cancelById(id);
        if (removed.isEmpty()) {
            return Transition.notFound();
        }
        ReminderDocument reminder = removed.get();
        if (reminder.isActive()) {
            adjustActive(reminder.getOwner(), -1);
        }
        log.info("Cancelled reminder {} of {}", id, reminder.getOwner());
        return saveIfChanged(new Transition(Transition.Status.APPLIED, reminder.copy()));
    }

    /** Removes every active reminder of the owner. */
    public List<ReminderDocument> cancelAll(String owner) {
        List<ReminderDocument> removed = store.cancelAllByOwner(owner);
        if (!removed.isEmpty()) {
            adjustActive(owner, -removed.size());
            if (!store.save()) {
                log.error("Cancellation of {} reminders of {} kept in memory only, save failed", removed.size(), owner);
            }
            log.info("Cancelled {} active reminders of {}", removed.size(), owner);
        }
        return removed.stream().map(ReminderDocument::copy).toList();
    }

    private void adjustActive(String owner, int delta) {
        store.updateProfile(owner, p -> p.adjustActiveReminders(delta));
    }

    private Transition saveIfChanged(Transition result) {
        if (!result.changed() || store.save()) {
            return result;
        }
        log.error("Reminder {} changed in memory only, save failed", result.reminder().getId());
        return result.withSaveFailed();
    }
}
