package io.github.drompincen.remindpal.runtime.reminder;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;

/**
 * Outcome of a lifecycle operation. {@code reminder} is a copy of the record
 * after the operation, or {@code null} when it was not found. {@code saveFailed}
 * is set when the change was applied in memory but could not be written.
 */
public record Transition(Status status, ReminderDocument reminder, boolean saveFailed) {

    public Transition(Status status, ReminderDocument reminder) {
        this(status, reminder, false);
    }

    public enum Status {
        /** The requested change was made. */
        APPLIED,
        /** A recurring reminder fired and moved to its next occurrence. */
        RESCHEDULED,
        /** A recurring reminder fired but has no next occurrence and was switched off. */
        DEACTIVATED,
        /** The reminder exists but was not active or not yet due, nothing to fire. */
        SKIPPED,
        NOT_FOUND,
        /** Completed already, or the current occurrence of a recurring reminder was already acknowledged. */
        ALREADY_COMPLETED
    }

    public static Transition notFound() {
        return new Transition(Status.NOT_FOUND, null);
    }

    Transition withSaveFailed() {
        return new Transition(status, reminder, true);
    }

    /** Whether the stored state was modified. */
    public boolean changed() {
        return status == Status.APPLIED || status == Status.RESCHEDULED || status == Status.DEACTIVATED;
    }
}
