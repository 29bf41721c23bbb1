package io.github.drompincen.remindpal.protocol.api;

import java.util.Locale;

/**
 * Acknowledgement sent back from an interactive prompt.
 *
 * <p>The wire form is {@code <action>_<targetType>_<identifier>}, for example
 * {@code completed_reminder_3f2a...} or {@code confirm_cancellation_all}. The
 * identifier may itself contain underscores.
 */
public record ReminderAction(Action action, TargetType targetType, String identifier) {

    public static final String ALL = "all";

    public enum Action {
        COMPLETED, SNOOZE, CONFIRM, DECLINE
    }

    public enum TargetType {
        REMINDER, CANCELLATION
    }

    public ReminderAction {
        if (action == null || targetType == null || identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("action, targetType and identifier are required");
        }
        boolean valid = switch (targetType) {
            case REMINDER -> action == Action.COMPLETED || action == Action.SNOOZE;
            case CANCELLATION -> (action == Action.CONFIRM || action == Action.DECLINE) && ALL.equals(identifier);
        };
        if (!valid) {
            throw new IllegalArgumentException("Unsupported action " + action + " for " + targetType
                    + " '" + identifier + "'");
        }
    }

    public static ReminderAction completed(String reminderId) {
        return new ReminderAction(Action.COMPLETED, TargetType.REMINDER, reminderId);
    }

    public static ReminderAction snooze(String reminderId) {
        return new ReminderAction(Action.SNOOZE, TargetType.REMINDER, reminderId);
    }

    public static ReminderAction confirmCancelAll() {
        return new ReminderAction(Action.CONFIRM, TargetType.CANCELLATION, ALL);
    }

    public static ReminderAction declineCancelAll() {
        return new ReminderAction(Action.DECLINE, TargetType.CANCELLATION, ALL);
    }

    /**
     * Parses a wire payload.
     *
     * @throws IllegalArgumentException if the payload is malformed or names an unknown combination
     */
    public static ReminderAction parse(String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Action payload is required");
        }
        String[] parts = payload.trim().split("_", 3);
        if (parts.length < 3) {
            throw new IllegalArgumentException("Malformed action payload: " + payload);
        }
        try {
            Action action = Action.valueOf(parts[0].toUpperCase(Locale.ROOT));
            TargetType target = TargetType.valueOf(parts[1].toUpperCase(Locale.ROOT));
            return new ReminderAction(action, target, parts[2]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unrecognized action payload: " + payload, e);
        }
    }

    public String toPayload() {
        return action.name().toLowerCase(Locale.ROOT) + "_"
                + targetType.name().toLowerCase(Locale.ROOT) + "_" + identifier;
    }
}
