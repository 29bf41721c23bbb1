package io.github.drompincen.remindpal.protocol.api;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Optional;

/**
 * Cadence rule of a recurring reminder.
 *
 * <p>Persisted as a compact tag: {@code daily}, {@code weekly_monday},
 * {@code monthly} or {@code monthly_31}. Tags that do not parse are kept as raw
 * strings on the reminder and surface as an empty {@link #fromTag(String)}.
 */
public record RecurrencePattern(Cadence cadence, DayOfWeek weekday, Integer dayOfMonth) {

    public enum Cadence {
        DAILY, WEEKLY, MONTHLY
    }

    public RecurrencePattern {
        if (cadence == null) {
            throw new IllegalArgumentException("cadence is required");
        }
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new IllegalArgumentException("dayOfMonth out of range: " + dayOfMonth);
        }
    }

    public static RecurrencePattern daily() {
        return new RecurrencePattern(Cadence.DAILY, null, null);
    }

    public static RecurrencePattern weekly(DayOfWeek weekday) {
        return new RecurrencePattern(Cadence.WEEKLY, weekday, null);
    }

    public static RecurrencePattern monthly(Integer dayOfMonth) {
        return new RecurrencePattern(Cadence.MONTHLY, null, dayOfMonth);
    }

    public String toTag() {
        String base = cadence.name().toLowerCase(Locale.ROOT);
        return switch (cadence) {
            case DAILY -> base;
            case WEEKLY -> weekday != null ? base + "_" + weekday.name().toLowerCase(Locale.ROOT) : base;
            case MONTHLY -> dayOfMonth != null ? base + "_" + dayOfMonth : base;
        };
    }

    public static Optional<RecurrencePattern> fromTag(String tag) {
        if (tag == null || tag.isBlank()) return Optional.empty();

        String[] parts = tag.trim().toLowerCase(Locale.ROOT).split("_", 2);
        String suffix = parts.length > 1 ? parts[1] : null;
        try {
            return switch (parts[0]) {
                case "daily" -> suffix == null ? Optional.of(daily()) : Optional.empty();
                case "weekly" -> Optional.of(weekly(
                        suffix == null ? null : DayOfWeek.valueOf(suffix.toUpperCase(Locale.ROOT))));
                case "monthly" -> Optional.of(monthly(suffix == null ? null : Integer.parseInt(suffix)));
                default -> Optional.empty();
            };
        } catch (IllegalArgumentException e) {
            // covers NumberFormatException and unknown weekday names
            return Optional.empty();
        }
    }

    /** Human-readable form used in confirmations, e.g. "weekly monday". */
    public String describe() {
        return toTag().replace('_', ' ');
    }
}
