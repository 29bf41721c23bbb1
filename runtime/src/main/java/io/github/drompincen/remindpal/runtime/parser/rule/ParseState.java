package io.github.drompincen.remindpal.runtime.parser.rule;

import io.github.drompincen.remindpal.protocol.api.RecurrencePattern;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable working state threaded through the time rules. {@code working} is the
 * candidate trigger time in the reference zone; the part sets record which
 * calendar and clock fields some rule has fixed so far.
 */
public record ParseState(
        LocalDateTime now,
        LocalDateTime working,
        RecurrencePattern pattern,
        Set<DatePart> dateParts,
        Set<TimePart> timeParts
) {
    public enum DatePart { YEAR, MONTH, DAY, WEEKDAY }

    public enum TimePart { HOUR, MINUTE }

    public static final LocalTime MORNING = LocalTime.of(9, 0);
    public static final LocalTime EVENING = LocalTime.of(20, 0);

    public ParseState {
        dateParts = Collections.unmodifiableSet(dateParts.isEmpty()
                ? EnumSet.noneOf(DatePart.class) : EnumSet.copyOf(dateParts));
        timeParts = Collections.unmodifiableSet(timeParts.isEmpty()
                ? EnumSet.noneOf(TimePart.class) : EnumSet.copyOf(timeParts));
    }

    public static ParseState initial(LocalDateTime now) {
        return new ParseState(now, now, null, Set.of(), Set.of());
    }

    public boolean recurring() {
        return pattern != null;
    }

    public boolean hasDate() {
        return !dateParts.isEmpty();
    }

    public boolean hasTime() {
        return !timeParts.isEmpty();
    }

    public LocalDate today() {
        return now.toLocalDate();
    }

    public ParseState withWorking(LocalDateTime newWorking) {
        return new ParseState(now, newWorking, pattern, dateParts, timeParts);
    }

    public ParseState withPattern(RecurrencePattern newPattern) {
        return new ParseState(now, working, newPattern, dateParts, timeParts);
    }

    public ParseState withDateParts(DatePart... parts) {
        EnumSet<DatePart> merged = dateParts.isEmpty() ? EnumSet.noneOf(DatePart.class) : EnumSet.copyOf(dateParts);
        Collections.addAll(merged, parts);
        return new ParseState(now, working, pattern, merged, timeParts);
    }

    public ParseState withTimeParts(TimePart... parts) {
        EnumSet<TimePart> merged = timeParts.isEmpty() ? EnumSet.noneOf(TimePart.class) : EnumSet.copyOf(timeParts);
        Collections.addAll(merged, parts);
        return new ParseState(now, working, pattern, dateParts, merged);
    }

    /** {@code date} at the working time of day, or at {@code fallback} when no rule has set a time yet. */
    public LocalDateTime onDate(LocalDate date, LocalTime fallback) {
        LocalTime time = hasTime() ? working.toLocalTime() : fallback;
        return LocalDateTime.of(date, time);
    }
}
