package io.github.drompincen.remindpal.runtime.recurrence;

import io.github.drompincen.remindpal.protocol.api.RecurrencePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the next occurrence of a recurring reminder.
 *
 * <p>Calendar steps are taken in the reference zone of the injected clock, so a
 * daily reminder keeps its wall-clock time across DST changes. An empty result
 * means the reminder must be deactivated.
 */
@Service
public class RecurrenceEngine {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceEngine.class);

    private final ZoneId zone;

    public RecurrenceEngine(Clock clock) {
        this.zone = clock.getZone();
    }

    public Optional<Instant> advance(String patternTag, Instant currentTrigger, Instant now) {
        Optional<RecurrencePattern> pattern = RecurrencePattern.fromTag(patternTag);
        if (pattern.isEmpty()) {
            log.warn("Unknown recurring pattern '{}'", patternTag);
            return Optional.empty();
        }
        return advance(pattern.get(), currentTrigger, now);
    }

    /**
     * Steps at least once from {@code currentTrigger}, then keeps stepping until
     * the result is strictly after {@code now}.
     */
    public Optional<Instant> advance(RecurrencePattern pattern, Instant currentTrigger, Instant now) {
        ZonedDateTime current = currentTrigger.atZone(zone);
        int targetDay = pattern.dayOfMonth() != null ? pattern.dayOfMonth() : current.getDayOfMonth();

        long maxSteps = maxSteps(pattern, currentTrigger, now);
        ZonedDateTime next = step(pattern, current, targetDay);
        long steps = 1;
        while (!next.toInstant().isAfter(now)) {
            if (steps >= maxSteps) {
                log.warn("Gave up advancing {} from {} after {} steps", pattern.toTag(), currentTrigger, steps);
                return Optional.empty();
            }
            next = step(pattern, next, targetDay);
            steps++;
        }
        return Optional.of(next.toInstant());
    }

    private ZonedDateTime step(RecurrencePattern pattern, ZonedDateTime from, int targetDay) {
        return switch (pattern.cadence()) {
            case DAILY -> from.plusDays(1);
            case WEEKLY -> from.plusDays(7);
            case MONTHLY -> {
                YearMonth month = YearMonth.from(from).plusMonths(1);
                int day = Math.min(targetDay, month.lengthOfMonth());
                yield ZonedDateTime.of(month.atDay(day), from.toLocalTime(), zone);
            }
        };
    }

    // Upper bound on steps: one per elapsed cadence period plus slack.
    private long maxSteps(RecurrencePattern pattern, Instant currentTrigger, Instant now) {
        long cadenceDays = switch (pattern.cadence()) {
            case DAILY -> 1;
            case WEEKLY -> 7;
            case MONTHLY -> 28;
        };
        long elapsedDays = Math.max(0, Duration.between(currentTrigger, now).toDays());
        return elapsedDays / cadenceDays + 2;
    }
}
