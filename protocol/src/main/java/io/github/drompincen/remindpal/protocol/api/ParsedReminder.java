package io.github.drompincen.remindpal.protocol.api;

import java.time.Instant;

/**
 * Draft produced by the time-expression parser, before the store assigns an
 * id, an owner and the lifecycle flags.
 */
public record ParsedReminder(
        String message,
        String originalText,
        Instant triggerTime,
        boolean recurring,
        RecurrencePattern pattern
) {
    public String patternTag() {
        return pattern != null ? pattern.toTag() : null;
    }
}
