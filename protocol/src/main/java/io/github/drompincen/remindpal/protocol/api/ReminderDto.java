package io.github.drompincen.remindpal.protocol.api;

import java.time.Instant;

public record ReminderDto(
        String id,
        String owner,
        String message,
        String originalText,
        Instant triggerTime,
        boolean recurring,
        String pattern,
        boolean active,
        boolean completed,
        boolean snoozed,
        Instant createdAt
) {}
