package io.github.drompincen.remindpal.protocol.api;

import java.time.Instant;

public record UserStatsDto(
        String owner,
        Instant joinedAt,
        int totalReminders,
        int activeReminders,
        int completedReminders,
        int completionRatePercent
) {}
