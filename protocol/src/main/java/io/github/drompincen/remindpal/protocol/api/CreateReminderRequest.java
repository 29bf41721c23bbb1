package io.github.drompincen.remindpal.protocol.api;

public record CreateReminderRequest(
        String owner,
        String text
) {}
