package io.github.drompincen.remindpal.protocol.api;

public record AskRequest(
        String owner,
        String text
) {}
