package io.github.drompincen.remindpal.protocol.api;

public record SnoozeRequest(Integer minutes) {}
