package io.github.drompincen.remindpal.protocol.api;

/** Raw button payload as delivered by the messaging channel, e.g. {@code snooze_reminder_<id>}. */
public record ActionRequest(String payload) {}
