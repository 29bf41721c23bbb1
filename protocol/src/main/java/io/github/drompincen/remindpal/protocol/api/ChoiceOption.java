package io.github.drompincen.remindpal.protocol.api;

/** One selectable reply of an interactive prompt. The id travels back as the action payload. */
public record ChoiceOption(String id, String label) {}
