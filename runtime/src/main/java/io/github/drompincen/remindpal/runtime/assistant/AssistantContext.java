package io.github.drompincen.remindpal.runtime.assistant;

/** What the answerer knows about the person asking. */
public record AssistantContext(String owner, int activeReminders, int totalReminders) {}
