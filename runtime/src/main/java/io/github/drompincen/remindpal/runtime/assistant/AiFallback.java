package io.github.drompincen.remindpal.runtime.assistant;

/**
 * Answers free text that is not a command. Implementations may call a remote
 * model and may block; {@link AssistantService} bounds the call.
 */
public interface AiFallback {

    String answer(String text, AssistantContext context);
}
