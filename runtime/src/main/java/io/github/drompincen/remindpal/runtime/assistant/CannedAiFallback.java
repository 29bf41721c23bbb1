package io.github.drompincen.remindpal.runtime.assistant;

import java.util.List;
import java.util.Locale;

/** Keyword-matched replies, used when no model is configured or the model fails. */
public class CannedAiFallback implements AiFallback {

    private static final List<String> GREETINGS = List.of("hello", "hi", "hey", "good morning", "good evening");

    static final String GREETING = "Hello! How can I assist you today? Try \"help\" for commands.";
    static final String THANKS = "You're welcome! 😊";
    static final String BYE = "Goodbye! 👋";
    static final String HINT =
            "I can help set reminders or answer simple questions. Try 'remind me to call Mom tomorrow' or ask 'help'.";

    @Override
    public String answer(String text, AssistantContext context) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        if (GREETINGS.stream().anyMatch(lower::contains)) return GREETING;
        if (lower.contains("thank")) return THANKS;
        if (lower.contains("bye")) return BYE;
        return HINT;
    }
}
