package io.github.drompincen.remindpal.runtime.notify;

import io.github.drompincen.remindpal.protocol.api.ChoiceOption;

import java.util.List;

/**
 * Outbound delivery channel. Implementations report failure by returning
 * {@code false}; they may also throw, which callers treat the same way.
 */
public interface Notifier {

    boolean sendText(String owner, String text);

    boolean sendChoice(String owner, String text, List<ChoiceOption> options);
}
