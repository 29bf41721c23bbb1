package io.github.drompincen.remindpal.runtime.notify;

import io.github.drompincen.remindpal.protocol.api.ChoiceOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/** Writes every delivery to the log. Used when no real channel is configured. */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public boolean sendText(String owner, String text) {
        log.info("[to {}] {}", owner, text);
        return true;
    }

    @Override
    public boolean sendChoice(String owner, String text, List<ChoiceOption> options) {
        String choices = options.stream()
                .map(o -> o.label() + " -> " + o.id())
                .collect(Collectors.joining(", "));
        log.info("[to {}] {} [{}]", owner, text, choices);
        return true;
    }
}
