package io.github.drompincen.remindpal.runtime.parser.rule;

import java.util.Optional;

/**
 * One recognizer of a time expression. Implementations are stateless: the
 * result depends only on the text and the incoming state.
 */
public interface TimeRule {

    RuleGroup group();

    Optional<RuleMatch> apply(String text, ParseState state);
}
