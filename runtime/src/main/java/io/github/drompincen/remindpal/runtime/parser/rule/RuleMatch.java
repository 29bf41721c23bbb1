package io.github.drompincen.remindpal.runtime.parser.rule;

/**
 * @param phrase the matched text, removed from the reminder message afterwards
 * @param state  the state after the rule was applied
 */
public record RuleMatch(String phrase, ParseState state) {
}
