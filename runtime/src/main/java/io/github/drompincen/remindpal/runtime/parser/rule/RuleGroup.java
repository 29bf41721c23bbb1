package io.github.drompincen.remindpal.runtime.parser.rule;

/** Rule groups, in the order the parser applies them. */
public enum RuleGroup {
    RECURRENCE,
    DATE,
    TIME
}
