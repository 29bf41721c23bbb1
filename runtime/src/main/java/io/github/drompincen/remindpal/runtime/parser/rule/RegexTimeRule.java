package io.github.drompincen.remindpal.runtime.parser.rule;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for rules driven by a single case-insensitive regular expression. Only
 * the first occurrence in the text is considered.
 */
public abstract class RegexTimeRule implements TimeRule {

    private final RuleGroup group;
    private final Pattern pattern;

    protected RegexTimeRule(RuleGroup group, String regex) {
        this.group = group;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public RuleGroup group() {
        return group;
    }

    @Override
    public Optional<RuleMatch> apply(String text, ParseState state) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return resolve(m, state).map(next -> new RuleMatch(m.group(), next));
    }

    /**
     * Computes the next state from a successful match. Returning empty rejects
     * the match, e.g. for an impossible calendar date.
     */
    protected abstract Optional<ParseState> resolve(Matcher m, ParseState state);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + pattern.pattern() + "]";
    }
}
