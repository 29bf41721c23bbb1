package io.github.drompincen.remindpal.runtime.parser.rule;

import io.github.drompincen.remindpal.protocol.api.RecurrencePattern;

import java.util.Optional;
import java.util.regex.Matcher;

/** {@code every day}, {@code daily}. */
public class DailyRule extends RegexTimeRule {

    public DailyRule() {
        super(RuleGroup.RECURRENCE, "\\b(?:every\\s+day|daily)\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        return Optional.of(state
                .withPattern(RecurrencePattern.daily())
                .withWorking(state.onDate(state.working().toLocalDate(), ParseState.MORNING)));
    }
}
