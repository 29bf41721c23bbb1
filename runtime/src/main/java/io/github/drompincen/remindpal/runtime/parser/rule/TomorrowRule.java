package io.github.drompincen.remindpal.runtime.parser.rule;

import java.util.Optional;
import java.util.regex.Matcher;

public class TomorrowRule extends RegexTimeRule {

    public TomorrowRule() {
        super(RuleGroup.DATE, "\\btomorrow\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        return Optional.of(state
                .withWorking(state.onDate(state.today().plusDays(1), ParseState.MORNING))
                .withDateParts(ParseState.DatePart.DAY));
    }
}
