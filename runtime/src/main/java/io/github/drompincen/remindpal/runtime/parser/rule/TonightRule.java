package io.github.drompincen.remindpal.runtime.parser.rule;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Matcher;

/** {@code tonight}: today at 20:00 unless a time is set, the next day once that has passed. */
public class TonightRule extends RegexTimeRule {

    public TonightRule() {
        super(RuleGroup.DATE, "\\btonight\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        LocalDateTime candidate = state.onDate(state.today(), ParseState.EVENING);
        if (!candidate.isAfter(state.now())) {
            candidate = candidate.plusDays(1);
        }
        return Optional.of(state.withWorking(candidate).withDateParts(ParseState.DatePart.DAY));
    }
}
