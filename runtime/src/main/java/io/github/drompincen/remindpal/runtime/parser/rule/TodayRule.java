package io.github.drompincen.remindpal.runtime.parser.rule;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * {@code today}: an explicit time wins; otherwise one hour from now, never
 * earlier than 09:00 on the same day.
 */
public class TodayRule extends RegexTimeRule {

    public TodayRule() {
        super(RuleGroup.DATE, "\\btoday\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        LocalDateTime candidate;
        if (state.hasTime()) {
            candidate = LocalDateTime.of(state.today(), state.working().toLocalTime());
        } else {
            candidate = state.now().plusHours(1).truncatedTo(ChronoUnit.MINUTES);
            if (candidate.toLocalDate().equals(state.today()) && candidate.toLocalTime().isBefore(ParseState.MORNING)) {
                candidate = LocalDateTime.of(state.today(), ParseState.MORNING);
            }
        }
        return Optional.of(state.withWorking(candidate).withDateParts(ParseState.DatePart.DAY));
    }
}
