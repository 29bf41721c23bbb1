package io.github.drompincen.remindpal.runtime.parser.rule;

import io.github.drompincen.remindpal.protocol.api.RecurrencePattern;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * {@code every <weekday>}, {@code weekly}. Moves to the next occurrence of the
 * weekday; a bare {@code weekly} keeps the current weekday.
 */
public class WeeklyRule extends RegexTimeRule {

    public WeeklyRule() {
        super(RuleGroup.RECURRENCE,
                "\\b(?:every\\s+(monday|tuesday|wednesday|thursday|friday|saturday|sunday)|weekly)\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        DayOfWeek target = m.group(1) != null
                ? DayOfWeek.valueOf(m.group(1).toUpperCase(Locale.ROOT))
                : state.working().getDayOfWeek();

        LocalDateTime candidate = state.onDate(state.working().toLocalDate(), ParseState.MORNING);
        int days = (target.getValue() - candidate.getDayOfWeek().getValue() + 7) % 7;
        if (days == 0 && !candidate.isAfter(state.now())) {
            days = 7;
        }
        return Optional.of(state
                .withPattern(RecurrencePattern.weekly(target))
                .withWorking(candidate.plusDays(days))
                .withDateParts(ParseState.DatePart.WEEKDAY));
    }
}
