package io.github.drompincen.remindpal.runtime.parser.rule;

import io.github.drompincen.remindpal.protocol.api.RecurrencePattern;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * {@code every month [on the N(st|nd|rd|th)]}. Without a day the current day of
 * the month is kept. The day is clamped to the length of the current month but
 * recorded unclamped in the pattern.
 */
public class MonthlyRule extends RegexTimeRule {

    public MonthlyRule() {
        super(RuleGroup.RECURRENCE, "\\bevery\\s+month(?:\\s+on\\s+the\\s+(\\d{1,2})(?:st|nd|rd|th)?)?\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        int day = m.group(1) != null ? Integer.parseInt(m.group(1)) : state.working().getDayOfMonth();
        if (day < 1 || day > 31) {
            return Optional.empty();
        }
        YearMonth month = YearMonth.from(state.working());
        LocalDate date = month.atDay(Math.min(day, month.lengthOfMonth()));
        return Optional.of(state
                .withPattern(RecurrencePattern.monthly(day))
                .withWorking(state.onDate(date, ParseState.MORNING))
                .withDateParts(ParseState.DatePart.DAY));
    }
}
