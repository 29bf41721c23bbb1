package io.github.drompincen.remindpal.runtime.parser.rule;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Absolute dates, either month first ({@code July 4th, 2027}) or day first
 * ({@code 4th of July}). Without a year, a date whose morning has already
 * passed means next year.
 */
public class CalendarDateRule extends RegexTimeRule {

    private static final String MONTHS = "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";
    private static final String DAY = "(\\d{1,2})(?:st|nd|rd|th)?";
    private static final String YEAR = "(?:,\\s*(\\d{4}))?";

    private final int monthGroup;
    private final int dayGroup;

    private CalendarDateRule(String regex, int monthGroup, int dayGroup) {
        super(RuleGroup.DATE, regex);
        this.monthGroup = monthGroup;
        this.dayGroup = dayGroup;
    }

    public static CalendarDateRule monthFirst() {
        return new CalendarDateRule("\\b(?:on\\s+)?" + MONTHS + "\\s+" + DAY + YEAR + "\\b", 1, 2);
    }

    public static CalendarDateRule dayFirst() {
        return new CalendarDateRule("\\b(?:on\\s+)?" + DAY + "\\s+(?:of\\s+)?" + MONTHS + YEAR + "\\b", 2, 1);
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        Month month = monthOf(m.group(monthGroup));
        int day = Integer.parseInt(m.group(dayGroup));
        String year = m.group(3);

        LocalDate date;
        try {
            date = LocalDate.of(year != null ? Integer.parseInt(year) : state.today().getYear(), month, day);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
        if (year == null && state.onDate(date, ParseState.MORNING).isBefore(state.now())) {
            date = date.plusYears(1);
        }
        return Optional.of(state
                .withWorking(state.onDate(date, ParseState.MORNING))
                .withDateParts(ParseState.DatePart.YEAR, ParseState.DatePart.MONTH, ParseState.DatePart.DAY));
    }

    static Month monthOf(String name) {
        String prefix = name.substring(0, 3).toUpperCase(Locale.ROOT);
        for (Month month : Month.values()) {
            if (month.name().startsWith(prefix)) {
                return month;
            }
        }
        throw new IllegalArgumentException("Unknown month: " + name);
    }
}
