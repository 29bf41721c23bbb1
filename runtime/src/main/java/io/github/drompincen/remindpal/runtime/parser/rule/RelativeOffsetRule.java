package io.github.drompincen.remindpal.runtime.parser.rule;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/** {@code in|after N minutes|hours|days|weeks}, added to the working time. */
public class RelativeOffsetRule extends RegexTimeRule {

    public RelativeOffsetRule() {
        super(RuleGroup.TIME, "\\b(?:in|after)\\s+(\\d+)\\s+(minute|min|hour|hr|day|week)s?\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        LocalDateTime shifted;
        try {
            long amount = Long.parseLong(m.group(1));
            shifted = state.working().plus(amount, unitOf(m.group(2)));
        } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
        return Optional.of(state
                .withWorking(shifted)
                .withDateParts(ParseState.DatePart.DAY)
                .withTimeParts(ParseState.TimePart.HOUR, ParseState.TimePart.MINUTE));
    }

    private static ChronoUnit unitOf(String word) {
        return switch (word.toLowerCase(Locale.ROOT)) {
            case "minute", "min" -> ChronoUnit.MINUTES;
            case "hour", "hr" -> ChronoUnit.HOURS;
            case "day" -> ChronoUnit.DAYS;
            case "week" -> ChronoUnit.WEEKS;
            default -> throw new IllegalArgumentException("Unknown unit: " + word);
        };
    }
}
