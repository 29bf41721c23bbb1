package io.github.drompincen.remindpal.runtime.parser.rule;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * {@code at|@ H[:MM|.MM] [am|pm]}. Sets the time of day on the working date,
 * seconds cleared. Out-of-range hours or minutes do not match.
 */
public class ClockTimeRule extends RegexTimeRule {

    public ClockTimeRule() {
        super(RuleGroup.TIME, "(?:\\bat|@)\\s*(\\d{1,2})(?:[:.](\\d{2}))?\\s*(am|pm)?\\b");
    }

    @Override
    protected Optional<ParseState> resolve(Matcher m, ParseState state) {
        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        String meridiem = m.group(3);
        if (meridiem != null) {
            boolean pm = meridiem.equalsIgnoreCase("pm");
            if (pm && hour < 12) hour += 12;
            if (!pm && hour == 12) hour = 0;
        }
        if (hour > 23 || minute > 59) {
            return Optional.empty();
        }
        return Optional.of(state
                .withWorking(state.working().withHour(hour).withMinute(minute).withSecond(0).withNano(0))
                .withTimeParts(ParseState.TimePart.HOUR, ParseState.TimePart.MINUTE));
    }
}
