package io.github.drompincen.remindpal.runtime.parser;

import io.github.drompincen.remindpal.protocol.api.ParsedReminder;
import io.github.drompincen.remindpal.runtime.parser.rule.CalendarDateRule;
import io.github.drompincen.remindpal.runtime.parser.rule.ClockTimeRule;
import io.github.drompincen.remindpal.runtime.parser.rule.DailyRule;
import io.github.drompincen.remindpal.runtime.parser.rule.MonthlyRule;
import io.github.drompincen.remindpal.runtime.parser.rule.ParseState;
import io.github.drompincen.remindpal.runtime.parser.rule.RelativeOffsetRule;
import io.github.drompincen.remindpal.runtime.parser.rule.RuleMatch;
import io.github.drompincen.remindpal.runtime.parser.rule.TimeRule;
import io.github.drompincen.remindpal.runtime.parser.rule.TodayRule;
import io.github.drompincen.remindpal.runtime.parser.rule.TomorrowRule;
import io.github.drompincen.remindpal.runtime.parser.rule.TonightRule;
import io.github.drompincen.remindpal.runtime.parser.rule.WeeklyRule;
import io.github.drompincen.remindpal.runtime.recurrence.RecurrenceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns free text such as {@code "@remind call mom tomorrow at 5pm"} into a
 * reminder draft.
 *
 * <p>Rules run in group order (recurrence, date keywords, time of day) and every
 * rule sees the same text; a later rule refines the working time left by an
 * earlier one. The phrases the rules consumed are removed from the text to
 * leave the task description. An empty result means the text carried no usable
 * time, or named a one-off time in the past.
 */
@Service
public class TimeExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(TimeExpressionParser.class);

    public static final String UNTITLED = "Untitled Reminder";
    static final Duration PAST_TOLERANCE = Duration.ofSeconds(60);

    private static final Pattern PREFIX =
            Pattern.compile("^\\s*(?:@remind\\s+|remind\\s+me\\s+(?:to\\s+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ZoneId zone;
    private final RecurrenceEngine recurrence;
    private final List<TimeRule> rules;

    public TimeExpressionParser(Clock clock, RecurrenceEngine recurrence) {
        this.zone = clock.getZone();
        this.recurrence = recurrence;
        this.rules = defaultRules().stream().sorted(Comparator.comparing(TimeRule::group)).toList();
    }

    static List<TimeRule> defaultRules() {
        return List.of(
                new DailyRule(),
                new WeeklyRule(),
                new MonthlyRule(),
                new TomorrowRule(),
                new TonightRule(),
                new TodayRule(),
                CalendarDateRule.monthFirst(),
                CalendarDateRule.dayFirst(),
                new RelativeOffsetRule(),
                new ClockTimeRule());
    }

    public Optional<ParsedReminder> parse(String text, Instant now) {
        if (text == null) {
            return Optional.empty();
        }
        String body = PREFIX.matcher(text).replaceFirst("").trim();
        if (body.isEmpty()) {
            log.debug("Nothing to parse after prefix in '{}'", text);
            return Optional.empty();
        }

        LocalDateTime localNow = LocalDateTime.ofInstant(now, zone);
        ParseState state = ParseState.initial(localNow);
        List<String> phrases = new ArrayList<>();
        for (TimeRule rule : rules) {
            Optional<RuleMatch> match = rule.apply(body, state);
            if (match.isPresent()) {
                phrases.add(match.get().phrase());
                state = match.get().state();
            }
        }

        if (!state.recurring() && !state.hasDate() && !state.hasTime()) {
            log.debug("No time expression found in '{}'", text);
            return Optional.empty();
        }

        Optional<Instant> trigger = normalize(state, now);
        if (trigger.isEmpty()) {
            return Optional.empty();
        }

        String message = residual(body, phrases);
        return Optional.of(new ParsedReminder(message, text, trigger.get(), state.recurring(), state.pattern()));
    }

    private Optional<Instant> normalize(ParseState state, Instant now) {
        LocalDateTime working = state.working();
        if (!state.recurring() && !state.hasDate() && !working.isAfter(state.now())) {
            working = working.plusDays(1);
        }
        Instant trigger = working.atZone(zone).toInstant();

        if (state.recurring()) {
            if (!trigger.isAfter(now)) {
                return recurrence.advance(state.pattern(), trigger, now);
            }
            return Optional.of(trigger);
        }
        if (trigger.isBefore(now.minus(PAST_TOLERANCE))) {
            log.debug("Rejecting reminder in the past: {} (now {})", trigger, now);
            return Optional.empty();
        }
        return Optional.of(trigger);
    }

    static String residual(String body, List<String> phrases) {
        String message = body;
        List<String> longestFirst = new ArrayList<>(phrases);
        longestFirst.sort(Comparator.comparingInt(String::length).reversed());
        for (String phrase : longestFirst) {
            message = Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(message).replaceAll("");
        }
        message = WHITESPACE.matcher(message).replaceAll(" ").trim();
        return message.isEmpty() ? UNTITLED : message;
    }
}
