package io.github.drompincen.remindpal.runtime.notify;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.protocol.api.ChoiceOption;
import io.github.drompincen.remindpal.protocol.api.RecurrencePattern;
import io.github.drompincen.remindpal.protocol.api.ReminderAction;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/** User-facing texts and prompt options. Times are shown in the reference zone. */
@Component
public class ReminderMessages {

    public static final String PARSE_HELP = """
            Oops! I couldn't understand that reminder. Can you try phrasing it clearly?

            Examples:
            • "@remind drink water in 30 minutes"
            • "remind me to call mom tomorrow at 6 PM"
            • "@remind project update every friday at 10am\"""";

    private final DateTimeFormatter display;

    public ReminderMessages(Clock clock) {
        this.display = DateTimeFormatter.ofPattern("EEE, MMM d, h:mm a", Locale.ENGLISH).withZone(clock.getZone());
    }

    public String formatTime(Instant instant) {
        return instant == null ? "unscheduled" : display.format(instant);
    }

    public String alert(ReminderDocument reminder) {
        return "🔔 REMINDER ALERT! 🔔\n\n"
                + "📝 " + reminder.getMessage() + "\n\n"
                + "⏰ Was scheduled for: " + formatTime(reminder.getTriggerTime()) + "\n\n"
                + "Did you complete this task?";
    }

    public List<ChoiceOption> alertOptions(ReminderDocument reminder, int snoozeMinutes) {
        return List.of(
                new ChoiceOption(ReminderAction.completed(reminder.getId()).toPayload(), "✅ Yes, Done!"),
                new ChoiceOption(ReminderAction.snooze(reminder.getId()).toPayload(),
                        "😴 Snooze " + snoozeMinutes + "min"));
    }

    public String created(ReminderDocument reminder) {
        String repeats = RecurrencePattern.fromTag(reminder.getPattern())
                .map(p -> " (Repeats " + p.describe() + ")")
                .orElse("");
        return "✅ Reminder set!\n\n"
                + "📝 Task: " + reminder.getMessage() + "\n"
                + (reminder.isRecurring() ? "🔄" : "⏰") + " Time: " + formatTime(reminder.getTriggerTime()) + repeats;
    }

    public String completed(ReminderDocument reminder) {
        return "✅ Great job! Marked \"" + reminder.getMessage() + "\" as completed.";
    }

    public String snoozed(ReminderDocument reminder, int minutes) {
        return "😴 Snoozed \"" + reminder.getMessage() + "\" for " + minutes
                + " minutes. I'll remind you again around " + formatTime(reminder.getTriggerTime()) + ".";
    }

    public String notFound() {
        return "Hmm, I couldn't find that reminder. It might have been processed or removed.";
    }

    public String alreadyCompleted(ReminderDocument reminder) {
        return "\"" + reminder.getMessage() + "\" is already completed.";
    }

    public String cancelPrompt(int activeCount) {
        return "⚠️ You have " + activeCount + " active reminder(s). Are you sure you want to cancel ALL of them?";
    }

    public List<ChoiceOption> cancelOptions() {
        return List.of(
                new ChoiceOption(ReminderAction.confirmCancelAll().toPayload(), "Yes, Cancel All"),
                new ChoiceOption(ReminderAction.declineCancelAll().toPayload(), "No, Keep Them"));
    }

    public String nothingToCancel() {
        return "📋 You have no active reminders to cancel.";
    }

    public String cancelledAll(int count) {
        return "🗑️ All " + count + " active reminders have been cancelled.";
    }

    public String keptAll() {
        return "👍 Okay, your reminders are safe.";
    }
}
