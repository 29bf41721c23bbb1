package io.github.drompincen.remindpal.runtime.reminder;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import io.github.drompincen.remindpal.protocol.api.ReminderAction;
import io.github.drompincen.remindpal.protocol.api.SessionState;
import io.github.drompincen.remindpal.runtime.notify.NotificationService;
import io.github.drompincen.remindpal.runtime.notify.ReminderMessages;
import io.github.drompincen.remindpal.runtime.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Handles acknowledgements coming back from prompts, plus the cancel-all
 * confirmation flow. Every reply is delivered to the owner and also returned.
 */
@Service
public class ReminderActionService {

    private static final Logger log = LoggerFactory.getLogger(ReminderActionService.class);

    private final ReminderStore store;
    private final ReminderLifecycle lifecycle;
    private final SessionRegistry sessions;
    private final NotificationService notifications;
    private final ReminderMessages messages;
    private final Clock clock;
    private final int snoozeMinutes;

    public ReminderActionService(ReminderStore store, ReminderLifecycle lifecycle, SessionRegistry sessions,
                                 NotificationService notifications, ReminderMessages messages, Clock clock,
                                 @Value("${remindpal.reminders.snooze-minutes:10}") int snoozeMinutes) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.sessions = sessions;
        this.notifications = notifications;
        this.messages = messages;
        this.clock = clock;
        this.snoozeMinutes = snoozeMinutes;
    }

    public String handle(String owner, ReminderAction action) {
        sessions.touch(owner);
        String reply = switch (action.targetType()) {
            case REMINDER -> handleReminder(owner, action);
            case CANCELLATION -> handleCancellation(owner, action);
        };
        notifications.sendText(owner, reply);
        return reply;
    }

    /**
     * Asks the owner to confirm cancelling all active reminders. With nothing to
     * cancel the session stays idle.
     */
    public String startCancellation(String owner) {
        sessions.touch(owner);
        int active = store.countActive(owner);
        if (active == 0) {
            String reply = messages.nothingToCancel();
            notifications.sendText(owner, reply);
            return reply;
        }
        sessions.transition(owner, SessionState.AWAITING_CANCEL_CONFIRMATION);
        String prompt = messages.cancelPrompt(active);
        notifications.sendChoice(owner, prompt, messages.cancelOptions());
        return prompt;
    }

    private String handleReminder(String owner, ReminderAction action) {
        String id = action.identifier();
        Optional<ReminderDocument> current = store.findById(id);
        if (current.isEmpty() || !owner.equals(current.get().getOwner())) {
            log.debug("Action {} for unknown reminder {} from {}", action.action(), id, owner);
            return messages.notFound();
        }

        Transition t = switch (action.action()) {
            case COMPLETED -> lifecycle.complete(id);
            case SNOOZE -> lifecycle.snooze(id, snoozeMinutes, clock.instant());
            case CONFIRM, DECLINE -> throw new IllegalStateException("Not a reminder action: " + action);
        };

        return switch (t.status()) {
            case NOT_FOUND -> messages.notFound();
            case ALREADY_COMPLETED -> messages.alreadyCompleted(t.reminder());
            default -> action.action() == ReminderAction.Action.COMPLETED
                    ? messages.completed(t.reminder())
                    : messages.snoozed(t.reminder(), snoozeMinutes);
        };
    }

    private String handleCancellation(String owner, ReminderAction action) {
        try {
            return switch (action.action()) {
                case CONFIRM -> {
                    List<ReminderDocument> removed = lifecycle.cancelAll(owner);
                    yield removed.isEmpty() ? messages.nothingToCancel() : messages.cancelledAll(removed.size());
                }
                case DECLINE -> messages.keptAll();
                case COMPLETED, SNOOZE -> throw new IllegalStateException("Not a cancellation action: " + action);
            };
        } finally {
            sessions.transition(owner, SessionState.IDLE);
        }
    }
}
