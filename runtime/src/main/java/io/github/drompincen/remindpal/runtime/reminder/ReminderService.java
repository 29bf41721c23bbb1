package io.github.drompincen.remindpal.runtime.reminder;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.persistence.store.ReminderStore;
import io.github.drompincen.remindpal.protocol.api.ParsedReminder;
import io.github.drompincen.remindpal.protocol.api.ReminderDto;
import io.github.drompincen.remindpal.protocol.api.UserStatsDto;
import io.github.drompincen.remindpal.runtime.parser.TimeExpressionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Creation and read side of reminders: parses free text, stores the draft and
 * answers list and stats queries. State transitions live in {@link ReminderLifecycle}.
 */
@Service
public class ReminderService {

    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    private final ReminderStore store;
    private final TimeExpressionParser parser;
    private final Clock clock;

    public ReminderService(ReminderStore store, TimeExpressionParser parser, Clock clock) {
        this.store = store;
        this.parser = parser;
        this.clock = clock;
    }

    /**
     * @return the stored reminder, or empty when the text names no usable time
     */
    public Optional<ReminderDocument> create(String owner, String text) {
        Instant now = clock.instant();
        store.ensureProfile(owner, now);
        Optional<ParsedReminder> draft = parser.parse(text, now);
        if (draft.isEmpty()) {
            log.info("Could not parse reminder from {}: '{}'", owner, text);
            return Optional.empty();
        }
        ReminderDocument created = store.create(owner, draft.get(), now);
        log.info("Created reminder {} for {} at {}{}", created.getId(), owner, created.getTriggerTime(),
                created.isRecurring() ? " (" + created.getPattern() + ")" : "");
        return Optional.of(created);
    }

    public List<ReminderDocument> listActive(String owner) {
        return store.listActiveByOwner(owner);
    }

    public Optional<ReminderDocument> find(String id) {
        return store.findById(id);
    }

    /** Counters from the profile; the active count is recomputed from the reminders themselves. */
    public Optional<UserStatsDto> stats(String owner) {
        return store.findProfile(owner).map(profile -> {
            int completed = profile.getCompletedReminders();
            int total = profile.getTotalReminders();
            return new UserStatsDto(owner, profile.getJoinedAt(), total, store.countActive(owner), completed,
                    completionRate(completed, total));
        });
    }

    static int completionRate(int completed, int total) {
        if (total <= 0 || completed <= 0) return 0;
        return (int) Math.round(completed * 100.0 / total);
    }

    public static ReminderDto toDto(ReminderDocument doc) {
        return new ReminderDto(doc.getId(), doc.getOwner(), doc.getMessage(), doc.getOriginalText(),
                doc.getTriggerTime(), doc.isRecurring(), doc.getPattern(), doc.isActive(), doc.isCompleted(),
                doc.isSnoozed(), doc.getCreatedAt());
    }
}
