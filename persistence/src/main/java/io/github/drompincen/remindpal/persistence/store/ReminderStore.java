package io.github.drompincen.remindpal.persistence.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.persistence.document.UserProfileDocument;
import io.github.drompincen.remindpal.protocol.api.ParsedReminder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Authoritative in-memory collection of reminders and user profiles, backed by
 * {@code reminders.json} and {@code userProfiles.json}.
 *
 * <p>Readers always receive copies. The only way to change a stored reminder is
 * {@link #update(String, Function)}, which hands the live record to the mutator
 * while holding the store monitor. The two files are saved one after the other;
 * a crash in between can leave the profile counters out of step with the
 * reminders.
 */
public class ReminderStore {

    private static final Logger log = LoggerFactory.getLogger(ReminderStore.class);

    public static final String REMINDERS_FILE = "reminders.json";
    public static final String PROFILES_FILE = "userProfiles.json";

    private final Path dataDir;
    private final JsonFileStore<List<ReminderDocument>> reminderFile;
    private final JsonFileStore<Map<String, UserProfileDocument>> profileFile;

    private final Map<String, ReminderDocument> reminders = new LinkedHashMap<>();
    private final Map<String, UserProfileDocument> profiles = new LinkedHashMap<>();

    public ReminderStore(Path dataDir, Clock clock) {
        this(dataDir, defaultMapper(), clock);
    }

    public ReminderStore(Path dataDir, ObjectMapper mapper, Clock clock) {
        this.dataDir = dataDir;
        this.reminderFile = new JsonFileStore<>(dataDir.resolve(REMINDERS_FILE), mapper,
                new TypeReference<List<ReminderDocument>>() {}, ArrayList::new, clock);
        this.profileFile = new JsonFileStore<>(dataDir.resolve(PROFILES_FILE), mapper,
                new TypeReference<Map<String, UserProfileDocument>>() {}, LinkedHashMap::new, clock);
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // ---- Persistence ----

    public synchronized void load() {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new IllegalStateException("Could not create data directory " + dataDir, e);
        }

        reminders.clear();
        for (ReminderDocument doc : reminderFile.load()) {
            if (doc == null || doc.getId() == null) {
                log.warn("Skipping stored reminder without id");
                continue;
            }
            reminders.put(doc.getId(), doc);
        }
        profiles.clear();
        profileFile.load().forEach((key, profile) -> {
            if (profile == null) return;
            if (profile.getOwner() == null) profile.setOwner(key);
            profiles.put(key, profile);
        });
        log.info("Loaded {} reminders and {} user profiles from {}", reminders.size(), profiles.size(), dataDir);
    }

    /**
     * Writes both collections. A failure is logged and leaves the previous files intact.
     *
     * @return {@code true} only if both files were written
     */
    public synchronized boolean save() {
        boolean remindersSaved = reminderFile.save(new ArrayList<>(reminders.values()));
        boolean profilesSaved = profileFile.save(new LinkedHashMap<>(profiles));
        return remindersSaved && profilesSaved;
    }

    // ---- Reminders ----

    /**
     * Stores a parsed draft as a new active reminder and bumps the owner's
     * total and active counters, creating the profile if needed. Saves.
     */
    public synchronized ReminderDocument create(String owner, ParsedReminder draft, Instant now) {
        ReminderDocument doc = new ReminderDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setOwner(owner);
        doc.setMessage(draft.message());
        doc.setOriginalText(draft.originalText());
        doc.setTriggerTime(draft.triggerTime());
        doc.setRecurring(draft.recurring());
        doc.setPattern(draft.patternTag());
        doc.setActive(true);
        doc.setCompleted(false);
        doc.setSnoozed(false);
        doc.setCreatedAt(now);
        reminders.put(doc.getId(), doc);

        UserProfileDocument profile = profiles.computeIfAbsent(owner, o -> new UserProfileDocument(o, now));
        profile.setTotalReminders(profile.getTotalReminders() + 1);
        profile.adjustActiveReminders(1);

        if (!save()) {
            log.error("Reminder {} for {} kept in memory only, save failed", doc.getId(), owner);
        }
        return doc.copy();
    }

    public synchronized Optional<ReminderDocument> findById(String id) {
        return Optional.ofNullable(reminders.get(id)).map(ReminderDocument::copy);
    }

    public synchronized List<ReminderDocument> listActiveByOwner(String owner) {
        return reminders.values().stream()
                .filter(r -> r.isActive() && owner.equals(r.getOwner()))
                .sorted(Comparator.comparing(ReminderDocument::getTriggerTime,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(ReminderDocument::copy)
                .toList();
    }

    public synchronized int countActive(String owner) {
        return (int) reminders.values().stream()
                .filter(r -> r.isActive() && owner.equals(r.getOwner()))
                .count();
    }

    /** Stable copy of every reminder, in insertion order. */
    public synchronized List<ReminderDocument> snapshot() {
        return reminders.values().stream().map(ReminderDocument::copy).toList();
    }

    /**
     * Applies {@code mutator} to the live record with the given id.
     *
     * @return the mutator's result, or empty if no such reminder exists
     */
    public synchronized <R> Optional<R> update(String id, Function<ReminderDocument, R> mutator) {
        ReminderDocument live = reminders.get(id);
        if (live == null) return Optional.empty();
        return Optional.ofNullable(mutator.apply(live));
    }

    public synchronized Optional<ReminderDocument> cancelById(String id) {
        return Optional.ofNullable(reminders.remove(id));
    }

    /** Removes every active reminder of the owner and returns what was removed. */
    public synchronized List<ReminderDocument> cancelAllByOwner(String owner) {
        return removeIf(r -> r.isActive() && owner.equals(r.getOwner()));
    }

    private List<ReminderDocument> removeIf(Predicate<ReminderDocument> filter) {
        List<ReminderDocument> removed = new ArrayList<>();
        Iterator<ReminderDocument> it = reminders.values().iterator();
        while (it.hasNext()) {
            ReminderDocument r = it.next();
            if (filter.test(r)) {
                removed.add(r);
                it.remove();
            }
        }
        return removed;
    }

    public synchronized int reminderCount() {
        return reminders.size();
    }

    // ---- Profiles ----

    /**
     * Returns the owner's profile, creating and saving it on first contact.
     */
    public synchronized UserProfileDocument ensureProfile(String owner, Instant now) {
        UserProfileDocument existing = profiles.get(owner);
        if (existing != null) return existing.copy();

        UserProfileDocument profile = new UserProfileDocument(owner, now);
        profiles.put(owner, profile);
        if (!save()) {
            log.error("Profile for {} kept in memory only, save failed", owner);
        }
        log.info("Created profile for new owner {}", owner);
        return profile.copy();
    }

    public synchronized Optional<UserProfileDocument> findProfile(String owner) {
        return Optional.ofNullable(profiles.get(owner)).map(UserProfileDocument::copy);
    }

    /** Mutates the owner's profile in place; returns {@code false} if there is no profile. */
    public synchronized boolean updateProfile(String owner, Consumer<UserProfileDocument> mutator) {
        UserProfileDocument profile = profiles.get(owner);
        if (profile == null) return false;
        mutator.accept(profile);
        return true;
    }

    public synchronized int profileCount() {
        return profiles.size();
    }
}
