package io.github.drompincen.remindpal.runtime.session;

import io.github.drompincen.remindpal.protocol.api.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory conversation state per owner. Entries idle for longer than the TTL
 * are dropped by a periodic sweep; nothing survives a restart.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, UserSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public SessionRegistry(Clock clock, @Value("${remindpal.sessions.ttl-ms:3600000}") long ttlMs) {
        this.clock = clock;
        this.ttl = Duration.ofMillis(ttlMs);
    }

    /** Returns the owner's session, creating an idle one, and records activity now. */
    public UserSession touch(String owner) {
        Instant now = clock.instant();
        return sessions.compute(owner, (k, existing) -> existing == null
                ? new UserSession(k, SessionState.IDLE, now)
                : existing.touchedAt(now));
    }

    public Optional<UserSession> find(String owner) {
        return Optional.ofNullable(sessions.get(owner));
    }

    public SessionState stateOf(String owner) {
        return find(owner).map(UserSession::state).orElse(SessionState.IDLE);
    }

    public UserSession transition(String owner, SessionState state) {
        Instant now = clock.instant();
        return sessions.compute(owner, (k, existing) -> existing == null
                ? new UserSession(k, state, now)
                : existing.withState(state).touchedAt(now));
    }

    @Scheduled(fixedRateString = "${remindpal.sessions.sweep-interval-ms:3600000}",
            initialDelayString = "${remindpal.sessions.sweep-interval-ms:3600000}")
    public void sweepExpired() {
        int removed = sweep(clock.instant());
        if (removed > 0) {
            log.info("Cleaned up {} inactive sessions", removed);
        }
    }

    int sweep(Instant now) {
        Instant cutoff = now.minus(ttl);
        int before = sessions.size();
        sessions.values().removeIf(s -> s.lastActivity().isBefore(cutoff));
        return before - sessions.size();
    }

    public int size() {
        return sessions.size();
    }
}
