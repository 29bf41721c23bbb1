package io.github.drompincen.remindpal.runtime.session;

import io.github.drompincen.remindpal.protocol.api.SessionState;

import java.time.Instant;

public record UserSession(String owner, SessionState state, Instant lastActivity) {

    public UserSession withState(SessionState newState) {
        return new UserSession(owner, newState, lastActivity);
    }

    public UserSession touchedAt(Instant now) {
        return new UserSession(owner, state, now);
    }
}
