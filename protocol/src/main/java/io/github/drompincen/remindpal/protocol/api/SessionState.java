package io.github.drompincen.remindpal.protocol.api;

public enum SessionState {
    IDLE,
    AWAITING_CANCEL_CONFIRMATION
}
