package io.github.drompincen.remindpal.persistence.document;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;

public class UserProfileDocument {

    @JsonAlias("phoneNumber")
    private String owner;
    private Instant joinedAt;
    private int totalReminders;
    private int activeReminders;
    private int completedReminders;

    public UserProfileDocument() {}

    public UserProfileDocument(String owner, Instant joinedAt) {
        this.owner = owner;
        this.joinedAt = joinedAt;
    }

    public UserProfileDocument copy() {
        UserProfileDocument c = new UserProfileDocument(owner, joinedAt);
        c.totalReminders = totalReminders;
        c.activeReminders = activeReminders;
        c.completedReminders = completedReminders;
        return c;
    }

    /** Applies a delta to the active counter, never going below zero. */
    public void adjustActiveReminders(int delta) {
        activeReminders = Math.max(0, activeReminders + delta);
    }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public Instant getJoinedAt() { return joinedAt; }
    public void setJoinedAt(Instant joinedAt) { this.joinedAt = joinedAt; }

    public int getTotalReminders() { return totalReminders; }
    public void setTotalReminders(int totalReminders) { this.totalReminders = totalReminders; }

    public int getActiveReminders() { return activeReminders; }
    public void setActiveReminders(int activeReminders) { this.activeReminders = activeReminders; }

    public int getCompletedReminders() { return completedReminders; }
    public void setCompletedReminders(int completedReminders) { this.completedReminders = completedReminders; }
}
