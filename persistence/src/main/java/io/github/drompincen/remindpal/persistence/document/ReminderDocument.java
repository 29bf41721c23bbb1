package io.github.drompincen.remindpal.persistence.document;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;

public class ReminderDocument {

    private String id;
    @JsonAlias("phoneNumber")
    private String owner;
    private String message;
    private String originalText;
    private Instant triggerTime;
    private boolean recurring;
    private String pattern;
    private boolean active;
    private boolean completed;
    private boolean snoozed;
    private boolean acknowledgementPending;
    @JsonAlias("created")
    private Instant createdAt;

    public ReminderDocument() {}

    public ReminderDocument copy() {
        ReminderDocument c = new ReminderDocument();
        c.id = id;
        c.owner = owner;
        c.message = message;
        c.originalText = originalText;
        c.triggerTime = triggerTime;
        c.recurring = recurring;
        c.pattern = pattern;
        c.active = active;
        c.completed = completed;
        c.snoozed = snoozed;
        c.acknowledgementPending = acknowledgementPending;
        c.createdAt = createdAt;
        return c;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getOriginalText() { return originalText; }
    public void setOriginalText(String originalText) { this.originalText = originalText; }

    public Instant getTriggerTime() { return triggerTime; }
    public void setTriggerTime(Instant triggerTime) { this.triggerTime = triggerTime; }

    public boolean isRecurring() { return recurring; }
    public void setRecurring(boolean recurring) { this.recurring = recurring; }

    public String getPattern() { return pattern; }
    public void setPattern(String pattern) { this.pattern = pattern; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public boolean isSnoozed() { return snoozed; }
    public void setSnoozed(boolean snoozed) { this.snoozed = snoozed; }

    /** Set when a recurring occurrence fired and has not been marked done yet. */
    public boolean isAcknowledgementPending() { return acknowledgementPending; }
    public void setAcknowledgementPending(boolean acknowledgementPending) { this.acknowledgementPending = acknowledgementPending; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
