package io.github.drompincen.remindpal.gateway.controller;

import io.github.drompincen.remindpal.persistence.document.ReminderDocument;
import io.github.drompincen.remindpal.protocol.api.CreateReminderRequest;
import io.github.drompincen.remindpal.protocol.api.ReminderDto;
import io.github.drompincen.remindpal.protocol.api.SnoozeRequest;
import io.github.drompincen.remindpal.runtime.notify.NotificationService;
import io.github.drompincen.remindpal.runtime.notify.ReminderMessages;
import io.github.drompincen.remindpal.runtime.reminder.ReminderLifecycle;
import io.github.drompincen.remindpal.runtime.reminder.ReminderService;
import io.github.drompincen.remindpal.runtime.reminder.Transition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
public class ReminderController {

    private final ReminderService reminderService;
    private final ReminderLifecycle lifecycle;
    private final NotificationService notifications;
    private final ReminderMessages messages;
    private final Clock clock;
    private final int defaultSnoozeMinutes;

    public ReminderController(ReminderService reminderService, ReminderLifecycle lifecycle,
                              NotificationService notifications, ReminderMessages messages, Clock clock,
                              @Value("${remindpal.reminders.snooze-minutes:10}") int defaultSnoozeMinutes) {
        this.reminderService = reminderService;
        this.lifecycle = lifecycle;
        this.notifications = notifications;
        this.messages = messages;
        this.clock = clock;
        this.defaultSnoozeMinutes = defaultSnoozeMinutes;
    }

    @PostMapping("/api/reminders")
    public ResponseEntity<?> create(@RequestBody CreateReminderRequest req) {
        if (req.owner() == null || req.owner().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "owner is required"));
        }
        if (req.text() == null || req.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required"));
        }

        Optional<ReminderDocument> created = reminderService.create(req.owner(), req.text());
        if (created.isEmpty()) {
            return ResponseEntity.unprocessableEntity().body(Map.of("error", ReminderMessages.PARSE_HELP));
        }
        ReminderDocument doc = created.get();
        notifications.sendText(doc.getOwner(), messages.created(doc));
        return ResponseEntity.created(URI.create("/api/reminders/" + doc.getId()))
                .body(ReminderService.toDto(doc));
    }

    @GetMapping("/api/owners/{owner}/reminders")
    public List<ReminderDto> listActive(@PathVariable String owner) {
        return reminderService.listActive(owner).stream().map(ReminderService::toDto).toList();
    }

    @GetMapping("/api/reminders/{id}")
    public ResponseEntity<ReminderDto> get(@PathVariable String id) {
        return reminderService.find(id)
                .map(doc -> ResponseEntity.ok(ReminderService.toDto(doc)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/api/reminders/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        Transition t = lifecycle.cancelOne(id);
        if (t.status() == Transition.Status.NOT_FOUND) {
            return ResponseEntity.notFound().build();
        }
        if (t.saveFailed()) {
            return ResponseEntity.internalServerError().build();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/api/reminders/{id}/complete")
    public ResponseEntity<ReminderDto> complete(@PathVariable String id) {
        return toResponse(lifecycle.complete(id));
    }

    @PostMapping("/api/reminders/{id}/snooze")
    public ResponseEntity<ReminderDto> snooze(@PathVariable String id,
                                              @RequestBody(required = false) SnoozeRequest req) {
        int minutes = req != null && req.minutes() != null ? req.minutes() : defaultSnoozeMinutes;
        return toResponse(lifecycle.snooze(id, minutes, clock.instant()));
    }

    private ResponseEntity<ReminderDto> toResponse(Transition t) {
        if (t.saveFailed()) {
            return ResponseEntity.internalServerError().body(ReminderService.toDto(t.reminder()));
        }
        return switch (t.status()) {
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case ALREADY_COMPLETED -> ResponseEntity.status(HttpStatus.CONFLICT).body(ReminderService.toDto(t.reminder()));
            default -> ResponseEntity.ok(ReminderService.toDto(t.reminder()));
        };
    }
}
