package io.github.drompincen.remindpal.gateway.controller;

import io.github.drompincen.remindpal.protocol.api.ActionRequest;
import io.github.drompincen.remindpal.protocol.api.ReminderAction;
import io.github.drompincen.remindpal.protocol.api.UserStatsDto;
import io.github.drompincen.remindpal.runtime.reminder.ReminderActionService;
import io.github.drompincen.remindpal.runtime.reminder.ReminderService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/owners/{owner}")
public class OwnerController {

    private final ReminderActionService actionService;
    private final ReminderService reminderService;

    public OwnerController(ReminderActionService actionService, ReminderService reminderService) {
        this.actionService = actionService;
        this.reminderService = reminderService;
    }

    @PostMapping("/cancellation")
    public Map<String, String> startCancellation(@PathVariable String owner) {
        return Map.of("reply", actionService.startCancellation(owner));
    }

    /** Routes a prompt reply such as {@code snooze_reminder_<id>}; a malformed payload yields 400. */
    @PostMapping("/actions")
    public Map<String, String> action(@PathVariable String owner, @RequestBody ActionRequest req) {
        ReminderAction action = ReminderAction.parse(req.payload());
        return Map.of("reply", actionService.handle(owner, action));
    }

    @GetMapping("/stats")
    public ResponseEntity<UserStatsDto> stats(@PathVariable String owner) {
        return reminderService.stats(owner)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
