package io.github.drompincen.remindpal.gateway.controller;

import io.github.drompincen.remindpal.runtime.reminder.ReminderScheduler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
public class SchedulerController {

    private final ReminderScheduler scheduler;
    private final Clock clock;

    public SchedulerController(ReminderScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /** Runs one tick immediately instead of waiting for the next scheduled one. */
    @PostMapping("/api/scheduler/tick")
    public Map<String, Integer> tick() {
        return Map.of("fired", scheduler.tick(clock.instant()));
    }
}
