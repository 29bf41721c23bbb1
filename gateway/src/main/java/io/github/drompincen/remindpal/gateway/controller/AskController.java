package io.github.drompincen.remindpal.gateway.controller;

import io.github.drompincen.remindpal.protocol.api.AskRequest;
import io.github.drompincen.remindpal.runtime.assistant.AssistantService;
import io.github.drompincen.remindpal.runtime.session.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/ask")
public class AskController {

    private final AssistantService assistant;
    private final SessionRegistry sessions;

    public AskController(AssistantService assistant, SessionRegistry sessions) {
        this.assistant = assistant;
        this.sessions = sessions;
    }

    @PostMapping
    public ResponseEntity<?> ask(@RequestBody AskRequest req) {
        if (req.owner() == null || req.owner().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "owner is required"));
        }
        if (req.text() == null || req.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required"));
        }
        sessions.touch(req.owner());
        return ResponseEntity.ok(Map.of("answer", assistant.ask(req.owner(), req.text())));
    }
}
