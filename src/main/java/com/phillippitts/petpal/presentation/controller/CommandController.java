package com.phillippitts.petpal.presentation.controller;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.exception.InvalidCommandException;
import com.phillippitts.petpal.service.capability.DirectActionService;
import com.phillippitts.petpal.service.command.CommandService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Command submission, status lookup and the fire-and-forget actions.
 */
@RestController
class CommandController {

    private static final Logger log = LogManager.getLogger(CommandController.class);

    private final CommandService commandService;
    private final DirectActionService actions;

    CommandController(CommandService commandService, DirectActionService actions) {
        this.commandService = commandService;
        this.actions = actions;
    }

    /**
     * Accepts a whitelisted command. Progress is reported through {@code /events} and {@code /status}.
     */
    @PostMapping("/command")
    ResponseEntity<Map<String, Object>> submit(@RequestBody CommandRequest request) {
        if (request == null || request.prompt() == null || request.prompt().isBlank()) {
            throw new InvalidCommandException("prompt is required");
        }
        CommandSnapshot accepted = commandService.submit(request.prompt());
        log.info("Command accepted: requestId={}, kind={}", accepted.requestId(), accepted.kind());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "requestId", accepted.requestId(),
                "status", "accepted"
        ));
    }

    @GetMapping("/status/{requestId}")
    ResponseEntity<CommandSnapshot> status(@PathVariable String requestId) {
        return ResponseEntity.ok(commandService.getStatus(requestId));
    }

    @PostMapping("/dispense_treat")
    ResponseEntity<Map<String, Object>> dispenseTreat(@RequestBody(required = false) DispenseRequest request) {
        int duration = actions.dispenseTreat(request == null ? null : request.durationMs());
        return ResponseEntity.ok(Map.of("status", "ok", "durationMs", duration));
    }

    @PostMapping("/speak")
    ResponseEntity<Map<String, Object>> speak(@RequestBody SpeakRequest request) {
        actions.speak(request == null ? null : request.text());
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Command request body. {@code options} is accepted for forward compatibility and ignored.
     */
    record CommandRequest(String prompt, Map<String, Object> options) { }

    record DispenseRequest(Integer durationMs) { }

    record SpeakRequest(String text) { }
}
