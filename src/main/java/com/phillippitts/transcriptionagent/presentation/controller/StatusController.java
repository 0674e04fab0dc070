package com.phillippitts.transcriptionagent.presentation.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Liveness endpoint for hosting platforms that probe a plain HTTP port.
 * Answers as long as the process is up; room and engine state live in /actuator/health.
 */
@RestController
class StatusController {

    static final String SERVICE_NAME = "transcription-agent";

    private final Clock clock;

    StatusController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping({"/", "/health"})
    ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "service", SERVICE_NAME,
                "timestamp", LocalDateTime.now(clock).toString()
        ));
    }
}
