package com.phillippitts.petpal.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness endpoint for UI clients and load balancers. Detailed component health lives under
 * {@code /actuator/health}.
 */
@RestController
class HealthController {

    private static final Logger log = LogManager.getLogger(HealthController.class);
    static final int API_VERSION = 1;

    private final String version;

    HealthController(@Value("${petpal.version:v0.1}") String version) {
        this.version = version;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        log.debug("Health probe");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "api", API_VERSION,
                "version", version
        ));
    }
}
