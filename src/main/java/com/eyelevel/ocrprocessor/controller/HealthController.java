package com.eyelevel.ocrprocessor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness endpoints. They do not touch the job store.
 */
@RestController
@Tag(name = "Health")
public class HealthController {

    @Operation(summary = "Service health check")
    @GetMapping("/api/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "message", "Service is healthy");
    }

    @Operation(summary = "Root health check")
    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("status", "ok", "message", "OCR processor API is running");
    }
}
