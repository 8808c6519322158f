package com.starscape.taskboard.common.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint.
 * GET /
 */
@RestController
public class HealthController {
    
    @GetMapping("/")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok", "Task Management API is running"));
    }
    
    public record HealthResponse(String status, String message) {}
}
