package com.flamingo.ai.ephemeralrag.api.rest;

import com.flamingo.ai.ephemeralrag.api.dto.response.SystemStats;
import com.flamingo.ai.ephemeralrag.service.health.HealthService;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and store statistics. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    SystemStats stats = healthService.getSystemStats();
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", stats.getTimestamp());
    health.put("service", "ephemeral-rag");
    health.put("activeSessions", stats.getActiveSessions());
    health.put("totalChunks", stats.getTotalChunks());
    health.put("dimension", stats.getDimension());
    return ResponseEntity.ok(health);
  }

  /** Returns store statistics. */
  @GetMapping("/stats")
  public ResponseEntity<SystemStats> stats() {
    return ResponseEntity.ok(healthService.getSystemStats());
  }
}
