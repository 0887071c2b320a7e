package com.flamingo.ai.researchchat.api.rest;

import com.flamingo.ai.researchchat.service.stream.GenerationSessionRegistry;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. Reachable without an origin. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final GenerationSessionRegistry sessionRegistry;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "research-chat");
    health.put("activeRuns", sessionRegistry.activeCount());
    return ResponseEntity.ok(health);
  }
}
