package com.callcenter.backend.health.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Map;

@Schema(description = "Service health summary")
public record HealthResponse(
    @Schema(description = "healthy, degraded or unhealthy", example = "healthy") String status,
    Instant timestamp,
    String version,
    String environment,
    long uptimeSeconds,
    @Schema(description = "Availability per registered handler") Map<String, Boolean> agentsAvailable,
    boolean storageAvailable) {}
