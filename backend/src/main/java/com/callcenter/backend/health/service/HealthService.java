package com.callcenter.backend.health.service;

import com.callcenter.backend.agent.capability.Capability;
import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.common.config.AppInfoProperties;
import com.callcenter.backend.dialog.persistence.DialogRepository;
import com.callcenter.backend.health.api.HealthResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Unhealthy when dialogs cannot be stored or first-contact turns have nowhere to go; degraded when
 * any other handler is disabled.
 */
@Service
@Slf4j
public class HealthService {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";
  public static final String UNHEALTHY = "unhealthy";

  private final CapabilityRegistry capabilityRegistry;
  private final DialogRepository dialogRepository;
  private final OrchestrationProperties orchestrationProperties;
  private final AppInfoProperties appInfo;
  private final Clock clock;
  private final Instant startedAt;

  public HealthService(
      CapabilityRegistry capabilityRegistry,
      DialogRepository dialogRepository,
      OrchestrationProperties orchestrationProperties,
      AppInfoProperties appInfo,
      Clock clock) {
    this.capabilityRegistry = capabilityRegistry;
    this.dialogRepository = dialogRepository;
    this.orchestrationProperties = orchestrationProperties;
    this.appInfo = appInfo;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public HealthResponse check() {
    Map<String, Boolean> agents = new LinkedHashMap<>();
    for (Capability capability : capabilityRegistry.list()) {
      agents.put(capability.name(), capability.available());
    }
    boolean storageAvailable = storageAvailable();

    String status;
    if (!storageAvailable
        || !agents.getOrDefault(orchestrationProperties.getDefaultHandler(), false)) {
      status = UNHEALTHY;
    } else if (agents.containsValue(false)) {
      status = DEGRADED;
    } else {
      status = HEALTHY;
    }

    Instant now = clock.instant();
    return new HealthResponse(
        status,
        now,
        appInfo.getVersion(),
        appInfo.getEnvironment(),
        Math.max(0, Duration.between(startedAt, now).toSeconds()),
        agents,
        storageAvailable);
  }

  private boolean storageAvailable() {
    try {
      return dialogRepository.isAvailable();
    } catch (RuntimeException exception) {
      log.warn("Dialog storage availability check failed: {}", exception.getMessage());
      return false;
    }
  }
}
