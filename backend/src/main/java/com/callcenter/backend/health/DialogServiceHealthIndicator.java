package com.callcenter.backend.health;

import com.callcenter.backend.health.api.HealthResponse;
import com.callcenter.backend.health.service.HealthService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Exposes the dialog service health summary through the actuator health endpoint. */
@Component
public class DialogServiceHealthIndicator implements HealthIndicator {

  private final HealthService healthService;
  private final Timer latencyTimer;
  private final Counter errorCounter;

  public DialogServiceHealthIndicator(HealthService healthService, MeterRegistry meterRegistry) {
    this.healthService = healthService;
    this.latencyTimer =
        Timer.builder("dialog_health_check_latency")
            .description("Latency of dialog service health checks")
            .register(meterRegistry);
    this.errorCounter =
        Counter.builder("dialog_health_check_errors_total")
            .description("Number of dialog service health check errors")
            .register(meterRegistry);
  }

  @Override
  public Health health() {
    long started = System.nanoTime();
    try {
      HealthResponse response = healthService.check();
      latencyTimer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);

      Health.Builder builder =
          switch (response.status()) {
            case HealthService.HEALTHY -> Health.up();
            case HealthService.DEGRADED -> Health.up().withDetail("status", "degraded");
            default -> Health.down();
          };
      return builder
          .withDetail("agents", response.agentsAvailable())
          .withDetail("storageAvailable", response.storageAvailable())
          .withDetail("uptimeSeconds", response.uptimeSeconds())
          .build();
    } catch (Exception ex) {
      errorCounter.increment();
      return Health.down(ex).build();
    }
  }
}
