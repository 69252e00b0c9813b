package com.callcenter.backend.health.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.callcenter.backend.agent.capability.ConfiguredCapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.common.config.AppInfoProperties;
import com.callcenter.backend.dialog.exception.DialogStorageException;
import com.callcenter.backend.dialog.persistence.DialogRepository;
import com.callcenter.backend.health.api.HealthResponse;
import com.callcenter.backend.support.AgentTestFixtures;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HealthServiceTest {

  @Mock private DialogRepository dialogRepository;

  private ConfiguredCapabilityRegistry registry;
  private HealthService healthService;

  @BeforeEach
  void setUp() {
    OrchestrationProperties properties = AgentTestFixtures.properties();
    registry = AgentTestFixtures.registry(properties);
    AppInfoProperties appInfo = new AppInfoProperties();
    appInfo.setEnvironment("test");
    healthService =
        new HealthService(
            registry,
            dialogRepository,
            properties,
            appInfo,
            Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void healthyWhenEverythingIsAvailable() {
    when(dialogRepository.isAvailable()).thenReturn(true);

    HealthResponse response = healthService.check();

    assertThat(response.status()).isEqualTo(HealthService.HEALTHY);
    assertThat(response.agentsAvailable())
        .containsOnlyKeys("general", "sales", "technical", "escalation")
        .doesNotContainValue(false);
    assertThat(response.environment()).isEqualTo("test");
    assertThat(response.uptimeSeconds()).isZero();
  }

  @Test
  void degradedWhenASpecialistIsDisabled() {
    when(dialogRepository.isAvailable()).thenReturn(true);
    registry.setAvailability("technical", false);

    assertThat(healthService.check().status()).isEqualTo(HealthService.DEGRADED);
  }

  @Test
  void unhealthyWithoutDefaultHandler() {
    when(dialogRepository.isAvailable()).thenReturn(true);
    registry.setAvailability("general", false);

    assertThat(healthService.check().status()).isEqualTo(HealthService.UNHEALTHY);
  }

  @Test
  void unhealthyWhenStorageFails() {
    when(dialogRepository.isAvailable()).thenThrow(new DialogStorageException("disk gone", null));

    HealthResponse response = healthService.check();

    assertThat(response.status()).isEqualTo(HealthService.UNHEALTHY);
    assertThat(response.storageAvailable()).isFalse();
  }
}
