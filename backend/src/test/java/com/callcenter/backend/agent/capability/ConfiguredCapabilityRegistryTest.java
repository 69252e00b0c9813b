package com.callcenter.backend.agent.capability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.support.AgentTestFixtures;
import org.junit.jupiter.api.Test;

class ConfiguredCapabilityRegistryTest {

  @Test
  void registersConfiguredCapabilitiesInOrder() {
    ConfiguredCapabilityRegistry registry =
        AgentTestFixtures.registry(AgentTestFixtures.properties());

    assertThat(registry.list())
        .extracting(Capability::name)
        .containsExactly("general", "sales", "technical", "escalation");
    assertThat(registry.get("sales").skills())
        .containsExactly("billing", "pricing", "purchase", "subscription", "refund");
    assertThat(registry.get("technical").hasSkill("connectivity")).isTrue();
  }

  @Test
  void availabilityToggleIsVisibleToLaterQueries() {
    ConfiguredCapabilityRegistry registry =
        AgentTestFixtures.registry(AgentTestFixtures.properties());

    Capability updated = registry.setAvailability("technical", false);

    assertThat(updated.available()).isFalse();
    assertThat(registry.isAvailable("technical")).isFalse();
    assertThat(registry.get("technical").available()).isFalse();

    registry.setAvailability("technical", true);
    assertThat(registry.isAvailable("technical")).isTrue();
  }

  @Test
  void unknownNamesAreNeverAvailable() {
    ConfiguredCapabilityRegistry registry =
        AgentTestFixtures.registry(AgentTestFixtures.properties());

    assertThat(registry.isAvailable("billing-bot")).isFalse();
    assertThat(registry.contains(null)).isFalse();
    assertThatThrownBy(() -> registry.get("billing-bot"))
        .isInstanceOf(CapabilityNotFoundException.class)
        .hasMessageContaining("billing-bot");
    assertThatThrownBy(() -> registry.setAvailability("billing-bot", true))
        .isInstanceOf(CapabilityNotFoundException.class);
  }

  @Test
  void rejectsConfigurationWithoutEscalationHandler() {
    OrchestrationProperties properties = AgentTestFixtures.properties();
    properties.getCapabilities().remove("escalation");

    assertThatThrownBy(() -> new ConfiguredCapabilityRegistry(properties))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Escalation handler");
  }

  @Test
  void honoursInitiallyDisabledCapabilities() {
    OrchestrationProperties properties = AgentTestFixtures.properties();
    properties.getCapabilities().get("sales").setAvailable(false);

    ConfiguredCapabilityRegistry registry = new ConfiguredCapabilityRegistry(properties);

    assertThat(registry.isAvailable("sales")).isFalse();
    assertThat(registry.isAvailable("general")).isTrue();
  }
}
