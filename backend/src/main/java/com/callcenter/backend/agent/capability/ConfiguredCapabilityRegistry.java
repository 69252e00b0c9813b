package com.callcenter.backend.agent.capability;

import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.config.OrchestrationProperties.CapabilityDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/** Registry backed by {@code app.agents.capabilities}; availability toggles live in memory. */
@Slf4j
public class ConfiguredCapabilityRegistry implements CapabilityRegistry {

  private final Map<String, Capability> capabilities;
  private final ConcurrentMap<String, Boolean> availability = new ConcurrentHashMap<>();

  public ConfiguredCapabilityRegistry(OrchestrationProperties properties) {
    Objects.requireNonNull(properties, "properties must not be null");
    Map<String, CapabilityDefinition> definitions = properties.getCapabilities();
    Assert.state(
        definitions != null && !definitions.isEmpty(), "At least one capability must be defined");

    Map<String, Capability> registered = new LinkedHashMap<>();
    definitions.forEach(
        (name, definition) -> {
          Assert.state(
              StringUtils.hasText(definition.getSpecialization()),
              () -> "Capability '" + name + "' must declare a specialization");
          Capability capability =
              new Capability(
                  name,
                  definition.getSpecialization(),
                  definition.getSkills() != null ? new LinkedHashSet<>(definition.getSkills()) : null,
                  definition.isAvailable());
          registered.put(name, capability);
          availability.put(name, definition.isAvailable());
        });
    this.capabilities = Collections.unmodifiableMap(registered);

    Assert.state(
        capabilities.containsKey(properties.getDefaultHandler()),
        () -> "Default handler '" + properties.getDefaultHandler() + "' is not a registered capability");
    Assert.state(
        capabilities.containsKey(properties.getEscalationHandler()),
        () ->
            "Escalation handler '"
                + properties.getEscalationHandler()
                + "' is not a registered capability");
    log.info("Registered {} capabilities: {}", capabilities.size(), capabilities.keySet());
  }

  @Override
  public List<Capability> list() {
    List<Capability> result = new ArrayList<>(capabilities.size());
    capabilities.values().forEach(capability -> result.add(withCurrentAvailability(capability)));
    return List.copyOf(result);
  }

  @Override
  public Capability get(String name) {
    Capability capability = name != null ? capabilities.get(name) : null;
    if (capability == null) {
      throw new CapabilityNotFoundException(name);
    }
    return withCurrentAvailability(capability);
  }

  @Override
  public boolean contains(String name) {
    return name != null && capabilities.containsKey(name);
  }

  @Override
  public boolean isAvailable(String name) {
    return contains(name) && availability.getOrDefault(name, Boolean.FALSE);
  }

  @Override
  public Capability setAvailability(String name, boolean available) {
    Capability capability = get(name);
    Boolean previous = availability.put(name, available);
    if (!Objects.equals(previous, available)) {
      log.info("Capability '{}' availability changed: {} -> {}", name, previous, available);
    }
    return capability.withAvailability(available);
  }

  private Capability withCurrentAvailability(Capability capability) {
    return capability.withAvailability(availability.getOrDefault(capability.name(), Boolean.FALSE));
  }
}
