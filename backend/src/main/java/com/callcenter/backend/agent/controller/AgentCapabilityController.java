package com.callcenter.backend.agent.controller;

import com.callcenter.backend.agent.api.AvailabilityRequest;
import com.callcenter.backend.agent.api.CapabilityResponse;
import com.callcenter.backend.agent.capability.Capability;
import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentCapabilityController {

  private final CapabilityRegistry capabilityRegistry;
  private final OrchestrationProperties properties;

  public AgentCapabilityController(
      CapabilityRegistry capabilityRegistry, OrchestrationProperties properties) {
    this.capabilityRegistry = capabilityRegistry;
    this.properties = properties;
  }

  @GetMapping
  public List<CapabilityResponse> listCapabilities() {
    return capabilityRegistry.list().stream().map(this::toResponse).toList();
  }

  @GetMapping("/{name}")
  public CapabilityResponse getCapability(@PathVariable String name) {
    return toResponse(capabilityRegistry.get(name));
  }

  @PutMapping("/{name}/availability")
  public CapabilityResponse updateAvailability(
      @PathVariable String name, @Valid @RequestBody AvailabilityRequest request) {
    return toResponse(capabilityRegistry.setAvailability(name, request.available()));
  }

  private CapabilityResponse toResponse(Capability capability) {
    return new CapabilityResponse(
        capability.name(),
        capability.specialization(),
        List.copyOf(capability.skills()),
        capability.available(),
        capability.name().equals(properties.getDefaultHandler()),
        capability.name().equals(properties.getEscalationHandler()));
  }
}
