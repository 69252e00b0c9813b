package com.callcenter.backend.agent.capability;

public class CapabilityNotFoundException extends RuntimeException {

  private final String name;

  public CapabilityNotFoundException(String name) {
    super("Capability '" + name + "' is not registered");
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
