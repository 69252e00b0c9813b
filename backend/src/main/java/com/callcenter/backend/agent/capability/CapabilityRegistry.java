package com.callcenter.backend.agent.capability;

import java.util.List;

/**
 * Catalog of the handlers known to the orchestrator. Availability may change between turns, so
 * callers query it fresh instead of caching results.
 */
public interface CapabilityRegistry {

  /** All registered capabilities in registration order. */
  List<Capability> list();

  /**
   * @throws CapabilityNotFoundException when no capability with this name is registered
   */
  Capability get(String name);

  boolean contains(String name);

  /** {@code false} for unknown names as well as for registered but disabled handlers. */
  boolean isAvailable(String name);

  Capability setAvailability(String name, boolean available);
}
