package com.callcenter.backend.agent.orchestrator;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.exception.HandoffLoopException;
import com.callcenter.backend.agent.exception.InvalidTransitionException;
import com.callcenter.backend.agent.handler.HandoffDecision;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/** Validates handoff requests and bounds the number of hops resolved in one turn. */
public class HandoffPolicy {

  private final CapabilityRegistry capabilityRegistry;
  private final int maxReroutes;

  public HandoffPolicy(CapabilityRegistry capabilityRegistry, int maxReroutes) {
    this.capabilityRegistry =
        Objects.requireNonNull(capabilityRegistry, "capabilityRegistry must not be null");
    if (maxReroutes < 0) {
      throw new IllegalArgumentException("maxReroutes must not be negative");
    }
    this.maxReroutes = maxReroutes;
  }

  /**
   * @return the handoff target, which is registered and differs from {@code current}; it may still
   *     be unavailable
   * @throws InvalidTransitionException for self-handoffs and unknown targets
   */
  public String validate(String current, HandoffDecision decision) {
    String target = decision.target();
    if (!StringUtils.hasText(target)) {
      throw new InvalidTransitionException(current, target, "target is blank");
    }
    if (target.equals(current)) {
      throw new InvalidTransitionException(current, target, "handler cannot hand off to itself");
    }
    if (!capabilityRegistry.contains(target)) {
      throw new InvalidTransitionException(current, target, "target is not a registered capability");
    }
    return target;
  }

  /**
   * @throws HandoffLoopException once {@code reroutes} exceeds the configured bound
   */
  public void checkBound(int reroutes, List<String> chain) {
    if (reroutes > maxReroutes) {
      throw new HandoffLoopException(reroutes, chain);
    }
  }

  public int getMaxReroutes() {
    return maxReroutes;
  }
}
