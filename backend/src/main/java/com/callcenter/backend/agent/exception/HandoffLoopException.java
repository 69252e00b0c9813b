package com.callcenter.backend.agent.exception;

import java.util.List;

/**
 * Raised when a handoff chain exceeds the configured reroute bound. The orchestrator recovers from
 * it by forcing escalation.
 */
public class HandoffLoopException extends OrchestrationException {

  private final int reroutes;
  private final List<String> chain;

  public HandoffLoopException(int reroutes, List<String> chain) {
    super("Handoff chain exceeded reroute bound after " + reroutes + " hops: " + chain);
    this.reroutes = reroutes;
    this.chain = List.copyOf(chain);
  }

  public int getReroutes() {
    return reroutes;
  }

  public List<String> getChain() {
    return chain;
  }
}
