package com.callcenter.backend.agent.orchestrator;

/** Progress of a single turn through the orchestrator. */
public enum TurnState {
  UNRESOLVED,
  ROUTED,
  DISPATCHED,
  HANDOFF_PENDING,
  RESOLVED,
  FAILED
}
