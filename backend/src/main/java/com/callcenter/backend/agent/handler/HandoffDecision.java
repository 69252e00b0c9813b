package com.callcenter.backend.agent.handler;

import java.util.Objects;

/** What a handler wants to happen after its response: keep the dialog, or pass it on. */
public record HandoffDecision(Type type, String target, String reason) {

  private static final HandoffDecision STAY = new HandoffDecision(Type.STAY, null, null);

  public enum Type {
    STAY,
    HANDOFF
  }

  public HandoffDecision {
    Objects.requireNonNull(type, "type must not be null");
    if (type == Type.HANDOFF) {
      Objects.requireNonNull(target, "handoff target must not be null");
      Objects.requireNonNull(reason, "handoff reason must not be null");
    }
  }

  public static HandoffDecision stay() {
    return STAY;
  }

  public static HandoffDecision handoffTo(String target, String reason) {
    return new HandoffDecision(Type.HANDOFF, target, reason);
  }

  public boolean isHandoff() {
    return type == Type.HANDOFF;
  }
}
