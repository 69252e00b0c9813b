package com.callcenter.backend.agent.orchestrator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a successful turn.
 *
 * @param currentHandler handler owning the dialog after this turn
 * @param previousHandler owner at the start of the turn, set only when ownership changed
 * @param handoffReason why ownership changed, set only when it did
 * @param intent intent classified by the router, {@code null} when no routing happened
 */
public record TurnResult(
    String responseText,
    String currentHandler,
    String previousHandler,
    String handoffReason,
    String intent,
    Map<String, Object> metadata) {

  public TurnResult {
    Objects.requireNonNull(responseText, "responseText must not be null");
    Objects.requireNonNull(currentHandler, "currentHandler must not be null");
    if ((handoffReason == null) != (previousHandler == null)) {
      throw new IllegalArgumentException(
          "previousHandler and handoffReason must be either both set or both absent");
    }
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public boolean handedOff() {
    return handoffReason != null;
  }
}
