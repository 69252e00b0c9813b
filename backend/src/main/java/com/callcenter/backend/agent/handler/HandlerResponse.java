package com.callcenter.backend.agent.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record HandlerResponse(
    String responseText, HandoffDecision decision, Map<String, Object> metadata) {

  public HandlerResponse {
    Objects.requireNonNull(decision, "decision must not be null");
    responseText = responseText != null ? responseText : "";
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static HandlerResponse stay(String responseText) {
    return new HandlerResponse(responseText, HandoffDecision.stay(), Map.of());
  }
}
