package com.callcenter.backend.agent.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SenderRole {
  USER,
  AGENT,
  SYSTEM;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static SenderRole from(String value) {
    if (value == null) {
      return null;
    }
    for (SenderRole role : values()) {
      if (role.name().equalsIgnoreCase(value.trim())) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown sender role: " + value);
  }
}
