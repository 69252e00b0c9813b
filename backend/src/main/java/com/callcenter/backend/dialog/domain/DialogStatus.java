package com.callcenter.backend.dialog.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DialogStatus {
  ACTIVE,
  CLOSED,
  ESCALATED,
  PENDING;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DialogStatus from(String value) {
    for (DialogStatus status : values()) {
      if (status.name().equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown dialog status: " + value);
  }

  public boolean acceptsMessages() {
    return this != CLOSED;
  }
}
