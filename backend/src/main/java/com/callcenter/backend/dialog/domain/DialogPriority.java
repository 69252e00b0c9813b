package com.callcenter.backend.dialog.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DialogPriority {
  LOW,
  NORMAL,
  HIGH,
  URGENT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static DialogPriority from(String value) {
    for (DialogPriority priority : values()) {
      if (priority.name().equalsIgnoreCase(value)) {
        return priority;
      }
    }
    throw new IllegalArgumentException(
        "Unknown priority '" + value + "', expected one of low, normal, high, urgent");
  }
}
