package com.callcenter.backend.agent.handler;

import java.util.Locale;

public enum Specialization {
  GENERAL,
  SALES,
  TECHNICAL,
  ESCALATION;

  public static Specialization from(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Specialization must not be null");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException exception) {
      throw new IllegalArgumentException("Unknown specialization: " + value, exception);
    }
  }
}
