package com.callcenter.backend.agent.context;

import java.time.Instant;
import java.util.Objects;

/** Condensed form of the messages dropped from a dialog's retained window. */
public record SummaryRecord(String text, int coveredMessageCount, Instant createdAt) {

  public SummaryRecord {
    Objects.requireNonNull(text, "text must not be null");
    if (coveredMessageCount < 0) {
      throw new IllegalArgumentException("coveredMessageCount must not be negative");
    }
  }
}
