package com.callcenter.backend.chat.provider;

import java.util.Comparator;
import java.util.List;

/** Ranked intent candidates, highest confidence first, ties ordered by label. */
public record IntentClassification(List<IntentCandidate> candidates) {

  private static final Comparator<IntentCandidate> RANKING =
      Comparator.comparingDouble(IntentCandidate::confidence)
          .reversed()
          .thenComparing(IntentCandidate::label);

  public IntentClassification {
    candidates =
        candidates == null
            ? List.of()
            : candidates.stream()
                .filter(candidate -> candidate != null && candidate.label() != null)
                .sorted(RANKING)
                .toList();
  }

  public static IntentClassification empty() {
    return new IntentClassification(List.of());
  }
}
