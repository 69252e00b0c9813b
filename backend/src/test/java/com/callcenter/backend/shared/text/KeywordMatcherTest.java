package com.callcenter.backend.shared.text;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordMatcherTest {

  @Test
  void matchesWholeWordsIgnoringCase() {
    assertThat(KeywordMatcher.containsAny("My BILL is wrong", List.of("bill"))).isTrue();
    assertThat(KeywordMatcher.containsAny("We lost a billion", List.of("bill"))).isFalse();
  }

  @Test
  void matchesMultiWordPhrasesAndTypographicApostrophes() {
    assertThat(KeywordMatcher.firstMatch("The app doesn’t  work at all", List.of("doesn't work")))
        .contains("doesn't work");
    assertThat(KeywordMatcher.containsAny("I want my money back!", List.of("money back"))).isTrue();
  }

  @Test
  void matchesCyrillicOnWordBoundaries() {
    assertThat(KeywordMatcher.containsAny("Нужен возврат денег", List.of("возврат"))).isTrue();
    assertThat(KeywordMatcher.containsAny("Невозвратный платеж", List.of("возврат"))).isFalse();
  }

  @Test
  void countsDistinctKeywordHits() {
    assertThat(
            KeywordMatcher.countMatches(
                "Refund the charge on my invoice", List.of("refund", "charge", "invoice", "plan")))
        .isEqualTo(3);
    assertThat(KeywordMatcher.countMatches(null, List.of("refund"))).isZero();
  }

  @Test
  void truncateCollapsesWhitespaceAndAddsEllipsis() {
    assertThat(KeywordMatcher.truncate("  a   b  ", 10)).isEqualTo("a b");
    assertThat(KeywordMatcher.truncate("abcdefghijkl", 8)).isEqualTo("abcde...");
    assertThat(KeywordMatcher.truncate(null, 8)).isEmpty();
  }
}
