package com.callcenter.backend.shared.text;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Case-insensitive phrase matching on word boundaries, so that {@code "bill"} matches "my bill"
 * but not "billion". Works for Latin and Cyrillic text alike.
 */
public final class KeywordMatcher {

  private KeywordMatcher() {}

  public static boolean containsAny(String text, Collection<String> keywords) {
    return firstMatch(text, keywords).isPresent();
  }

  public static Optional<String> firstMatch(String text, Collection<String> keywords) {
    if (!StringUtils.hasText(text) || keywords == null || keywords.isEmpty()) {
      return Optional.empty();
    }
    String normalized = normalize(text);
    for (String keyword : keywords) {
      if (StringUtils.hasText(keyword) && matches(normalized, normalize(keyword))) {
        return Optional.of(keyword);
      }
    }
    return Optional.empty();
  }

  public static int countMatches(String text, Collection<String> keywords) {
    if (!StringUtils.hasText(text) || keywords == null) {
      return 0;
    }
    String normalized = normalize(text);
    int hits = 0;
    for (String keyword : keywords) {
      if (StringUtils.hasText(keyword) && matches(normalized, normalize(keyword))) {
        hits++;
      }
    }
    return hits;
  }

  public static String truncate(String text, int maxLength) {
    if (text == null) {
      return "";
    }
    String compact = text.strip().replaceAll("\\s+", " ");
    if (maxLength <= 0 || compact.length() <= maxLength) {
      return compact;
    }
    return compact.substring(0, Math.max(0, maxLength - 3)).stripTrailing() + "...";
  }

  private static boolean matches(String normalizedText, String normalizedKeyword) {
    Pattern pattern =
        Pattern.compile(
            "(?<![\\p{L}\\p{N}])" + Pattern.quote(normalizedKeyword) + "(?![\\p{L}\\p{N}])");
    return pattern.matcher(normalizedText).find();
  }

  private static String normalize(String value) {
    return value.toLowerCase(Locale.ROOT).replace('’', '\'').replaceAll("\\s+", " ").strip();
  }
}
