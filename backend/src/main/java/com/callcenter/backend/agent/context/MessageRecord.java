package com.callcenter.backend.agent.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.springframework.util.StringUtils;

/**
 * One entry of a dialog's message sequence. Agent records always carry the name of the handler
 * that produced them; the current owner of a dialog is derived from that attribution.
 */
public record MessageRecord(
    String id,
    SenderRole sender,
    String text,
    String handlerName,
    Instant timestamp,
    Map<String, Object> metadata) {

  public MessageRecord {
    Objects.requireNonNull(sender, "sender must not be null");
    Objects.requireNonNull(text, "text must not be null");
    if (sender == SenderRole.AGENT && !StringUtils.hasText(handlerName)) {
      throw new IllegalArgumentException("Agent messages must be attributed to a handler");
    }
    if (sender != SenderRole.AGENT && handlerName != null) {
      throw new IllegalArgumentException("Only agent messages carry a handler name");
    }
    id = StringUtils.hasText(id) ? id : UUID.randomUUID().toString();
    timestamp = timestamp != null ? timestamp : Instant.now();
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static MessageRecord user(String text, Instant timestamp, Map<String, Object> metadata) {
    return new MessageRecord(null, SenderRole.USER, text, null, timestamp, metadata);
  }

  public static MessageRecord agent(
      String handlerName, String text, Instant timestamp, Map<String, Object> metadata) {
    return new MessageRecord(null, SenderRole.AGENT, text, handlerName, timestamp, metadata);
  }

  public static MessageRecord system(String text, Instant timestamp) {
    return new MessageRecord(null, SenderRole.SYSTEM, text, null, timestamp, null);
  }

  public boolean isAgent() {
    return sender == SenderRole.AGENT;
  }

  public Optional<Integer> intMetadata(String key) {
    Object value = metadata.get(key);
    if (value instanceof Number number) {
      return Optional.of(number.intValue());
    }
    if (value instanceof String string && StringUtils.hasText(string)) {
      try {
        return Optional.of(Integer.parseInt(string.trim()));
      } catch (NumberFormatException ignored) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  public Optional<String> stringMetadata(String key) {
    Object value = metadata.get(key);
    return value instanceof String string && StringUtils.hasText(string)
        ? Optional.of(string)
        : Optional.empty();
  }
}
