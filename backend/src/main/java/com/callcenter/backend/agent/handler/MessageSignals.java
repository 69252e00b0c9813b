package com.callcenter.backend.agent.handler;

import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.shared.text.KeywordMatcher;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Keyword-level signals handlers use to decide on handoffs. */
public class MessageSignals {

  private final OrchestrationProperties properties;

  public MessageSignals(OrchestrationProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  /** Skill tags mentioned in {@code text}, in vocabulary order. */
  public Set<String> matchSkills(String text) {
    Set<String> tags = new LinkedHashSet<>();
    properties
        .getSkillKeywords()
        .forEach(
            (tag, keywords) -> {
              if (KeywordMatcher.containsAny(text, keywords)) {
                tags.add(tag);
              }
            });
    return tags;
  }

  public boolean isSupervisorRequest(String text) {
    return KeywordMatcher.containsAny(text, properties.getTriggers().getSupervisorKeywords());
  }

  public boolean signalsResolution(String text) {
    return KeywordMatcher.containsAny(text, properties.getTriggers().getResolutionKeywords());
  }

  public boolean isRefundRequest(String text) {
    return KeywordMatcher.containsAny(text, properties.getTriggers().getRefundKeywords());
  }

  public boolean isCriticalIncident(String text) {
    return KeywordMatcher.containsAny(text, properties.getTriggers().getCriticalIncidentKeywords());
  }
}
