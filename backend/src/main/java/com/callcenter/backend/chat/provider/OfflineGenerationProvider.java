package com.callcenter.backend.chat.provider;

import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.config.OrchestrationProperties.IntentDefinition;
import com.callcenter.backend.agent.context.DialogContext;
import com.callcenter.backend.shared.text.KeywordMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic provider used when {@code app.chat.provider=mock}. Classification counts intent
 * keyword hits; completions are fixed templates keyed by the calling handler.
 */
public class OfflineGenerationProvider implements GenerationProvider {

  private static final double BASE_CONFIDENCE = 0.6d;
  private static final double CONFIDENCE_PER_HIT = 0.15d;

  private static final Map<String, String> REPLY_TEMPLATES =
      Map.of(
          "general",
          "Thank you for reaching out. I can help with general questions about our services: %s",
          "sales",
          "Our sales team is on it. Regarding your request \"%s\", let me check the available plans and billing options.",
          "technical",
          "Let's troubleshoot this together. About \"%s\": please restart the device and tell me if the problem persists.",
          "escalation",
          "I am a senior specialist and I have taken over your case. Regarding \"%s\", I will make sure it gets resolved.",
          "summarizer",
          "Summary: %s");

  private final OrchestrationProperties properties;

  public OfflineGenerationProvider(OrchestrationProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  @Override
  public String complete(GenerationRequest request) {
    String snippet = KeywordMatcher.truncate(request.userText(), 200);
    String template =
        REPLY_TEMPLATES.getOrDefault(
            request.caller(), "Thank you for your message. We are looking into: %s");
    return template.formatted(snippet);
  }

  @Override
  public IntentClassification classify(
      String text, DialogContext context, Collection<String> intents) {
    Map<String, IntentDefinition> definitions = properties.getIntents();
    List<IntentCandidate> candidates = new ArrayList<>();
    for (String intent : intents) {
      IntentDefinition definition = definitions.get(intent);
      if (definition == null) {
        continue;
      }
      int hits = KeywordMatcher.countMatches(text, definition.getKeywords());
      if (hits > 0) {
        double confidence = Math.min(1d, BASE_CONFIDENCE + CONFIDENCE_PER_HIT * (hits - 1));
        candidates.add(new IntentCandidate(intent, confidence));
      }
    }
    return new IntentClassification(candidates);
  }
}
