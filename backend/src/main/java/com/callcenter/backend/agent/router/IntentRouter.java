package com.callcenter.backend.agent.router;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.config.OrchestrationProperties.IntentDefinition;
import com.callcenter.backend.agent.context.DialogContext;
import com.callcenter.backend.agent.exception.RoutingException;
import com.callcenter.backend.chat.provider.GenerationProvider;
import com.callcenter.backend.chat.provider.IntentCandidate;
import com.callcenter.backend.chat.provider.IntentClassification;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a user message to the handler that should own it. The escalation handler is never a routing
 * target; anything the router cannot place with confidence goes to the default handler.
 */
@Slf4j
public class IntentRouter {

  static final String REASON_NO_CANDIDATES = "no_candidates";
  static final String REASON_TIE = "ambiguous_tie";
  static final String REASON_LOW_CONFIDENCE = "low_confidence";
  static final String REASON_UNMAPPED_INTENT = "unmapped_intent";
  static final String REASON_ESCALATION_TARGET = "escalation_not_routable";
  static final String REASON_TARGET_UNAVAILABLE = "target_unavailable";

  private static final double TIE_EPSILON = 1e-9;

  private final GenerationProvider generationProvider;
  private final CapabilityRegistry capabilityRegistry;
  private final OrchestrationProperties properties;

  public IntentRouter(
      GenerationProvider generationProvider,
      CapabilityRegistry capabilityRegistry,
      OrchestrationProperties properties) {
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.capabilityRegistry =
        Objects.requireNonNull(capabilityRegistry, "capabilityRegistry must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  public RoutingDecision route(String userText, DialogContext context) {
    IntentClassification classification =
        generationProvider.classify(userText, context, properties.getIntents().keySet());
    List<IntentCandidate> candidates = classification.candidates();
    if (candidates.isEmpty()) {
      return fallback(null, 0d, REASON_NO_CANDIDATES);
    }

    IntentCandidate best = candidates.get(0);
    double top = best.confidence();
    Set<String> tiedHandlers = new TreeSet<>();
    for (IntentCandidate candidate : candidates) {
      if (Math.abs(candidate.confidence() - top) > TIE_EPSILON) {
        break;
      }
      tiedHandlers.add(String.valueOf(handlerFor(candidate.label())));
    }
    if (tiedHandlers.size() > 1) {
      return fallback(best.label(), top, REASON_TIE);
    }
    if (top < properties.getConfidenceThreshold()) {
      return fallback(best.label(), top, REASON_LOW_CONFIDENCE);
    }

    String target = handlerFor(best.label());
    if (target == null) {
      return fallback(best.label(), top, REASON_UNMAPPED_INTENT);
    }
    if (target.equals(properties.getEscalationHandler())) {
      return fallback(best.label(), top, REASON_ESCALATION_TARGET);
    }
    if (!capabilityRegistry.isAvailable(target)) {
      return fallback(best.label(), top, REASON_TARGET_UNAVAILABLE);
    }
    log.debug("Routed intent {} ({}) to handler {}", best.label(), top, target);
    return RoutingDecision.direct(target, best.label(), top);
  }

  private RoutingDecision fallback(String intent, double confidence, String reason) {
    String defaultHandler = properties.getDefaultHandler();
    if (!capabilityRegistry.isAvailable(defaultHandler)) {
      throw new RoutingException(
          "Default handler '" + defaultHandler + "' is unavailable (routing fallback: " + reason + ")");
    }
    log.debug("Routing fell back to {} ({}), intent={}", defaultHandler, reason, intent);
    return RoutingDecision.fallback(defaultHandler, intent, confidence, reason);
  }

  private String handlerFor(String intent) {
    IntentDefinition definition = properties.getIntents().get(intent);
    return definition != null ? definition.getHandler() : null;
  }
}
