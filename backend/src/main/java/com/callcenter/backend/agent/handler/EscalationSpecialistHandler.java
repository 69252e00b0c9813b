package com.callcenter.backend.agent.handler;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.chat.provider.GenerationProvider;
import java.util.Map;
import java.util.Optional;

/**
 * Supervisor handler. Keeps the dialog until the customer confirms the issue is resolved, then
 * hands it back to the specialist it was escalated from. It never hands off to itself and never
 * hands back within the turn it was escalated in.
 */
public class EscalationSpecialistHandler extends AbstractSpecialistHandler {

  /** Specialist that escalated the dialog; carried on every escalation agent record. */
  public static final String ESCALATED_FROM = "escalated_from";

  private static final String SYSTEM_PROMPT =
      """
      You are a senior supervisor of a customer support call center. You handle complaints,
      refunds, critical incidents and customers who asked for a manager. Acknowledge the
      problem, take ownership and describe the concrete next steps and their timeline.
      """;

  public EscalationSpecialistHandler(
      String name,
      CapabilityRegistry capabilityRegistry,
      GenerationProvider generationProvider,
      MessageSignals signals,
      OrchestrationProperties properties) {
    super(name, capabilityRegistry, generationProvider, signals, properties);
  }

  @Override
  protected String systemPrompt() {
    return SYSTEM_PROMPT;
  }

  @Override
  protected HandoffDecision decideHandoff(HandlerRequest request, int unresolvedTurns) {
    if (request.isHandoffArrival() || !signals.signalsResolution(request.userText())) {
      return HandoffDecision.stay();
    }
    Optional<String> origin = escalatedFrom(request);
    if (origin.isEmpty()
        || origin.get().equals(name())
        || !capabilityRegistry.isAvailable(origin.get())) {
      return HandoffDecision.stay();
    }
    return HandoffDecision.handoffTo(origin.get(), HandoffReasons.ESCALATION_RESOLVED);
  }

  @Override
  protected void contributeMetadata(HandlerRequest request, Map<String, Object> metadata) {
    escalatedFrom(request).ifPresent(origin -> metadata.put(ESCALATED_FROM, origin));
  }

  private Optional<String> escalatedFrom(HandlerRequest request) {
    if (request.isHandoffArrival() && !name().equals(request.handoffFrom())) {
      return Optional.of(request.handoffFrom());
    }
    return ownLastMessage(request).flatMap(message -> message.stringMetadata(ESCALATED_FROM));
  }
}
