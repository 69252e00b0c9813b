package com.callcenter.backend.agent.handler;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.chat.provider.GenerationProvider;
import java.util.Optional;

/** Troubleshooting and account access. Outages, data loss and breaches go straight to escalation. */
public class TechnicalSpecialistHandler extends AbstractSpecialistHandler {

  private static final String SYSTEM_PROMPT =
      """
      You are a technical support engineer of a customer support call center. Diagnose the
      problem step by step, ask for error messages or device details when they are missing and
      give concrete instructions. Keep each answer to a few short steps.
      """;

  public TechnicalSpecialistHandler(
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
  protected Optional<HandoffDecision> specialistTrigger(HandlerRequest request) {
    if (signals.isCriticalIncident(request.userText())) {
      return Optional.of(
          HandoffDecision.handoffTo(
              properties.getEscalationHandler(), HandoffReasons.CRITICAL_INCIDENT));
    }
    return Optional.empty();
  }
}
