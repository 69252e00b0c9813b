package com.callcenter.backend.agent.handler;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.chat.provider.GenerationProvider;
import java.util.Optional;

/** Plans, pricing, purchases and billing. Refund requests always go to escalation. */
public class SalesSpecialistHandler extends AbstractSpecialistHandler {

  private static final String SYSTEM_PROMPT =
      """
      You are a sales and billing specialist of a customer support call center. Help with plans,
      pricing, purchases, subscriptions and invoices. Recommend options that fit the customer's
      needs and explain charges clearly. You are not allowed to approve refunds.
      """;

  public SalesSpecialistHandler(
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
    if (signals.isRefundRequest(request.userText())) {
      return Optional.of(
          HandoffDecision.handoffTo(
              properties.getEscalationHandler(), HandoffReasons.REFUND_ESCALATION));
    }
    return Optional.empty();
  }
}
