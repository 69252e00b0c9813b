package com.callcenter.backend.agent.handler;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.chat.provider.GenerationProvider;

public class GeneralSpecialistHandler extends AbstractSpecialistHandler {

  private static final String SYSTEM_PROMPT =
      """
      You are the first-line consultant of a customer support call center. Answer general
      questions about the company, its services, opening hours and contacts. Be polite and
      concise. Do not invent prices or technical diagnoses; say that a specialist will help.
      """;

  public GeneralSpecialistHandler(
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
}
