package com.callcenter.backend.agent.config;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.capability.ConfiguredCapabilityRegistry;
import com.callcenter.backend.agent.handler.EscalationSpecialistHandler;
import com.callcenter.backend.agent.handler.GeneralSpecialistHandler;
import com.callcenter.backend.agent.handler.MessageSignals;
import com.callcenter.backend.agent.handler.SalesSpecialistHandler;
import com.callcenter.backend.agent.handler.Specialization;
import com.callcenter.backend.agent.handler.SpecialistHandler;
import com.callcenter.backend.agent.handler.TechnicalSpecialistHandler;
import com.callcenter.backend.agent.orchestrator.DialogOrchestrator;
import com.callcenter.backend.agent.orchestrator.HandoffPolicy;
import com.callcenter.backend.agent.orchestrator.OrchestrationMetrics;
import com.callcenter.backend.agent.router.IntentRouter;
import com.callcenter.backend.chat.provider.GenerationProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.Assert;

@Configuration
@EnableConfigurationProperties(OrchestrationProperties.class)
public class AgentConfiguration {

  @Bean
  public CapabilityRegistry capabilityRegistry(OrchestrationProperties properties) {
    return new ConfiguredCapabilityRegistry(properties);
  }

  @Bean
  public MessageSignals messageSignals(OrchestrationProperties properties) {
    return new MessageSignals(properties);
  }

  @Bean
  public OrchestrationMetrics orchestrationMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    return new OrchestrationMetrics(meterRegistry.getIfAvailable());
  }

  @Bean
  public IntentRouter intentRouter(
      GenerationProvider generationProvider,
      CapabilityRegistry capabilityRegistry,
      OrchestrationProperties properties) {
    return new IntentRouter(generationProvider, capabilityRegistry, properties);
  }

  @Bean
  public HandoffPolicy handoffPolicy(
      CapabilityRegistry capabilityRegistry, OrchestrationProperties properties) {
    return new HandoffPolicy(capabilityRegistry, properties.getMaxReroutes());
  }

  @Bean
  public List<SpecialistHandler> specialistHandlers(
      OrchestrationProperties properties,
      CapabilityRegistry capabilityRegistry,
      GenerationProvider generationProvider,
      MessageSignals messageSignals) {
    List<SpecialistHandler> handlers = new ArrayList<>(properties.getCapabilities().size());
    properties
        .getCapabilities()
        .forEach(
            (name, definition) -> {
              Specialization specialization = Specialization.from(definition.getSpecialization());
              Assert.state(
                  specialization != Specialization.ESCALATION
                      || name.equals(properties.getEscalationHandler()),
                  () ->
                      "Escalation capability '"
                          + name
                          + "' must be the configured escalation handler");
              handlers.add(
                  switch (specialization) {
                    case GENERAL ->
                        new GeneralSpecialistHandler(
                            name, capabilityRegistry, generationProvider, messageSignals, properties);
                    case SALES ->
                        new SalesSpecialistHandler(
                            name, capabilityRegistry, generationProvider, messageSignals, properties);
                    case TECHNICAL ->
                        new TechnicalSpecialistHandler(
                            name, capabilityRegistry, generationProvider, messageSignals, properties);
                    case ESCALATION ->
                        new EscalationSpecialistHandler(
                            name, capabilityRegistry, generationProvider, messageSignals, properties);
                  });
            });
    return handlers;
  }

  @Bean
  public DialogOrchestrator dialogOrchestrator(
      CapabilityRegistry capabilityRegistry,
      IntentRouter intentRouter,
      List<SpecialistHandler> specialistHandlers,
      HandoffPolicy handoffPolicy,
      OrchestrationProperties properties,
      OrchestrationMetrics orchestrationMetrics) {
    return new DialogOrchestrator(
        capabilityRegistry,
        intentRouter,
        specialistHandlers,
        handoffPolicy,
        properties,
        orchestrationMetrics);
  }
}
