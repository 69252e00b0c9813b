package com.callcenter.backend.agent.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.callcenter.backend.agent.capability.ConfiguredCapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.context.DialogContext;
import com.callcenter.backend.agent.exception.RoutingException;
import com.callcenter.backend.chat.provider.GenerationProvider;
import com.callcenter.backend.chat.provider.IntentCandidate;
import com.callcenter.backend.chat.provider.IntentClassification;
import com.callcenter.backend.support.AgentTestFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IntentRouterTest {

  @Mock private GenerationProvider generationProvider;

  private OrchestrationProperties properties;
  private ConfiguredCapabilityRegistry registry;
  private IntentRouter router;

  @BeforeEach
  void setUp() {
    properties = AgentTestFixtures.properties();
    properties.getIntents().put("complaint", new OrchestrationProperties.IntentDefinition(
        "escalation", List.of("complaint")));
    registry = AgentTestFixtures.registry(properties);
    router = new IntentRouter(generationProvider, registry, properties);
  }

  @Test
  void routesTopCandidateToItsHandler() {
    classifyAs(new IntentCandidate("billing_issue", 0.9), new IntentCandidate("technical_issue", 0.4));

    RoutingDecision decision = router.route("My invoice is wrong", DialogContext.empty());

    assertThat(decision.target()).isEqualTo("sales");
    assertThat(decision.intent()).isEqualTo("billing_issue");
    assertThat(decision.confidence()).isEqualTo(0.9);
    assertThat(decision.fallback()).isFalse();
  }

  @Test
  void fallsBackWhenNothingWasClassified() {
    classifyAs();

    RoutingDecision decision = router.route("Hmm", DialogContext.empty());

    assertThat(decision.target()).isEqualTo("general");
    assertThat(decision.fallback()).isTrue();
    assertThat(decision.fallbackReason()).isEqualTo(IntentRouter.REASON_NO_CANDIDATES);
    assertThat(decision.intent()).isNull();
  }

  @Test
  void fallsBackBelowConfidenceThreshold() {
    classifyAs(new IntentCandidate("technical_issue", 0.3));

    RoutingDecision decision = router.route("something odd", DialogContext.empty());

    assertThat(decision.target()).isEqualTo("general");
    assertThat(decision.fallbackReason()).isEqualTo(IntentRouter.REASON_LOW_CONFIDENCE);
    assertThat(decision.intent()).isEqualTo("technical_issue");
  }

  @Test
  void tieBetweenDifferentHandlersFallsBackToDefault() {
    classifyAs(new IntentCandidate("billing_issue", 0.8), new IntentCandidate("technical_issue", 0.8));

    RoutingDecision decision = router.route("Billing page shows an error", DialogContext.empty());

    assertThat(decision.target()).isEqualTo("general");
    assertThat(decision.fallbackReason()).isEqualTo(IntentRouter.REASON_TIE);
  }

  @Test
  void tieBetweenIntentsOfTheSameHandlerIsNotAmbiguous() {
    classifyAs(
        new IntentCandidate("technical_issue", 0.75), new IntentCandidate("connectivity_issue", 0.75));

    RoutingDecision decision = router.route("Router error, no internet", DialogContext.empty());

    assertThat(decision.target()).isEqualTo("technical");
    assertThat(decision.fallback()).isFalse();
    assertThat(decision.intent()).isEqualTo("connectivity_issue");
  }

  @Test
  void neverRoutesToEscalationHandler() {
    classifyAs(new IntentCandidate("complaint", 0.95));

    RoutingDecision decision = router.route("I have a complaint", DialogContext.empty());

    assertThat(decision.target()).isEqualTo("general");
    assertThat(decision.fallbackReason()).isEqualTo(IntentRouter.REASON_ESCALATION_TARGET);
  }

  @Test
  void unavailableTargetFallsBackToDefault() {
    registry.setAvailability("sales", false);
    classifyAs(new IntentCandidate("purchase_inquiry", 0.9));

    RoutingDecision decision = router.route("I want to buy a plan", DialogContext.empty());

    assertThat(decision.target()).isEqualTo("general");
    assertThat(decision.fallbackReason()).isEqualTo(IntentRouter.REASON_TARGET_UNAVAILABLE);
  }

  @Test
  void failsWhenDefaultHandlerIsUnavailableToo() {
    registry.setAvailability("general", false);
    classifyAs();

    assertThatThrownBy(() -> router.route("Hello", DialogContext.empty()))
        .isInstanceOf(RoutingException.class)
        .hasMessageContaining("general");
  }

  private void classifyAs(IntentCandidate... candidates) {
    when(generationProvider.classify(anyString(), any(DialogContext.class), anyCollection()))
        .thenReturn(new IntentClassification(List.of(candidates)));
  }
}
