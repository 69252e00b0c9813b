package com.callcenter.backend.agent.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.callcenter.backend.agent.capability.ConfiguredCapabilityRegistry;
import com.callcenter.backend.agent.exception.HandoffLoopException;
import com.callcenter.backend.agent.exception.InvalidTransitionException;
import com.callcenter.backend.agent.handler.HandoffDecision;
import com.callcenter.backend.support.AgentTestFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class HandoffPolicyTest {

  private final ConfiguredCapabilityRegistry registry =
      AgentTestFixtures.registry(AgentTestFixtures.properties());
  private final HandoffPolicy policy = new HandoffPolicy(registry, 2);

  @Test
  void acceptsRegisteredTargetEvenWhenUnavailable() {
    registry.setAvailability("technical", false);

    assertThat(policy.validate("general", HandoffDecision.handoffTo("technical", "x")))
        .isEqualTo("technical");
  }

  @Test
  void rejectsSelfAndUnknownTargets() {
    assertThatThrownBy(() -> policy.validate("sales", HandoffDecision.handoffTo("sales", "x")))
        .isInstanceOf(InvalidTransitionException.class)
        .hasMessageContaining("itself");
    assertThatThrownBy(() -> policy.validate("sales", HandoffDecision.handoffTo("legal", "x")))
        .isInstanceOf(InvalidTransitionException.class)
        .hasMessageContaining("legal");
  }

  @Test
  void boundAllowsConfiguredNumberOfReroutes() {
    assertThatCode(() -> policy.checkBound(2, List.of("a", "b", "a"))).doesNotThrowAnyException();

    assertThatThrownBy(() -> policy.checkBound(3, List.of("a", "b", "a", "b")))
        .isInstanceOfSatisfying(
            HandoffLoopException.class,
            exception -> {
              assertThat(exception.getReroutes()).isEqualTo(3);
              assertThat(exception.getChain()).containsExactly("a", "b", "a", "b");
            });
  }
}
