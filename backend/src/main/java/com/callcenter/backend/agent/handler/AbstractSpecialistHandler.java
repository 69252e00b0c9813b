package com.callcenter.backend.agent.handler;

import com.callcenter.backend.agent.capability.Capability;
import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.config.OrchestrationProperties.CapabilityDefinition;
import com.callcenter.backend.agent.context.MessageRecord;
import com.callcenter.backend.chat.provider.GenerationOverrides;
import com.callcenter.backend.chat.provider.GenerationProvider;
import com.callcenter.backend.chat.provider.GenerationRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Shared turn handling for specialists: evaluates the declared handoff triggers, tracks the
 * unresolved-turn counter and asks the generation provider for the reply.
 *
 * <p>Triggers are checked in a fixed order: explicit supervisor request, the variant's own trigger,
 * request outside the handler's skills, then the unresolved-turn limit.
 */
@Slf4j
public abstract class AbstractSpecialistHandler implements SpecialistHandler {

  /** Consecutive turns this handler has owned without the customer confirming resolution. */
  public static final String UNRESOLVED_TURNS = "unresolved_turns";

  private static final String TRANSFER_NOTE =
      "The conversation is being transferred to the %s team. Acknowledge the request in one or two"
          + " sentences and tell the customer a colleague will continue.";

  private final String name;
  protected final CapabilityRegistry capabilityRegistry;
  protected final GenerationProvider generationProvider;
  protected final MessageSignals signals;
  protected final OrchestrationProperties properties;

  protected AbstractSpecialistHandler(
      String name,
      CapabilityRegistry capabilityRegistry,
      GenerationProvider generationProvider,
      MessageSignals signals,
      OrchestrationProperties properties) {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("Handler name must not be blank");
    }
    this.name = name;
    this.capabilityRegistry =
        Objects.requireNonNull(capabilityRegistry, "capabilityRegistry must not be null");
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.signals = Objects.requireNonNull(signals, "signals must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public final HandlerResponse handle(HandlerRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    int unresolvedTurns = countUnresolvedTurns(request);
    HandoffDecision decision = decideHandoff(request, unresolvedTurns);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(UNRESOLVED_TURNS, unresolvedTurns);
    contributeMetadata(request, metadata);

    String prompt = systemPrompt();
    if (decision.isHandoff()) {
      prompt = prompt + "\n\n" + TRANSFER_NOTE.formatted(decision.target());
      log.info(
          "Handler {} requests handoff to {} in dialog {}: {}",
          name,
          decision.target(),
          request.dialogId(),
          decision.reason());
    }
    String reply =
        generationProvider.complete(
            new GenerationRequest(
                name,
                prompt,
                request.context(),
                request.userText(),
                GenerationOverrides.temperature(temperature())));
    return new HandlerResponse(reply, decision, metadata);
  }

  protected abstract String systemPrompt();

  /** Variant-specific trigger, evaluated after the supervisor check. */
  protected Optional<HandoffDecision> specialistTrigger(HandlerRequest request) {
    return Optional.empty();
  }

  protected void contributeMetadata(HandlerRequest request, Map<String, Object> metadata) {}

  protected HandoffDecision decideHandoff(HandlerRequest request, int unresolvedTurns) {
    String text = request.userText();
    String escalation = properties.getEscalationHandler();
    if (signals.isSupervisorRequest(text)) {
      return HandoffDecision.handoffTo(escalation, HandoffReasons.SUPERVISOR_REQUESTED);
    }
    Optional<HandoffDecision> specific = specialistTrigger(request);
    if (specific.isPresent()) {
      return specific.get();
    }
    Optional<HandoffDecision> outside = outsideSkills(text);
    if (outside.isPresent()) {
      return outside.get();
    }
    int limit = properties.getMaxUnresolvedTurns();
    if (limit > 0 && unresolvedTurns >= limit) {
      return HandoffDecision.handoffTo(escalation, HandoffReasons.unresolvedAfter(unresolvedTurns));
    }
    return HandoffDecision.stay();
  }

  /** Latest agent record of this handler in the retained window, if it is the newest agent record. */
  protected Optional<MessageRecord> ownLastMessage(HandlerRequest request) {
    return request.context().lastAgentMessage().filter(message -> name.equals(message.handlerName()));
  }

  private int countUnresolvedTurns(HandlerRequest request) {
    if (signals.signalsResolution(request.userText())) {
      return 0;
    }
    int previous =
        ownLastMessage(request)
            .flatMap(message -> message.intMetadata(UNRESOLVED_TURNS))
            .orElse(0);
    return previous + 1;
  }

  private Optional<HandoffDecision> outsideSkills(String text) {
    Set<String> tags = signals.matchSkills(text);
    if (tags.isEmpty()) {
      return Optional.empty();
    }
    Capability own = capabilityRegistry.get(name);
    if (tags.stream().anyMatch(own::hasSkill)) {
      return Optional.empty();
    }
    String escalation = properties.getEscalationHandler();
    for (String tag : tags) {
      for (Capability candidate : capabilityRegistry.list()) {
        if (candidate.name().equals(name)
            || candidate.name().equals(escalation)
            || !candidate.available()) {
          continue;
        }
        if (candidate.hasSkill(tag)) {
          return Optional.of(
              HandoffDecision.handoffTo(candidate.name(), HandoffReasons.outsideSkills(tag)));
        }
      }
    }
    return Optional.empty();
  }

  private Double temperature() {
    CapabilityDefinition definition = properties.getCapabilities().get(name);
    return definition != null ? definition.getTemperature() : null;
  }
}
