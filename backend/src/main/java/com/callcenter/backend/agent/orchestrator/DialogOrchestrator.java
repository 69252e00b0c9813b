package com.callcenter.backend.agent.orchestrator;

import com.callcenter.backend.agent.capability.CapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.context.DialogContext;
import com.callcenter.backend.agent.exception.HandoffLoopException;
import com.callcenter.backend.agent.exception.InvalidTransitionException;
import com.callcenter.backend.agent.exception.RoutingException;
import com.callcenter.backend.agent.handler.HandlerRequest;
import com.callcenter.backend.agent.handler.HandlerResponse;
import com.callcenter.backend.agent.handler.HandoffDecision;
import com.callcenter.backend.agent.handler.HandoffReasons;
import com.callcenter.backend.agent.handler.SpecialistHandler;
import com.callcenter.backend.agent.router.IntentRouter;
import com.callcenter.backend.agent.router.RoutingDecision;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Drives one dialog turn: resolves the owning handler from the message history, routes when there
 * is none, dispatches, and follows handoff requests until a handler keeps the turn.
 *
 * <p>The orchestrator holds no per-dialog state. Everything it needs is in the supplied
 * {@link DialogContext}; everything it produces is in the returned {@link TurnResult}.
 */
@Slf4j
public class DialogOrchestrator {

  public static final String META_REROUTE_COUNT = "reroute_count";
  public static final String META_HANDOFF_CHAIN = "handoff_chain";
  public static final String META_ROUTED = "routed";
  public static final String META_TURN_STATE = "turn_state";
  public static final String META_ROUTING_CONFIDENCE = "routing_confidence";
  public static final String META_ROUTING_FALLBACK = "routing_fallback";
  public static final String META_FORCED_ESCALATION = "forced_escalation";

  private final CapabilityRegistry capabilityRegistry;
  private final IntentRouter intentRouter;
  private final Map<String, SpecialistHandler> handlers;
  private final HandoffPolicy handoffPolicy;
  private final OrchestrationProperties properties;
  private final OrchestrationMetrics metrics;

  public DialogOrchestrator(
      CapabilityRegistry capabilityRegistry,
      IntentRouter intentRouter,
      Collection<? extends SpecialistHandler> handlers,
      HandoffPolicy handoffPolicy,
      OrchestrationProperties properties,
      OrchestrationMetrics metrics) {
    this.capabilityRegistry =
        Objects.requireNonNull(capabilityRegistry, "capabilityRegistry must not be null");
    this.intentRouter = Objects.requireNonNull(intentRouter, "intentRouter must not be null");
    this.handoffPolicy = Objects.requireNonNull(handoffPolicy, "handoffPolicy must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.metrics = metrics != null ? metrics : new OrchestrationMetrics(null);

    Map<String, SpecialistHandler> byName = new LinkedHashMap<>();
    for (SpecialistHandler handler : handlers) {
      SpecialistHandler duplicate = byName.put(handler.name(), handler);
      Assert.state(duplicate == null, () -> "Duplicate handler for capability " + handler.name());
      Assert.state(
          capabilityRegistry.contains(handler.name()),
          () -> "Handler " + handler.name() + " has no registered capability");
    }
    this.handlers = Map.copyOf(byName);
  }

  public TurnResult processTurn(String dialogId, String userText, DialogContext context) {
    if (!StringUtils.hasText(dialogId)) {
      throw new IllegalArgumentException("dialogId must not be blank");
    }
    if (!StringUtils.hasText(userText)) {
      throw new IllegalArgumentException("userText must not be blank");
    }
    DialogContext snapshot = context != null ? context : DialogContext.empty();
    TurnTrace trace = new TurnTrace();
    long started = System.nanoTime();
    try {
      TurnResult result = runTurn(dialogId, userText, snapshot, trace);
      metrics.turnCompleted(result.currentHandler(), result.handedOff(), System.nanoTime() - started);
      return result;
    } catch (RuntimeException exception) {
      TurnState failedIn = trace.state;
      trace.state = TurnState.FAILED;
      metrics.turnFailed(exception);
      log.warn(
          "Turn for dialog {} failed in state {} (handler chain {}): {}",
          dialogId,
          failedIn,
          trace.chain,
          exception.getMessage());
      throw exception;
    }
  }

  private TurnResult runTurn(
      String dialogId, String userText, DialogContext context, TurnTrace trace) {
    String owner = context.currentHandler().orElse(null);
    String current;
    String baseline = owner;

    if (owner != null && capabilityRegistry.isAvailable(owner) && handlers.containsKey(owner)) {
      current = owner;
    } else {
      if (owner != null) {
        log.info("Handler {} owning dialog {} is unavailable, re-routing", owner, dialogId);
      }
      trace.state = TurnState.UNRESOLVED;
      RoutingDecision routing = route(userText, context, trace);
      current = routing.target();
      if (baseline == null) {
        baseline = current;
      }
    }

    trace.chain.add(current);
    String handoffFrom = null;
    String lastReason = null;
    HandlerResponse response;
    while (true) {
      response =
          dispatch(
              current,
              new HandlerRequest(dialogId, userText, context, handoffFrom, lastReason),
              trace);
      HandoffDecision decision = response.decision();
      if (!decision.isHandoff()) {
        break;
      }
      trace.state = TurnState.HANDOFF_PENDING;

      String target;
      try {
        target = handoffPolicy.validate(current, decision);
      } catch (InvalidTransitionException exception) {
        metrics.invalidTransition();
        log.warn("Ignoring handoff in dialog {}: {}", dialogId, exception.getMessage());
        break;
      }

      String reason = decision.reason();
      if (!capabilityRegistry.isAvailable(target)) {
        log.info(
            "Handoff target {} is unavailable in dialog {}, asking the router instead",
            target,
            dialogId);
        RoutingDecision routing = route(userText, context, trace);
        if (routing.target().equals(current)) {
          break;
        }
        target = routing.target();
        reason = HandoffReasons.HANDOFF_TARGET_UNAVAILABLE;
      }

      trace.reroutes++;
      try {
        handoffPolicy.checkBound(trace.reroutes, trace.chain);
      } catch (HandoffLoopException exception) {
        metrics.loopEscalation();
        log.warn("Forcing escalation in dialog {}: {}", dialogId, exception.getMessage());
        String escalation = properties.getEscalationHandler();
        lastReason = HandoffReasons.ROUTING_LOOP;
        trace.forcedEscalation = true;
        if (!current.equals(escalation)) {
          handoffFrom = current;
          current = escalation;
          trace.chain.add(escalation);
          metrics.handoff(handoffFrom, escalation);
          response =
              dispatch(
                  current,
                  new HandlerRequest(dialogId, userText, context, handoffFrom, lastReason),
                  trace);
        }
        break;
      }

      metrics.handoff(current, target);
      log.debug("Dialog {} handed off {} -> {} ({})", dialogId, current, target, reason);
      handoffFrom = current;
      current = target;
      lastReason = reason;
      trace.chain.add(target);
    }

    trace.state = TurnState.RESOLVED;
    boolean ownerChanged = !current.equals(baseline);
    String handoffReason = null;
    String previousHandler = null;
    if (ownerChanged) {
      handoffReason = lastReason != null ? lastReason : HandoffReasons.HANDLER_UNAVAILABLE;
      previousHandler = baseline;
    }

    Map<String, Object> metadata = new LinkedHashMap<>(response.metadata());
    metadata.put(META_REROUTE_COUNT, trace.reroutes);
    metadata.put(META_HANDOFF_CHAIN, List.copyOf(trace.chain));
    metadata.put(META_ROUTED, trace.routed);
    if (trace.routing != null) {
      metadata.put(META_ROUTING_CONFIDENCE, trace.routing.confidence());
      if (trace.routing.fallback()) {
        metadata.put(META_ROUTING_FALLBACK, trace.routing.fallbackReason());
      }
    }
    if (trace.forcedEscalation) {
      metadata.put(META_FORCED_ESCALATION, true);
    }
    metadata.put(META_TURN_STATE, trace.state.name());

    log.info(
        "Dialog {} turn resolved by {} (previous={}, reason={}, chain={})",
        dialogId,
        current,
        previousHandler,
        handoffReason,
        trace.chain);
    return new TurnResult(
        response.responseText(),
        current,
        previousHandler,
        handoffReason,
        trace.routing != null ? trace.routing.intent() : null,
        metadata);
  }

  private RoutingDecision route(String userText, DialogContext context, TurnTrace trace) {
    RoutingDecision routing = intentRouter.route(userText, context);
    if (routing.fallback()) {
      metrics.routingFallback(routing.fallbackReason());
    }
    if (trace.routing == null || trace.routing.intent() == null) {
      trace.routing = routing;
    }
    trace.routed = true;
    trace.state = TurnState.ROUTED;
    return routing;
  }

  private HandlerResponse dispatch(String name, HandlerRequest request, TurnTrace trace) {
    if (!capabilityRegistry.isAvailable(name)) {
      throw new RoutingException("Handler '" + name + "' is not available for dispatch");
    }
    SpecialistHandler handler = handlers.get(name);
    if (handler == null) {
      throw new RoutingException("No specialist handler registered for capability '" + name + "'");
    }
    trace.state = TurnState.DISPATCHED;
    return handler.handle(request);
  }

  private static final class TurnTrace {
    private TurnState state = TurnState.UNRESOLVED;
    private final List<String> chain = new ArrayList<>();
    private int reroutes;
    private boolean routed;
    private boolean forcedEscalation;
    private RoutingDecision routing;
  }
}
