package com.callcenter.backend.agent.orchestrator;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class OrchestrationMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer turnTimer;

  public OrchestrationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.turnTimer =
        meterRegistry != null
            ? Timer.builder("dialog_turn_duration")
                .description("Duration of orchestrated dialog turns")
                .register(meterRegistry)
            : null;
  }

  public void turnCompleted(String handler, boolean handedOff, long elapsedNanos) {
    if (meterRegistry == null) {
      return;
    }
    meterRegistry
        .counter("dialog_turns_total", "handler", handler, "handoff", String.valueOf(handedOff))
        .increment();
    turnTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  public void turnFailed(Throwable error) {
    if (meterRegistry != null) {
      meterRegistry
          .counter("dialog_turn_failures_total", "exception", error.getClass().getSimpleName())
          .increment();
    }
  }

  public void handoff(String from, String to) {
    if (meterRegistry != null) {
      meterRegistry.counter("dialog_handoffs_total", "from", from, "to", to).increment();
    }
  }

  public void routingFallback(String reason) {
    if (meterRegistry != null) {
      meterRegistry.counter("dialog_routing_fallbacks_total", "reason", reason).increment();
    }
  }

  public void loopEscalation() {
    if (meterRegistry != null) {
      meterRegistry.counter("dialog_routing_loops_total").increment();
    }
  }

  public void invalidTransition() {
    if (meterRegistry != null) {
      meterRegistry.counter("dialog_invalid_transitions_total").increment();
    }
  }

  public void compaction(int droppedMessages) {
    if (meterRegistry != null) {
      meterRegistry.counter("dialog_compactions_total").increment();
      meterRegistry.counter("dialog_compacted_messages_total").increment(droppedMessages);
    }
  }
}
