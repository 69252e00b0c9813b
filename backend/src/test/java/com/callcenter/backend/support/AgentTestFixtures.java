package com.callcenter.backend.support;

import com.callcenter.backend.agent.capability.ConfiguredCapabilityRegistry;
import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.context.DialogContext;
import com.callcenter.backend.agent.context.MessageRecord;
import com.callcenter.backend.agent.handler.MessageSignals;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Shared builders for agent-level tests; everything uses the default four-handler setup. */
public final class AgentTestFixtures {

  public static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  private AgentTestFixtures() {}

  public static OrchestrationProperties properties() {
    return new OrchestrationProperties();
  }

  public static ConfiguredCapabilityRegistry registry(OrchestrationProperties properties) {
    return new ConfiguredCapabilityRegistry(properties);
  }

  public static MessageSignals signals(OrchestrationProperties properties) {
    return new MessageSignals(properties);
  }

  public static MessageRecord user(String text) {
    return MessageRecord.user(text, NOW, Map.of());
  }

  public static MessageRecord agent(String handler, String text) {
    return MessageRecord.agent(handler, text, NOW, Map.of());
  }

  public static MessageRecord agent(String handler, String text, Map<String, Object> metadata) {
    return MessageRecord.agent(handler, text, NOW, metadata);
  }

  /** Context whose newest agent record belongs to {@code owner}. */
  public static DialogContext ownedBy(String owner, Map<String, Object> metadata) {
    List<MessageRecord> messages = new ArrayList<>();
    messages.add(user("Hello"));
    messages.add(agent(owner, "How can I help?", metadata));
    return DialogContext.of(messages);
  }

  public static DialogContext ownedBy(String owner) {
    return ownedBy(owner, Map.of());
  }
}
