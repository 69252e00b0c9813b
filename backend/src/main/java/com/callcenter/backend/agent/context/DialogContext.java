package com.callcenter.backend.agent.context;

import java.util.List;
import java.util.Optional;

/** Immutable snapshot of a dialog's retained messages plus its optional summary. */
public record DialogContext(SummaryRecord summary, List<MessageRecord> messages) {

  private static final DialogContext EMPTY = new DialogContext(null, List.of());

  public DialogContext {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public static DialogContext empty() {
    return EMPTY;
  }

  public static DialogContext of(List<MessageRecord> messages) {
    return new DialogContext(null, messages);
  }

  public Optional<MessageRecord> lastAgentMessage() {
    for (int i = messages.size() - 1; i >= 0; i--) {
      MessageRecord message = messages.get(i);
      if (message.isAgent()) {
        return Optional.of(message);
      }
    }
    return Optional.empty();
  }

  /** Handler attribution of the newest agent record, if any. */
  public Optional<String> currentHandler() {
    return lastAgentMessage().map(MessageRecord::handlerName);
  }

  public int size() {
    return messages.size();
  }
}
