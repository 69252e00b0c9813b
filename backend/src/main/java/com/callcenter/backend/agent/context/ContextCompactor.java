package com.callcenter.backend.agent.context;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps a dialog's retained window within {@code maxWindowSize} messages. The oldest excess
 * messages are folded into a single summary record that replaces any earlier one.
 */
@Slf4j
public class ContextCompactor {

  private final ConversationSummarizer summarizer;
  private final int maxWindowSize;
  private final Clock clock;

  public ContextCompactor(ConversationSummarizer summarizer, int maxWindowSize, Clock clock) {
    this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    if (maxWindowSize < 1) {
      throw new IllegalArgumentException("maxWindowSize must be positive");
    }
    this.maxWindowSize = maxWindowSize;
  }

  public CompactionResult compact(String dialogId, DialogContext context) {
    List<MessageRecord> messages = context.messages();
    if (messages.size() <= maxWindowSize) {
      return CompactionResult.unchanged(context);
    }
    int excess = messages.size() - maxWindowSize;
    List<MessageRecord> dropped = messages.subList(0, excess);
    List<MessageRecord> retained = messages.subList(excess, messages.size());

    SummaryRecord previous = context.summary();
    String text = summarizer.summarize(previous, List.copyOf(dropped));
    int covered = (previous != null ? previous.coveredMessageCount() : 0) + excess;
    SummaryRecord summary = new SummaryRecord(text, covered, clock.instant());

    log.debug(
        "Compacted dialog {}: dropped {} messages, summary now covers {}", dialogId, excess, covered);
    return new CompactionResult(new DialogContext(summary, retained), true, excess);
  }
}
