package com.callcenter.backend.agent.context;

import java.util.List;

/** Produces the text of the summary that replaces messages dropped from the retained window. */
public interface ConversationSummarizer {

  /**
   * @param previous summary currently held by the dialog, may be {@code null}
   * @param dropped messages leaving the window, oldest first
   */
  String summarize(SummaryRecord previous, List<MessageRecord> dropped);
}
