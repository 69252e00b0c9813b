package com.callcenter.backend.agent.context;

import com.callcenter.backend.shared.text.KeywordMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Deterministic summarizer: keeps the customer's recent requests and the latest answer of every
 * handler that took part, carrying the previous summary forward in shortened form.
 */
public class ExtractiveConversationSummarizer implements ConversationSummarizer {

  private static final int MAX_TOPICS = 5;
  private static final int SNIPPET_LENGTH = 160;
  private static final int MIN_EARLIER_LENGTH = 40;
  private static final int EARLIER_OVERHEAD = "Earlier: ".length() + " | ".length();

  private final int maxLength;

  public ExtractiveConversationSummarizer(int maxLength) {
    if (maxLength < 200) {
      throw new IllegalArgumentException("maxLength must be at least 200 characters");
    }
    this.maxLength = maxLength;
  }

  @Override
  public String summarize(SummaryRecord previous, List<MessageRecord> dropped) {
    List<String> topics = new ArrayList<>();
    int userMessages = 0;
    Map<String, String> resolutions = new LinkedHashMap<>();
    for (MessageRecord message : dropped) {
      switch (message.sender()) {
        case USER -> {
          userMessages++;
          topics.add(KeywordMatcher.truncate(message.text(), SNIPPET_LENGTH));
        }
        case AGENT -> {
          resolutions.remove(message.handlerName());
          resolutions.put(
              message.handlerName(), KeywordMatcher.truncate(message.text(), SNIPPET_LENGTH));
        }
        case SYSTEM -> {
          // system notices carry no customer signal
        }
      }
    }
    if (topics.size() > MAX_TOPICS) {
      topics = new ArrayList<>(topics.subList(topics.size() - MAX_TOPICS, topics.size()));
    }

    List<String> sections = new ArrayList<>();
    if (!topics.isEmpty()) {
      sections.add("Customer requests (" + userMessages + "): " + String.join("; ", topics));
    }
    if (!resolutions.isEmpty()) {
      List<String> answers = new ArrayList<>();
      resolutions.forEach((handler, text) -> answers.add("[" + handler + "] " + text));
      sections.add("Agent responses: " + String.join("; ", answers));
    }
    String current = String.join(" | ", sections);

    if (previous != null && StringUtils.hasText(previous.text())) {
      String previousText = previous.text().strip();
      int reserved = Math.min(previousText.length(), Math.max(MIN_EARLIER_LENGTH, maxLength / 5));
      int currentBudget = maxLength - reserved - EARLIER_OVERHEAD;
      if (current.length() > currentBudget) {
        current = KeywordMatcher.truncate(current, currentBudget);
      }
      int budget = Math.min(maxLength - current.length() - EARLIER_OVERHEAD, maxLength / 2);
      String earlier = KeywordMatcher.truncate(previousText, Math.max(reserved, budget));
      current = current.isEmpty() ? "Earlier: " + earlier : "Earlier: " + earlier + " | " + current;
    }
    return KeywordMatcher.truncate(current, maxLength);
  }
}
