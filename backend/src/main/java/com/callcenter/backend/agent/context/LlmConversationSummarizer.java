package com.callcenter.backend.agent.context;

import com.callcenter.backend.agent.exception.ProviderException;
import com.callcenter.backend.chat.provider.GenerationOverrides;
import com.callcenter.backend.chat.provider.GenerationProvider;
import com.callcenter.backend.chat.provider.GenerationRequest;
import com.callcenter.backend.shared.text.KeywordMatcher;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Summarizes dropped messages with the generation provider. Provider failures never block a turn:
 * the extractive summarizer takes over.
 */
@Slf4j
public class LlmConversationSummarizer implements ConversationSummarizer {

  static final String CALLER = "summarizer";

  private static final String SYSTEM_PROMPT =
      "You write short summaries of customer support dialogs. Keep the customer's requests, what"
          + " each specialist answered and any open issue. Write in the language of the dialog.";

  private final GenerationProvider generationProvider;
  private final ConversationSummarizer fallback;
  private final int maxLength;

  public LlmConversationSummarizer(
      GenerationProvider generationProvider, ConversationSummarizer fallback, int maxLength) {
    this.generationProvider =
        Objects.requireNonNull(generationProvider, "generationProvider must not be null");
    this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    this.maxLength = maxLength;
  }

  @Override
  public String summarize(SummaryRecord previous, List<MessageRecord> dropped) {
    try {
      String summary =
          generationProvider.complete(
              new GenerationRequest(
                  CALLER,
                  SYSTEM_PROMPT,
                  DialogContext.empty(),
                  toPromptPayload(previous, dropped),
                  // Summaries favour determinism and brevity.
                  new GenerationOverrides(0.2d, 512)));
      if (!StringUtils.hasText(summary)) {
        log.warn("Summarizer returned an empty response, using extractive summary");
        return fallback.summarize(previous, dropped);
      }
      return KeywordMatcher.truncate(summary, maxLength);
    } catch (ProviderException exception) {
      log.warn("LLM summarization failed, using extractive summary: {}", exception.getMessage());
      return fallback.summarize(previous, dropped);
    }
  }

  private String toPromptPayload(SummaryRecord previous, List<MessageRecord> dropped) {
    String transcript =
        dropped.stream()
            .map(
                message ->
                    switch (message.sender()) {
                      case USER -> "customer: " + message.text();
                      case AGENT -> message.handlerName() + ": " + message.text();
                      case SYSTEM -> "system: " + message.text();
                    })
            .collect(Collectors.joining("\n"));
    if (previous != null && StringUtils.hasText(previous.text())) {
      return "Previous summary:\n" + previous.text() + "\n\nNew messages:\n" + transcript;
    }
    return transcript;
  }
}
