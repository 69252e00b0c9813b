package com.callcenter.backend.agent.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.callcenter.backend.agent.exception.ProviderException;
import com.callcenter.backend.chat.provider.GenerationProvider;
import com.callcenter.backend.chat.provider.GenerationRequest;
import com.callcenter.backend.support.AgentTestFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LlmConversationSummarizerTest {

  @Mock private GenerationProvider generationProvider;

  private final List<MessageRecord> dropped =
      List.of(
          AgentTestFixtures.user("Router keeps rebooting"),
          AgentTestFixtures.agent("technical", "Try a factory reset"));

  @Test
  void sendsTranscriptWithPreviousSummary() {
    when(generationProvider.complete(any(GenerationRequest.class))).thenReturn("  Router issue, reset advised. ");
    LlmConversationSummarizer summarizer =
        new LlmConversationSummarizer(generationProvider, new ExtractiveConversationSummarizer(500), 500);

    String summary =
        summarizer.summarize(new SummaryRecord("Customer on premium plan", 2, AgentTestFixtures.NOW), dropped);

    assertThat(summary).isEqualTo("Router issue, reset advised.");
    ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
    verify(generationProvider).complete(captor.capture());
    GenerationRequest request = captor.getValue();
    assertThat(request.caller()).isEqualTo(LlmConversationSummarizer.CALLER);
    assertThat(request.userText())
        .contains("Previous summary:\nCustomer on premium plan")
        .contains("customer: Router keeps rebooting")
        .contains("technical: Try a factory reset");
    assertThat(request.overrides().temperature()).isEqualTo(0.2d);
  }

  @Test
  void fallsBackToExtractiveSummaryOnProviderFailure() {
    when(generationProvider.complete(any(GenerationRequest.class)))
        .thenThrow(new ProviderException("timeout"));
    LlmConversationSummarizer summarizer =
        new LlmConversationSummarizer(generationProvider, new ExtractiveConversationSummarizer(500), 500);

    String summary = summarizer.summarize(null, dropped);

    assertThat(summary).startsWith("Customer requests (1): Router keeps rebooting");
  }

  @Test
  void fallsBackWhenProviderReturnsNothing() {
    when(generationProvider.complete(any(GenerationRequest.class))).thenReturn(" ");
    LlmConversationSummarizer summarizer =
        new LlmConversationSummarizer(generationProvider, new ExtractiveConversationSummarizer(500), 500);

    assertThat(summarizer.summarize(null, dropped)).contains("[technical] Try a factory reset");
  }
}
