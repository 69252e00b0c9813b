package com.callcenter.backend.agent.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.callcenter.backend.support.AgentTestFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExtractiveConversationSummarizerTest {

  private final ExtractiveConversationSummarizer summarizer = new ExtractiveConversationSummarizer(500);

  @Test
  void listsCustomerRequestsAndLatestAnswerPerHandler() {
    String summary =
        summarizer.summarize(
            null,
            List.of(
                AgentTestFixtures.user("My invoice is wrong"),
                AgentTestFixtures.agent("sales", "Let me check the invoice"),
                AgentTestFixtures.user("It was charged twice"),
                AgentTestFixtures.agent("sales", "I see a duplicate charge"),
                MessageRecord.system("customer verified", AgentTestFixtures.NOW)));

    assertThat(summary)
        .startsWith("Customer requests (2): My invoice is wrong; It was charged twice")
        .contains("Agent responses: [sales] I see a duplicate charge")
        .doesNotContain("Let me check the invoice")
        .doesNotContain("customer verified");
  }

  @Test
  void carriesPreviousSummaryForward() {
    String summary =
        summarizer.summarize(
            new SummaryRecord("Customer asked about plans", 4, AgentTestFixtures.NOW),
            List.of(AgentTestFixtures.user("Which plan is cheapest?")));

    assertThat(summary)
        .isEqualTo("Earlier: Customer asked about plans | Customer requests (1): Which plan is cheapest?");
  }

  @Test
  void neverExceedsMaximumLength() {
    String longText = "word ".repeat(400);
    String summary =
        new ExtractiveConversationSummarizer(200)
            .summarize(
                new SummaryRecord(longText, 10, AgentTestFixtures.NOW),
                List.of(
                    AgentTestFixtures.user(longText),
                    AgentTestFixtures.agent("technical", longText),
                    AgentTestFixtures.agent("general", longText)));

    assertThat(summary.length()).isLessThanOrEqualTo(200);
  }

  @Test
  void keepsPartOfPreviousSummaryWhenNewSectionFillsTheLimit() {
    String previous = "Customer reported a duplicate charge on the March invoice";
    String summary =
        new ExtractiveConversationSummarizer(200)
            .summarize(
                new SummaryRecord(previous, 6, AgentTestFixtures.NOW),
                List.of(AgentTestFixtures.user("x".repeat(185))));

    assertThat(summary.length()).isLessThanOrEqualTo(200);
    assertThat(summary).startsWith("Earlier: Customer reported a duplicate");
    assertThat(summary).contains("| Customer requests (1): xxx");
  }

  @Test
  void rejectsTinyLimit() {
    assertThatThrownBy(() -> new ExtractiveConversationSummarizer(50))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
