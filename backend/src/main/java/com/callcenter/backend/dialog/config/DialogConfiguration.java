package com.callcenter.backend.dialog.config;

import com.callcenter.backend.agent.context.ContextCompactor;
import com.callcenter.backend.agent.context.ConversationSummarizer;
import com.callcenter.backend.agent.context.ExtractiveConversationSummarizer;
import com.callcenter.backend.agent.context.LlmConversationSummarizer;
import com.callcenter.backend.chat.provider.GenerationProvider;
import com.callcenter.backend.dialog.persistence.DialogRepository;
import com.callcenter.backend.dialog.persistence.JsonFileDialogRepository;
import com.callcenter.backend.dialog.service.DialogLockRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(DialogProperties.class)
public class DialogConfiguration {

  @Bean
  public DialogRepository dialogRepository(DialogProperties properties, ObjectMapper objectMapper) {
    return new JsonFileDialogRepository(properties.getStoragePath(), objectMapper);
  }

  @Bean
  public DialogLockRegistry dialogLockRegistry(DialogProperties properties) {
    return new DialogLockRegistry(properties.getLockTimeout());
  }

  @Bean
  public ConversationSummarizer conversationSummarizer(
      DialogProperties properties, GenerationProvider generationProvider) {
    ConversationSummarizer extractive =
        new ExtractiveConversationSummarizer(properties.getMaxSummaryLength());
    return switch (properties.getSummarizer()) {
      case EXTRACTIVE -> extractive;
      case LLM ->
          new LlmConversationSummarizer(
              generationProvider, extractive, properties.getMaxSummaryLength());
    };
  }

  @Bean
  public ContextCompactor contextCompactor(
      ConversationSummarizer conversationSummarizer, DialogProperties properties, Clock clock) {
    return new ContextCompactor(conversationSummarizer, properties.getMaxHistoryLength(), clock);
  }
}
