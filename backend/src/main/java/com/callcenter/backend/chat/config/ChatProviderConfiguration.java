package com.callcenter.backend.chat.config;

import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.chat.provider.ChatClientGenerationProvider;
import com.callcenter.backend.chat.provider.GenerationProvider;
import com.callcenter.backend.chat.provider.OfflineGenerationProvider;
import com.callcenter.backend.chat.provider.ProviderCallExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

@Slf4j
@Configuration
@EnableConfigurationProperties(ChatProviderProperties.class)
public class ChatProviderConfiguration {

  // app.chat.retry is applied once, by ProviderCallExecutor around each call.
  private static final RetryTemplate SINGLE_ATTEMPT = RetryTemplate.builder().maxAttempts(1).build();

  @Bean
  public RetryTemplate providerRetryTemplate(ChatProviderProperties properties) {
    ChatProviderProperties.Retry retry = properties.getRetry();
    return ProviderCallExecutor.retryTemplate(
        retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMaxBackoff());
  }

  @Bean
  public ProviderCallExecutor providerCallExecutor(
      ChatProviderProperties properties, RetryTemplate providerRetryTemplate) {
    return new ProviderCallExecutor(properties.getTimeout(), providerRetryTemplate);
  }

  @Bean
  public GenerationProvider generationProvider(
      ChatProviderProperties properties,
      OrchestrationProperties orchestrationProperties,
      ProviderCallExecutor providerCallExecutor) {
    ChatProviderType type = properties.getProvider();
    log.info("Using {} generation provider", type);
    return switch (type) {
      case OPENAI ->
          new ChatClientGenerationProvider(
              openAiChatClient(properties), properties, providerCallExecutor);
      case MOCK -> new OfflineGenerationProvider(orchestrationProperties);
    };
  }

  private ChatClient openAiChatClient(ChatProviderProperties properties) {
    Assert.state(
        StringUtils.hasText(properties.getApiKey()),
        "app.chat.api-key must be set when app.chat.provider=openai");
    OpenAiApi.Builder apiBuilder = OpenAiApi.builder().apiKey(properties.getApiKey());
    if (StringUtils.hasText(properties.getBaseUrl())) {
      apiBuilder.baseUrl(properties.getBaseUrl());
    }
    if (StringUtils.hasText(properties.getCompletionsPath())) {
      apiBuilder.completionsPath(properties.getCompletionsPath());
    }
    OpenAiChatOptions.Builder optionsBuilder = OpenAiChatOptions.builder();
    if (StringUtils.hasText(properties.getModel())) {
      optionsBuilder.model(properties.getModel());
    }
    OpenAiChatModel chatModel =
        OpenAiChatModel.builder()
            .openAiApi(apiBuilder.build())
            .defaultOptions(optionsBuilder.build())
            .retryTemplate(SINGLE_ATTEMPT)
            .build();
    return ChatClient.builder(chatModel).defaultAdvisors(new SimpleLoggerAdvisor()).build();
  }
}
