package com.callcenter.backend.chat.provider;

import com.callcenter.backend.agent.context.DialogContext;
import com.callcenter.backend.agent.context.MessageRecord;
import com.callcenter.backend.agent.exception.ProviderException;
import com.callcenter.backend.chat.config.ChatProviderProperties;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.util.StringUtils;

/** {@link GenerationProvider} backed by a Spring AI {@link ChatClient}. */
@Slf4j
public class ChatClientGenerationProvider implements GenerationProvider {

  private static final String CLASSIFIER_PROMPT =
      """
      You classify customer messages for a call center. Pick the intents that best describe the
      latest customer message, using the conversation only as background. Use only these intent
      labels: %s. Give each chosen intent a confidence between 0 and 1 and return at most three.
      """;

  private final ChatClient chatClient;
  private final ChatProviderProperties properties;
  private final ProviderCallExecutor callExecutor;
  private final BeanOutputConverter<ClassificationPayload> classificationConverter =
      new BeanOutputConverter<>(ClassificationPayload.class);

  public ChatClientGenerationProvider(
      ChatClient chatClient, ChatProviderProperties properties, ProviderCallExecutor callExecutor) {
    this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
  }

  @Override
  public String complete(GenerationRequest request) {
    ChatOptions options =
        buildOptions(request.overrides().temperature(), request.overrides().maxTokens());
    List<Message> history = toMessages(request.context());
    return callExecutor.call(
        "completion[" + request.caller() + "]",
        () -> {
          String content =
              chatClient
                  .prompt()
                  .system(request.systemPrompt())
                  .messages(history)
                  .user(request.userText())
                  .options(options)
                  .call()
                  .content();
          if (!StringUtils.hasText(content)) {
            throw new ProviderException("Provider returned an empty completion");
          }
          return content.trim();
        });
  }

  @Override
  public IntentClassification classify(
      String text, DialogContext context, Collection<String> intents) {
    Set<String> allowed = new LinkedHashSet<>(intents);
    String system =
        CLASSIFIER_PROMPT.formatted(String.join(", ", allowed))
            + "\n"
            + classificationConverter.getFormat();
    ChatOptions options = buildOptions(properties.getRouterTemperature(), null);
    List<Message> history = toMessages(context != null ? context : DialogContext.empty());

    ClassificationPayload payload =
        callExecutor.call(
            "classification",
            () -> {
              String content =
                  chatClient
                      .prompt()
                      .system(system)
                      .messages(history)
                      .user(text)
                      .options(options)
                      .call()
                      .content();
              if (!StringUtils.hasText(content)) {
                throw new ProviderException("Provider returned an empty classification");
              }
              try {
                return classificationConverter.convert(content);
              } catch (RuntimeException exception) {
                throw new ProviderException("Malformed classification payload", exception);
              }
            });

    List<IntentCandidate> candidates = new ArrayList<>();
    if (payload != null && payload.intents() != null) {
      for (ClassificationPayload.Candidate candidate : payload.intents()) {
        if (candidate == null || !allowed.contains(candidate.intent())) {
          log.debug("Dropping classifier candidate outside the intent set: {}", candidate);
          continue;
        }
        double confidence = candidate.confidence() != null ? candidate.confidence() : 0d;
        candidates.add(
            new IntentCandidate(candidate.intent(), Math.max(0d, Math.min(1d, confidence))));
      }
    }
    return new IntentClassification(candidates);
  }

  private ChatOptions buildOptions(Double temperature, Integer maxTokens) {
    OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder();
    if (StringUtils.hasText(properties.getModel())) {
      builder.model(properties.getModel());
    }
    Double resolvedTemperature = temperature != null ? temperature : properties.getTemperature();
    if (resolvedTemperature != null) {
      builder.temperature(resolvedTemperature);
    }
    Integer resolvedMaxTokens = maxTokens != null ? maxTokens : properties.getMaxTokens();
    if (resolvedMaxTokens != null) {
      builder.maxTokens(resolvedMaxTokens);
    }
    return builder.build();
  }

  private List<Message> toMessages(DialogContext context) {
    List<Message> messages = new ArrayList<>();
    if (context.summary() != null && StringUtils.hasText(context.summary().text())) {
      messages.add(
          new SystemMessage("Summary of the earlier conversation: " + context.summary().text()));
    }
    for (MessageRecord record : context.messages()) {
      switch (record.sender()) {
        case USER -> messages.add(new UserMessage(record.text()));
        case AGENT ->
            messages.add(new AssistantMessage("[" + record.handlerName() + "] " + record.text()));
        case SYSTEM -> messages.add(new SystemMessage(record.text()));
      }
    }
    return messages;
  }

  public record ClassificationPayload(List<Candidate> intents) {

    public record Candidate(String intent, Double confidence) {}
  }
}
