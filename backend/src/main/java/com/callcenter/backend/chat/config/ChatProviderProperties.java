package com.callcenter.backend.chat.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.chat")
@Validated
public class ChatProviderProperties {

  @NotNull private ChatProviderType provider = ChatProviderType.MOCK;

  private String baseUrl;
  private String apiKey;
  private String completionsPath;
  private String model = "gpt-4o-mini";

  /** Default sampling temperature when a caller does not override it. */
  private Double temperature = 0.3d;

  /** Temperature used for intent classification. Kept low so routing stays repeatable. */
  private Double routerTemperature = 0.1d;

  private Integer maxTokens = 1000;

  /** Upper bound for a single provider call, including waiting for the first byte. */
  private Duration timeout = Duration.ofSeconds(30);

  private Retry retry = new Retry();

  public ChatProviderType getProvider() {
    return provider;
  }

  public void setProvider(ChatProviderType provider) {
    this.provider = provider;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getCompletionsPath() {
    return completionsPath;
  }

  public void setCompletionsPath(String completionsPath) {
    this.completionsPath = completionsPath;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public Double getTemperature() {
    return temperature;
  }

  public void setTemperature(Double temperature) {
    this.temperature = temperature;
  }

  public Double getRouterTemperature() {
    return routerTemperature;
  }

  public void setRouterTemperature(Double routerTemperature) {
    this.routerTemperature = routerTemperature;
  }

  public Integer getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(Integer maxTokens) {
    this.maxTokens = maxTokens;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public static class Retry {

    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(250);
    private Duration maxBackoff = Duration.ofSeconds(2);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }
  }
}
