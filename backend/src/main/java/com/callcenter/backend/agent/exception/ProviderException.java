package com.callcenter.backend.agent.exception;

/**
 * The text-generation provider failed, timed out or returned an unusable payload. Non-retryable
 * failures (interruption) abort immediately without further attempts.
 */
public class ProviderException extends OrchestrationException {

  private final boolean retryable;

  public ProviderException(String message) {
    this(message, null, true);
  }

  public ProviderException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public ProviderException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
