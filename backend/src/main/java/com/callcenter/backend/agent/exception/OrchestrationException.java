package com.callcenter.backend.agent.exception;

/** Base type for failures raised while a dialog turn is being orchestrated. */
public class OrchestrationException extends RuntimeException {

  public OrchestrationException(String message) {
    super(message);
  }

  public OrchestrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
