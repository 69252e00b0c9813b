package com.callcenter.backend.agent.exception;

public class InvalidTransitionException extends OrchestrationException {

  private final String from;
  private final String to;

  public InvalidTransitionException(String from, String to, String message) {
    super("Invalid handoff " + from + " -> " + to + ": " + message);
    this.from = from;
    this.to = to;
  }

  public String getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }
}
