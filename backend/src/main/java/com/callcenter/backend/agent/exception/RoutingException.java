package com.callcenter.backend.agent.exception;

/** No dispatchable handler could be resolved for a turn. */
public class RoutingException extends OrchestrationException {

  public RoutingException(String message) {
    super(message);
  }
}
