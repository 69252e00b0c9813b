package com.callcenter.backend.agent.handler;

/**
 * A handler that answers customer messages on behalf of one registered capability. Handlers return
 * values only; persisting the turn is the caller's job.
 */
public interface SpecialistHandler {

  /** Name of the capability this handler serves. */
  String name();

  HandlerResponse handle(HandlerRequest request);
}
