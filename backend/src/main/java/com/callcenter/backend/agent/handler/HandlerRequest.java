package com.callcenter.backend.agent.handler;

import com.callcenter.backend.agent.context.DialogContext;
import java.util.Objects;

/**
 * Input of a single handler dispatch.
 *
 * @param handoffFrom handler that passed the turn on within this turn, {@code null} on the first
 *     dispatch
 * @param handoffReason reason given by {@code handoffFrom}
 */
public record HandlerRequest(
    String dialogId,
    String userText,
    DialogContext context,
    String handoffFrom,
    String handoffReason) {

  public HandlerRequest {
    Objects.requireNonNull(dialogId, "dialogId must not be null");
    Objects.requireNonNull(userText, "userText must not be null");
    context = context != null ? context : DialogContext.empty();
  }

  public static HandlerRequest initial(String dialogId, String userText, DialogContext context) {
    return new HandlerRequest(dialogId, userText, context, null, null);
  }

  public boolean isHandoffArrival() {
    return handoffFrom != null;
  }
}
