package com.callcenter.backend.chat.provider;

import com.callcenter.backend.agent.context.DialogContext;
import java.util.Objects;

/**
 * A single completion call.
 *
 * @param caller logical origin of the call (a handler name or {@code summarizer}), used for logs
 *     and by the offline provider to pick a reply template
 * @param systemPrompt instructions for the model
 * @param context retained dialog history the model should see, may be empty
 * @param userText the text to answer
 * @param overrides per-call sampling overrides
 */
public record GenerationRequest(
    String caller,
    String systemPrompt,
    DialogContext context,
    String userText,
    GenerationOverrides overrides) {

  public GenerationRequest {
    Objects.requireNonNull(caller, "caller must not be null");
    Objects.requireNonNull(userText, "userText must not be null");
    context = context != null ? context : DialogContext.empty();
    overrides = overrides != null ? overrides : GenerationOverrides.empty();
  }
}
