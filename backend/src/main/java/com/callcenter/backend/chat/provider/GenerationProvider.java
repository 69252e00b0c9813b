package com.callcenter.backend.chat.provider;

import com.callcenter.backend.agent.context.DialogContext;
import java.util.Collection;

/**
 * Text generation and intent classification backend. Implementations enforce the call timeout and
 * retry policy themselves and report every failure as a
 * {@link com.callcenter.backend.agent.exception.ProviderException}.
 */
public interface GenerationProvider {

  String complete(GenerationRequest request);

  /**
   * Classifies {@code text} into the given intent labels. Labels outside {@code intents} are never
   * returned.
   */
  IntentClassification classify(String text, DialogContext context, Collection<String> intents);
}
