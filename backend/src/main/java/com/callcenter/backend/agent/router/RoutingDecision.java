package com.callcenter.backend.agent.router;

/**
 * Outcome of routing a first-contact (or orphaned) turn.
 *
 * @param target handler that should receive the turn; never the escalation handler
 * @param intent top classified intent, {@code null} when the classifier returned nothing
 * @param confidence confidence of {@code intent}, 0 when absent
 * @param fallback whether the default handler was chosen because no candidate qualified
 * @param fallbackReason why the fallback happened, {@code null} unless {@code fallback}
 */
public record RoutingDecision(
    String target, String intent, double confidence, boolean fallback, String fallbackReason) {

  public static RoutingDecision direct(String target, String intent, double confidence) {
    return new RoutingDecision(target, intent, confidence, false, null);
  }

  public static RoutingDecision fallback(
      String target, String intent, double confidence, String reason) {
    return new RoutingDecision(target, intent, confidence, true, reason);
  }
}
