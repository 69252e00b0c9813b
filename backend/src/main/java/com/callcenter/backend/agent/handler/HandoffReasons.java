package com.callcenter.backend.agent.handler;

/** Reason codes attached to handoffs and reported as the turn's handoff reason. */
public final class HandoffReasons {

  public static final String SUPERVISOR_REQUESTED = "supervisor_requested";
  public static final String REFUND_ESCALATION = "refund_escalation";
  public static final String CRITICAL_INCIDENT = "critical_incident";
  public static final String ESCALATION_RESOLVED = "escalation_resolved";
  public static final String ROUTING_LOOP = "routing_loop";
  public static final String HANDLER_UNAVAILABLE = "handler_unavailable";
  public static final String HANDOFF_TARGET_UNAVAILABLE = "handoff_target_unavailable";

  private static final String OUTSIDE_SKILLS_PREFIX = "outside_skills:";

  private HandoffReasons() {}

  public static String outsideSkills(String skillTag) {
    return OUTSIDE_SKILLS_PREFIX + skillTag;
  }

  public static String unresolvedAfter(int turns) {
    return "unresolved_after_" + turns + "_turns";
  }
}
