package com.callcenter.backend.agent.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.agents")
public class OrchestrationProperties {

  /** Handler that receives first-contact turns the router cannot place with confidence. */
  private String defaultHandler = "general";

  /** Supervisory handler; reachable only through a handoff, never through routing. */
  private String escalationHandler = "escalation";

  /**
   * Maximum number of handoffs resolved within a single turn. Exceeding it forces escalation with
   * reason {@code routing_loop}.
   */
  private int maxReroutes = 3;

  /** Router candidates below this confidence fall back to the default handler. */
  private double confidenceThreshold = 0.5;

  /**
   * Number of consecutive unresolved turns a specialist may own before handing off to escalation.
   * Zero or a negative value disables the trigger.
   */
  private int maxUnresolvedTurns = 3;

  private Map<String, CapabilityDefinition> capabilities = defaultCapabilities();

  /** Intent label to handler mapping, together with the keywords used by the offline classifier. */
  private Map<String, IntentDefinition> intents = defaultIntents();

  /** Skill tag to keyword vocabulary used to detect requests outside a handler's skills. */
  private Map<String, List<String>> skillKeywords = defaultSkillKeywords();

  private Triggers triggers = new Triggers();

  public String getDefaultHandler() {
    return defaultHandler;
  }

  public void setDefaultHandler(String defaultHandler) {
    this.defaultHandler = defaultHandler;
  }

  public String getEscalationHandler() {
    return escalationHandler;
  }

  public void setEscalationHandler(String escalationHandler) {
    this.escalationHandler = escalationHandler;
  }

  public int getMaxReroutes() {
    return maxReroutes;
  }

  public void setMaxReroutes(int maxReroutes) {
    this.maxReroutes = maxReroutes;
  }

  public double getConfidenceThreshold() {
    return confidenceThreshold;
  }

  public void setConfidenceThreshold(double confidenceThreshold) {
    this.confidenceThreshold = confidenceThreshold;
  }

  public int getMaxUnresolvedTurns() {
    return maxUnresolvedTurns;
  }

  public void setMaxUnresolvedTurns(int maxUnresolvedTurns) {
    this.maxUnresolvedTurns = maxUnresolvedTurns;
  }

  public Map<String, CapabilityDefinition> getCapabilities() {
    return capabilities;
  }

  public void setCapabilities(Map<String, CapabilityDefinition> capabilities) {
    this.capabilities = capabilities;
  }

  public Map<String, IntentDefinition> getIntents() {
    return intents;
  }

  public void setIntents(Map<String, IntentDefinition> intents) {
    this.intents = intents;
  }

  public Map<String, List<String>> getSkillKeywords() {
    return skillKeywords;
  }

  public void setSkillKeywords(Map<String, List<String>> skillKeywords) {
    this.skillKeywords = skillKeywords;
  }

  public Triggers getTriggers() {
    return triggers;
  }

  public void setTriggers(Triggers triggers) {
    this.triggers = triggers;
  }

  private static Map<String, CapabilityDefinition> defaultCapabilities() {
    Map<String, CapabilityDefinition> defaults = new LinkedHashMap<>();
    defaults.put(
        "general",
        new CapabilityDefinition(
            "general", List.of("general", "information", "feedback"), 0.3d));
    defaults.put(
        "sales",
        new CapabilityDefinition(
            "sales", List.of("billing", "pricing", "purchase", "subscription", "refund"), 0.4d));
    defaults.put(
        "technical",
        new CapabilityDefinition(
            "technical",
            List.of("troubleshooting", "connectivity", "installation", "account_access"),
            0.2d));
    defaults.put(
        "escalation",
        new CapabilityDefinition("escalation", List.of("complaint", "supervision"), 0.3d));
    return defaults;
  }

  private static Map<String, IntentDefinition> defaultIntents() {
    Map<String, IntentDefinition> defaults = new LinkedHashMap<>();
    defaults.put(
        "billing_issue",
        new IntentDefinition(
            "sales", List.of("bill", "billing", "invoice", "charge", "payment", "refund", "money back")));
    defaults.put(
        "purchase_inquiry",
        new IntentDefinition(
            "sales", List.of("buy", "purchase", "price", "pricing", "plan", "subscription", "tariff")));
    defaults.put(
        "technical_issue",
        new IntentDefinition(
            "technical",
            List.of("error", "not working", "doesn't work", "broken", "crash", "bug", "install")));
    defaults.put(
        "connectivity_issue",
        new IntentDefinition(
            "technical", List.of("internet", "connection", "wifi", "router", "offline", "outage")));
    defaults.put(
        "account_access",
        new IntentDefinition(
            "technical", List.of("password", "login", "log in", "sign in", "locked out")));
    defaults.put(
        "general_question",
        new IntentDefinition(
            "general", List.of("hours", "address", "information", "question", "how do i")));
    return defaults;
  }

  private static Map<String, List<String>> defaultSkillKeywords() {
    Map<String, List<String>> defaults = new LinkedHashMap<>();
    defaults.put("billing", List.of("bill", "billing", "invoice", "charge", "payment"));
    defaults.put("pricing", List.of("price", "pricing", "cost", "tariff", "discount"));
    defaults.put("purchase", List.of("buy", "purchase", "order"));
    defaults.put("subscription", List.of("subscription", "plan", "upgrade", "downgrade"));
    defaults.put("refund", List.of("refund", "money back", "chargeback"));
    defaults.put("troubleshooting", List.of("error", "not working", "doesn't work", "broken", "crash", "bug"));
    defaults.put("connectivity", List.of("internet", "connection", "wifi", "router", "offline"));
    defaults.put("installation", List.of("install", "setup", "set up", "configure"));
    defaults.put("account_access", List.of("password", "login", "log in", "sign in", "locked out"));
    return defaults;
  }

  public static class CapabilityDefinition {

    /** Handler variant implementing this capability: general, sales, technical or escalation. */
    private String specialization;

    private List<String> skills = new ArrayList<>();

    /** Whether the capability accepts dispatches at startup. Can be toggled at runtime. */
    private boolean available = true;

    /** Sampling temperature used for this handler's generation calls. */
    private Double temperature;

    public CapabilityDefinition() {}

    public CapabilityDefinition(String specialization, List<String> skills, Double temperature) {
      this.specialization = specialization;
      this.skills = new ArrayList<>(skills);
      this.temperature = temperature;
    }

    public String getSpecialization() {
      return specialization;
    }

    public void setSpecialization(String specialization) {
      this.specialization = specialization;
    }

    public List<String> getSkills() {
      return skills;
    }

    public void setSkills(List<String> skills) {
      this.skills = skills;
    }

    public boolean isAvailable() {
      return available;
    }

    public void setAvailable(boolean available) {
      this.available = available;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }
  }

  public static class IntentDefinition {

    private String handler;

    private List<String> keywords = new ArrayList<>();

    public IntentDefinition() {}

    public IntentDefinition(String handler, List<String> keywords) {
      this.handler = handler;
      this.keywords = new ArrayList<>(keywords);
    }

    public String getHandler() {
      return handler;
    }

    public void setHandler(String handler) {
      this.handler = handler;
    }

    public List<String> getKeywords() {
      return keywords;
    }

    public void setKeywords(List<String> keywords) {
      this.keywords = keywords;
    }
  }

  public static class Triggers {

    /** Phrases that count as an explicit request for a supervisor or a human operator. */
    private List<String> supervisorKeywords =
        new ArrayList<>(
            List.of(
                "supervisor",
                "manager",
                "human",
                "real person",
                "operator",
                "speak to someone",
                "escalate"));

    /** Phrases that confirm the customer's problem is solved. */
    private List<String> resolutionKeywords =
        new ArrayList<>(
            List.of(
                "thank you, that helped",
                "that helped",
                "problem solved",
                "issue resolved",
                "it works now",
                "works now",
                "all good"));

    private List<String> refundKeywords =
        new ArrayList<>(List.of("refund", "money back", "chargeback", "reimburse"));

    private List<String> criticalIncidentKeywords =
        new ArrayList<>(
            List.of(
                "outage",
                "data loss",
                "lost all my data",
                "security breach",
                "hacked",
                "compromised",
                "service down"));

    public List<String> getSupervisorKeywords() {
      return supervisorKeywords;
    }

    public void setSupervisorKeywords(List<String> supervisorKeywords) {
      this.supervisorKeywords = supervisorKeywords;
    }

    public List<String> getResolutionKeywords() {
      return resolutionKeywords;
    }

    public void setResolutionKeywords(List<String> resolutionKeywords) {
      this.resolutionKeywords = resolutionKeywords;
    }

    public List<String> getRefundKeywords() {
      return refundKeywords;
    }

    public void setRefundKeywords(List<String> refundKeywords) {
      this.refundKeywords = refundKeywords;
    }

    public List<String> getCriticalIncidentKeywords() {
      return criticalIncidentKeywords;
    }

    public void setCriticalIncidentKeywords(List<String> criticalIncidentKeywords) {
      this.criticalIncidentKeywords = criticalIncidentKeywords;
    }
  }
}
