package com.callcenter.backend.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.info")
public class AppInfoProperties {

  private String name = "call-center-agents";
  private String version = "0.1.0";

  /** Deployment environment reported by the health endpoint, e.g. development or production. */
  private String environment = "development";

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public String getEnvironment() {
    return environment;
  }

  public void setEnvironment(String environment) {
    this.environment = environment;
  }
}
