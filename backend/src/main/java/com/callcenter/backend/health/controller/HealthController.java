package com.callcenter.backend.health.controller;

import com.callcenter.backend.health.api.HealthResponse;
import com.callcenter.backend.health.service.HealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

  private final HealthService healthService;

  public HealthController(HealthService healthService) {
    this.healthService = healthService;
  }

  @GetMapping
  public HealthResponse getHealth() {
    return healthService.check();
  }
}
