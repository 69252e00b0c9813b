package com.callcenter.backend.health.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.callcenter.backend.health.api.HealthResponse;
import com.callcenter.backend.health.service.HealthService;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HealthController.class)
@AutoConfigureMockMvc(addFilters = false)
class HealthControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private HealthService healthService;

  @Test
  void returnsHealthSummary() throws Exception {
    when(healthService.check())
        .thenReturn(
            new HealthResponse(
                HealthService.DEGRADED,
                Instant.parse("2025-03-01T12:00:00Z"),
                "0.1.0",
                "test",
                42,
                Map.of("general", true, "sales", false),
                true));

    mockMvc
        .perform(get("/api/v1/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("degraded"))
        .andExpect(jsonPath("$.version").value("0.1.0"))
        .andExpect(jsonPath("$.agentsAvailable.sales").value(false))
        .andExpect(jsonPath("$.storageAvailable").value(true))
        .andExpect(jsonPath("$.timestamp").value("2025-03-01T12:00:00Z"));
  }
}
