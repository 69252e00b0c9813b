package com.callcenter.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

/** Full dialog flow through the HTTP API with the offline provider and file storage. */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CallCenterApplicationTests {

  private static final Path STORAGE_DIR;

  static {
    try {
      STORAGE_DIR = Files.createTempDirectory("call-center-dialogs");
    } catch (IOException exception) {
      throw new UncheckedIOException(exception);
    }
  }

  @DynamicPropertySource
  static void overrideStorage(DynamicPropertyRegistry registry) {
    registry.add("app.dialog.storage-path", STORAGE_DIR::toString);
  }

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @Test
  void customerIsRoutedEscalatedAndHandedBack() throws Exception {
    String body =
        mockMvc
            .perform(
                post("/api/v1/dialogue/create")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "customerInfo": {"name": "Alex Morgan", "email": "alex@example.com"},
                          "initialMessage": "I have a question about your opening hours",
                          "source": "web"
                        }
                        """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("active"))
            .andExpect(jsonPath("$.currentAgent").value("general"))
            .andExpect(jsonPath("$.messages.length()").value(2))
            .andReturn()
            .getResponse()
            .getContentAsString();
    JsonNode created = objectMapper.readTree(body);
    String dialogId = created.get("dialogId").asText();
    assertThat(Files.exists(STORAGE_DIR.resolve(dialogId + ".json"))).isTrue();

    send(dialogId, "I want to buy a new subscription plan")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.currentAgent").value("sales"))
        .andExpect(jsonPath("$.previousAgent").value("general"))
        .andExpect(jsonPath("$.handoffReason").value("outside_skills:purchase"));

    send(dialogId, "Actually I want a refund for the last charge")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.currentAgent").value("escalation"))
        .andExpect(jsonPath("$.previousAgent").value("sales"))
        .andExpect(jsonPath("$.handoffReason").value("refund_escalation"));

    mockMvc
        .perform(get("/api/v1/dialogue/{id}/status", dialogId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("escalated"))
        .andExpect(jsonPath("$.customerName").value("Alex Morgan"));

    send(dialogId, "Thank you, that helped")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.currentAgent").value("sales"))
        .andExpect(jsonPath("$.previousAgent").value("escalation"))
        .andExpect(jsonPath("$.handoffReason").value("escalation_resolved"));

    mockMvc
        .perform(get("/api/v1/dialogue/{id}/history", dialogId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"))
        .andExpect(jsonPath("$.messages.length()").value(8))
        .andExpect(jsonPath("$.messages[0].sender").value("user"))
        .andExpect(jsonPath("$.messages[1].handlerName").value("general"))
        .andExpect(jsonPath("$.messages[5].handlerName").value("escalation"))
        .andExpect(jsonPath("$.messages[7].handlerName").value("sales"));

    mockMvc
        .perform(post("/api/v1/dialogue/{id}/close", dialogId).param("reason", "resolved"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("closed"));

    send(dialogId, "One more thing")
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.dialogStatus").value("closed"));
  }

  @Test
  void exposesAgentsAndHealth() throws Exception {
    mockMvc
        .perform(get("/api/v1/agents"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(4));

    mockMvc
        .perform(get("/api/v1/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.environment").value("test"))
        .andExpect(jsonPath("$.storageAvailable").value(true));
  }

  @Test
  void unknownDialogIsNotFound() throws Exception {
    send("missing-dialog", "Hello").andExpect(status().isNotFound());
  }

  private ResultActions send(String dialogId, String message) throws Exception {
    return mockMvc.perform(
        post("/api/v1/dialogue/{id}/message", dialogId)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(new MessagePayload(message))));
  }

  private record MessagePayload(String message) {}
}
