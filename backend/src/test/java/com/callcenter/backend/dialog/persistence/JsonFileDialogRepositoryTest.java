package com.callcenter.backend.dialog.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.callcenter.backend.agent.context.MessageRecord;
import com.callcenter.backend.agent.context.SenderRole;
import com.callcenter.backend.agent.context.SummaryRecord;
import com.callcenter.backend.agent.handler.AbstractSpecialistHandler;
import com.callcenter.backend.dialog.domain.CustomerInfo;
import com.callcenter.backend.dialog.domain.DialogPriority;
import com.callcenter.backend.dialog.domain.DialogRecord;
import com.callcenter.backend.dialog.domain.DialogStatus;
import com.callcenter.backend.dialog.exception.DialogNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileDialogRepositoryTest {

  private static final Instant CREATED = Instant.parse("2025-03-01T10:00:00Z");

  @TempDir Path storage;

  private JsonFileDialogRepository repository;

  @BeforeEach
  void setUp() {
    repository = new JsonFileDialogRepository(storage, new ObjectMapper());
  }

  @Test
  void roundTripsDialogWithMessagesAndSummary() {
    DialogRecord dialog = dialog("d-1");
    dialog.appendMessage(MessageRecord.user("My bill is wrong", CREATED, Map.of("channel", "web")));
    dialog.appendMessage(
        MessageRecord.agent(
            "sales", "Let me check", CREATED, Map.of(AbstractSpecialistHandler.UNRESOLVED_TURNS, 1)));
    dialog.setSummary(new SummaryRecord("Earlier questions about plans", 4, CREATED));
    dialog.setCurrentAgent("sales");
    dialog.setStatus(DialogStatus.ESCALATED);

    repository.save(dialog);
    DialogRecord loaded = repository.load("d-1");

    assertThat(loaded.getCustomerInfo()).isEqualTo(dialog.getCustomerInfo());
    assertThat(loaded.getStatus()).isEqualTo(DialogStatus.ESCALATED);
    assertThat(loaded.getPriority()).isEqualTo(DialogPriority.HIGH);
    assertThat(loaded.getCreatedAt()).isEqualTo(CREATED);
    assertThat(loaded.getSummary()).isEqualTo(dialog.getSummary());
    assertThat(loaded.getMessages()).hasSize(2);
    MessageRecord reply = loaded.getMessages().get(1);
    assertThat(reply.sender()).isEqualTo(SenderRole.AGENT);
    assertThat(reply.handlerName()).isEqualTo("sales");
    assertThat(reply.intMetadata(AbstractSpecialistHandler.UNRESOLVED_TURNS)).contains(1);
    assertThat(loaded.toContext().currentHandler()).contains("sales");
    assertThat(loaded.getTotalMessageCount()).isEqualTo(6);
  }

  @Test
  void storesLowercaseEnumsAndIsoTimestamps() throws IOException {
    repository.save(dialog("d-2"));

    String json = Files.readString(storage.resolve("d-2.json"));

    assertThat(json).contains("\"status\" : \"active\"").contains("\"2025-03-01T10:00:00Z\"");
    assertThat(json).doesNotContain("totalMessageCount");
  }

  @Test
  void missingDialogIsReportedAsNotFound() {
    assertThat(repository.findById("absent")).isEmpty();
    assertThatThrownBy(() -> repository.load("absent"))
        .isInstanceOf(DialogNotFoundException.class);
  }

  @Test
  void rejectsPathTraversalIds() {
    assertThat(repository.findById("../secrets")).isEmpty();
    assertThat(repository.deleteById("../secrets")).isFalse();
    assertThatThrownBy(() -> repository.save(dialog("../evil")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void findAllSkipsCorruptFiles() throws IOException {
    repository.save(dialog("d-3"));
    Files.writeString(storage.resolve("broken.json"), "{not json");

    assertThat(repository.findAll()).extracting(DialogRecord::getDialogId).containsExactly("d-3");
  }

  @Test
  void deleteRemovesFile() {
    repository.save(dialog("d-4"));

    assertThat(repository.deleteById("d-4")).isTrue();
    assertThat(repository.findById("d-4")).isEmpty();
    assertThat(repository.deleteById("d-4")).isFalse();
    assertThat(repository.isAvailable()).isTrue();
  }

  private static DialogRecord dialog(String id) {
    return new DialogRecord(
        id,
        new CustomerInfo("Jane Doe", "+1 555 0100", "jane@example.com", "C-42"),
        DialogPriority.HIGH,
        "web",
        CREATED);
  }
}
