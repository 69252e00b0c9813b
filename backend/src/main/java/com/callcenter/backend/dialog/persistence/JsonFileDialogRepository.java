package com.callcenter.backend.dialog.persistence;

import com.callcenter.backend.dialog.domain.DialogRecord;
import com.callcenter.backend.dialog.exception.DialogStorageException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores each dialog as a pretty-printed JSON document named {@code <dialogId>.json}. Writes go to
 * a temporary file in the same directory that is then moved over the target.
 */
@Slf4j
public class JsonFileDialogRepository implements DialogRepository {

  private static final String EXTENSION = ".json";
  private static final Pattern DIALOG_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,63}");

  private final Path storagePath;
  private final ObjectMapper objectMapper;

  public JsonFileDialogRepository(Path storagePath, ObjectMapper objectMapper) {
    this.storagePath = Objects.requireNonNull(storagePath, "storagePath must not be null");
    this.objectMapper =
        Objects.requireNonNull(objectMapper, "objectMapper must not be null")
            .copy()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    try {
      Files.createDirectories(storagePath);
    } catch (IOException exception) {
      throw new DialogStorageException(
          "Cannot create dialog storage directory " + storagePath, exception);
    }
    log.info("Dialog storage initialised at {}", storagePath.toAbsolutePath());
  }

  @Override
  public Optional<DialogRecord> findById(String dialogId) {
    if (!isValidId(dialogId)) {
      return Optional.empty();
    }
    Path file = fileFor(dialogId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    return Optional.of(read(file));
  }

  @Override
  public DialogRecord save(DialogRecord dialog) {
    Objects.requireNonNull(dialog, "dialog must not be null");
    if (!isValidId(dialog.getDialogId())) {
      throw new IllegalArgumentException("Invalid dialog id: " + dialog.getDialogId());
    }
    Path target = fileFor(dialog.getDialogId());
    Path temp = null;
    try {
      temp = Files.createTempFile(storagePath, dialog.getDialogId() + "-", ".tmp");
      objectMapper.writeValue(temp.toFile(), dialog);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException exception) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      return dialog;
    } catch (IOException exception) {
      deleteQuietly(temp);
      throw new DialogStorageException("Failed to save dialog " + dialog.getDialogId(), exception);
    }
  }

  @Override
  public boolean deleteById(String dialogId) {
    if (!isValidId(dialogId)) {
      return false;
    }
    try {
      return Files.deleteIfExists(fileFor(dialogId));
    } catch (IOException exception) {
      throw new DialogStorageException("Failed to delete dialog " + dialogId, exception);
    }
  }

  @Override
  public List<DialogRecord> findAll() {
    List<DialogRecord> dialogs = new ArrayList<>();
    try (Stream<Path> files = Files.list(storagePath)) {
      files
          .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
          .sorted()
          .forEach(
              file -> {
                try {
                  dialogs.add(read(file));
                } catch (DialogStorageException exception) {
                  log.warn("Skipping unreadable dialog file {}: {}", file, exception.getMessage());
                }
              });
    } catch (IOException exception) {
      throw new DialogStorageException("Failed to list dialogs in " + storagePath, exception);
    }
    return dialogs;
  }

  @Override
  public boolean isAvailable() {
    return Files.isDirectory(storagePath) && Files.isWritable(storagePath);
  }

  public Path getStoragePath() {
    return storagePath;
  }

  private DialogRecord read(Path file) {
    try {
      return objectMapper.readValue(file.toFile(), DialogRecord.class);
    } catch (IOException exception) {
      throw new DialogStorageException("Failed to read dialog file " + file, exception);
    }
  }

  private Path fileFor(String dialogId) {
    return storagePath.resolve(dialogId + EXTENSION);
  }

  private boolean isValidId(String dialogId) {
    return dialogId != null && DIALOG_ID.matcher(dialogId).matches();
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException exception) {
      log.debug("Failed to remove temporary file {}", temp, exception);
    }
  }
}
