package com.callcenter.backend.dialog.service;

import com.callcenter.backend.agent.config.OrchestrationProperties;
import com.callcenter.backend.agent.context.CompactionResult;
import com.callcenter.backend.agent.context.ContextCompactor;
import com.callcenter.backend.agent.context.MessageRecord;
import com.callcenter.backend.agent.context.SenderRole;
import com.callcenter.backend.agent.orchestrator.DialogOrchestrator;
import com.callcenter.backend.agent.orchestrator.OrchestrationMetrics;
import com.callcenter.backend.agent.orchestrator.TurnResult;
import com.callcenter.backend.dialog.config.DialogProperties;
import com.callcenter.backend.dialog.domain.CustomerInfo;
import com.callcenter.backend.dialog.domain.DialogPriority;
import com.callcenter.backend.dialog.domain.DialogRecord;
import com.callcenter.backend.dialog.domain.DialogStatus;
import com.callcenter.backend.dialog.exception.DialogStateException;
import com.callcenter.backend.dialog.exception.DialogValidationException;
import com.callcenter.backend.dialog.persistence.DialogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Dialog lifecycle on top of the orchestrator. A turn is applied to the stored record only after
 * the orchestrator succeeded, and the record is saved once per turn, so a failed turn leaves the
 * stored dialog untouched.
 */
@Service
@Slf4j
public class DialogService {

  public static final String META_LAST_USER_INTENT = "last_user_intent";
  public static final String META_LAST_HANDOFF_REASON = "last_handoff_reason";
  public static final String META_CLOSE_REASON = "close_reason";
  public static final String META_CLOSED_AT = "closed_at";

  private final DialogRepository repository;
  private final DialogOrchestrator orchestrator;
  private final ContextCompactor compactor;
  private final DialogLockRegistry lockRegistry;
  private final DialogProperties properties;
  private final OrchestrationProperties orchestrationProperties;
  private final OrchestrationMetrics metrics;
  private final Clock clock;

  public DialogService(
      DialogRepository repository,
      DialogOrchestrator orchestrator,
      ContextCompactor compactor,
      DialogLockRegistry lockRegistry,
      DialogProperties properties,
      OrchestrationProperties orchestrationProperties,
      OrchestrationMetrics metrics,
      Clock clock) {
    this.repository = Objects.requireNonNull(repository, "repository must not be null");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
    this.compactor = Objects.requireNonNull(compactor, "compactor must not be null");
    this.lockRegistry = Objects.requireNonNull(lockRegistry, "lockRegistry must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.orchestrationProperties =
        Objects.requireNonNull(orchestrationProperties, "orchestrationProperties must not be null");
    this.metrics = metrics != null ? metrics : new OrchestrationMetrics(null);
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public DialogRecord create(
      CustomerInfo customerInfo, String initialMessage, String source, DialogPriority priority) {
    Objects.requireNonNull(customerInfo, "customerInfo must not be null");
    String dialogId = UUID.randomUUID().toString();
    DialogRecord dialog =
        new DialogRecord(
            dialogId,
            customerInfo,
            priority,
            StringUtils.hasText(source) ? source : "api",
            clock.instant());
    return lockRegistry.withLock(
        dialogId,
        () -> {
          if (StringUtils.hasText(initialMessage)) {
            validateLength(initialMessage);
            applyTurn(dialog, SenderRole.USER, initialMessage.trim(), Map.of());
          }
          repository.save(dialog);
          log.info(
              "Created dialog {} for customer '{}' (priority={}, source={})",
              dialogId,
              customerInfo.name(),
              dialog.getPriority().value(),
              dialog.getSource());
          return dialog;
        });
  }

  public DialogTurn sendMessage(
      String dialogId, String text, SenderRole sender, Map<String, Object> metadata) {
    if (!StringUtils.hasText(text)) {
      throw new DialogValidationException("message must not be blank");
    }
    validateLength(text);
    SenderRole role = sender != null ? sender : SenderRole.USER;
    if (role == SenderRole.AGENT) {
      throw new DialogValidationException("only user and system messages can be submitted");
    }
    return lockRegistry.withLock(
        dialogId,
        () -> {
          DialogRecord dialog = repository.load(dialogId);
          if (!dialog.getStatus().acceptsMessages()) {
            throw new DialogStateException(
                dialogId,
                dialog.getStatus(),
                "Dialog "
                    + dialogId
                    + " is "
                    + dialog.getStatus().value()
                    + " and accepts no messages");
          }
          DialogTurn turn =
              applyTurn(dialog, role, text.trim(), metadata != null ? metadata : Map.of());
          repository.save(dialog);
          return turn;
        });
  }

  public DialogRecord history(String dialogId) {
    return repository.load(dialogId);
  }

  public DialogStatusView status(String dialogId) {
    DialogRecord dialog = repository.load(dialogId);
    return new DialogStatusView(
        dialog.getDialogId(),
        dialog.getStatus(),
        dialog.getPriority(),
        dialog.getCurrentAgent(),
        dialog.getTotalMessageCount(),
        dialog.getCreatedAt(),
        dialog.getUpdatedAt(),
        dialog.getCustomerInfo() != null ? dialog.getCustomerInfo().name() : null);
  }

  public DialogRecord close(String dialogId, String reason) {
    return lockRegistry.withLock(
        dialogId,
        () -> {
          DialogRecord dialog = repository.load(dialogId);
          if (dialog.getStatus() != DialogStatus.CLOSED) {
            closeLocked(dialog, StringUtils.hasText(reason) ? reason : "manual");
          }
          return dialog;
        });
  }

  public void delete(String dialogId, boolean force) {
    lockRegistry.withLock(
        dialogId,
        () -> {
          DialogRecord dialog = repository.load(dialogId);
          if (dialog.getStatus() == DialogStatus.ACTIVE && !force) {
            throw new DialogStateException(
                dialogId,
                dialog.getStatus(),
                "Dialog " + dialogId + " is active; close it first or delete with force=true");
          }
          repository.deleteById(dialogId);
          log.info(
              "Deleted dialog {} (status={}, force={})",
              dialogId,
              dialog.getStatus().value(),
              force);
          return dialogId;
        });
  }

  /**
   * Closes open dialogs whose last activity is older than the inactivity timeout.
   *
   * @return number of dialogs closed
   */
  public int closeInactiveDialogs() {
    Duration timeout = properties.getInactivityTimeout();
    if (timeout.isZero() || timeout.isNegative()) {
      return 0;
    }
    Instant threshold = clock.instant().minus(timeout);
    int closed = 0;
    for (DialogRecord dialog : repository.findAll()) {
      if (!dialog.getStatus().acceptsMessages() || !isOlderThan(dialog, threshold)) {
        continue;
      }
      try {
        if (closeIfInactive(dialog.getDialogId(), threshold)) {
          closed++;
        }
      } catch (RuntimeException exception) {
        log.warn(
            "Failed to close inactive dialog {}: {}", dialog.getDialogId(), exception.getMessage());
      }
    }
    if (closed > 0) {
      log.info("Closed {} dialogs inactive for more than {}", closed, timeout);
    }
    return closed;
  }

  /**
   * Deletes closed dialogs last updated more than {@code olderThanDays} days ago.
   *
   * @return number of dialogs deleted
   */
  public int deleteClosedDialogs(int olderThanDays) {
    if (olderThanDays < 0) {
      throw new DialogValidationException("olderThanDays must not be negative");
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
    int deleted = 0;
    for (DialogRecord dialog : repository.findAll()) {
      if (dialog.getStatus() != DialogStatus.CLOSED || !isOlderThan(dialog, cutoff)) {
        continue;
      }
      try {
        delete(dialog.getDialogId(), true);
        deleted++;
      } catch (RuntimeException exception) {
        log.warn(
            "Failed to delete closed dialog {}: {}", dialog.getDialogId(), exception.getMessage());
      }
    }
    if (deleted > 0) {
      log.info("Deleted {} closed dialogs older than {} days", deleted, olderThanDays);
    }
    return deleted;
  }

  private boolean closeIfInactive(String dialogId, Instant threshold) {
    return lockRegistry.withLock(
        dialogId,
        () -> {
          DialogRecord current = repository.load(dialogId);
          if (!current.getStatus().acceptsMessages() || !isOlderThan(current, threshold)) {
            return false;
          }
          closeLocked(current, "timeout");
          return true;
        });
  }

  private void closeLocked(DialogRecord dialog, String reason) {
    Instant now = clock.instant();
    dialog.setStatus(DialogStatus.CLOSED);
    dialog.getMetadata().put(META_CLOSE_REASON, reason);
    dialog.getMetadata().put(META_CLOSED_AT, now.toString());
    dialog.setUpdatedAt(now);
    repository.save(dialog);
    log.info("Closed dialog {} ({})", dialog.getDialogId(), reason);
  }

  private DialogTurn applyTurn(
      DialogRecord dialog, SenderRole sender, String text, Map<String, Object> metadata) {
    TurnResult result = orchestrator.processTurn(dialog.getDialogId(), text, dialog.toContext());

    Instant now = clock.instant();
    MessageRecord inbound = new MessageRecord(null, sender, text, null, now, metadata);
    MessageRecord reply =
        MessageRecord.agent(result.currentHandler(), result.responseText(), now, result.metadata());
    dialog.appendMessage(inbound);
    dialog.appendMessage(reply);
    dialog.setCurrentAgent(result.currentHandler());
    dialog.setUpdatedAt(now);
    dialog.getMetadata().put(META_LAST_USER_INTENT, result.intent());
    dialog.getMetadata().put(META_LAST_HANDOFF_REASON, result.handoffReason());
    dialog.setStatus(
        result.currentHandler().equals(orchestrationProperties.getEscalationHandler())
            ? DialogStatus.ESCALATED
            : DialogStatus.ACTIVE);

    CompactionResult compaction = compactor.compact(dialog.getDialogId(), dialog.toContext());
    if (compaction.compacted()) {
      dialog.applyContext(compaction.context());
      metrics.compaction(compaction.droppedCount());
    }
    return new DialogTurn(dialog.getDialogId(), inbound.id(), result, now);
  }

  private void validateLength(String text) {
    if (text.length() > properties.getMaxMessageLength()) {
      throw new DialogValidationException(
          "message must be at most " + properties.getMaxMessageLength() + " characters");
    }
  }

  private boolean isOlderThan(DialogRecord dialog, Instant threshold) {
    Instant lastActivity =
        dialog.getUpdatedAt() != null ? dialog.getUpdatedAt() : dialog.getCreatedAt();
    return lastActivity == null || lastActivity.isBefore(threshold);
  }
}
