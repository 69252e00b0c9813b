package com.callcenter.backend.dialog.service;

import com.callcenter.backend.dialog.config.DialogProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** Periodically closes inactive dialogs and removes closed dialogs past their retention. */
@Component
@Slf4j
public class DialogCleanupScheduler {

  private final DialogService dialogService;
  private final DialogProperties properties;
  private final TaskScheduler taskScheduler;
  private final Counter closedCounter;
  private final Counter deletedCounter;

  public DialogCleanupScheduler(
      DialogService dialogService,
      DialogProperties properties,
      TaskScheduler taskScheduler,
      ObjectProvider<MeterRegistry> meterRegistryProvider) {
    this.dialogService = dialogService;
    this.properties = properties;
    this.taskScheduler = taskScheduler;
    MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
    this.closedCounter =
        meterRegistry != null ? meterRegistry.counter("dialog_inactive_closed_total") : null;
    this.deletedCounter =
        meterRegistry != null ? meterRegistry.counter("dialog_closed_deleted_total") : null;
  }

  @PostConstruct
  void scheduleCleanup() {
    Duration interval = properties.getCleanupInterval();
    if (interval == null || interval.isZero() || interval.isNegative()) {
      log.info("Dialog cleanup scheduler disabled (interval={})", interval);
      return;
    }
    taskScheduler.scheduleWithFixedDelay(this::safeCleanup, interval);
    log.info("Dialog cleanup scheduler started with interval {}", interval);
  }

  public void runCleanup() {
    int closed = dialogService.closeInactiveDialogs();
    if (closedCounter != null && closed > 0) {
      closedCounter.increment(closed);
    }
    int retentionDays = properties.getClosedRetentionDays();
    if (retentionDays > 0) {
      int deleted = dialogService.deleteClosedDialogs(retentionDays);
      if (deletedCounter != null && deleted > 0) {
        deletedCounter.increment(deleted);
      }
    }
  }

  private void safeCleanup() {
    try {
      runCleanup();
    } catch (Exception exception) {
      log.warn("Dialog cleanup task failed", exception);
    }
  }
}
