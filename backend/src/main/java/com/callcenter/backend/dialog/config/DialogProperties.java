package com.callcenter.backend.dialog.config;

import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.dialog")
public class DialogProperties {

  /** Directory holding one JSON document per dialog. */
  private Path storagePath = Path.of("storage", "dialogs");

  /**
   * Maximum number of messages kept in a dialog's retained window. Older messages are folded into
   * the dialog summary.
   */
  private int maxHistoryLength = 100;

  private int maxMessageLength = 2000;

  /** Open dialogs without activity for this long are closed by the cleanup task. */
  private Duration inactivityTimeout = Duration.ofMinutes(30);

  /** How often the cleanup task runs. Zero or negative disables it. */
  private Duration cleanupInterval = Duration.ofMinutes(10);

  /** How long a request waits for another turn of the same dialog to finish. */
  private Duration lockTimeout = Duration.ofSeconds(30);

  /**
   * Closed dialogs last updated more than this many days ago are deleted by the cleanup task. Zero
   * or negative keeps them forever.
   */
  private int closedRetentionDays = 7;

  private SummarizerType summarizer = SummarizerType.EXTRACTIVE;

  /** Upper bound for the dialog summary text, in characters. */
  private int maxSummaryLength = 2000;

  public Path getStoragePath() {
    return storagePath;
  }

  public void setStoragePath(Path storagePath) {
    this.storagePath = storagePath;
  }

  public int getMaxHistoryLength() {
    return maxHistoryLength;
  }

  public void setMaxHistoryLength(int maxHistoryLength) {
    this.maxHistoryLength = maxHistoryLength;
  }

  public int getMaxMessageLength() {
    return maxMessageLength;
  }

  public void setMaxMessageLength(int maxMessageLength) {
    this.maxMessageLength = maxMessageLength;
  }

  public Duration getInactivityTimeout() {
    return inactivityTimeout;
  }

  public void setInactivityTimeout(Duration inactivityTimeout) {
    this.inactivityTimeout = inactivityTimeout;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }

  public void setCleanupInterval(Duration cleanupInterval) {
    this.cleanupInterval = cleanupInterval;
  }

  public Duration getLockTimeout() {
    return lockTimeout;
  }

  public void setLockTimeout(Duration lockTimeout) {
    this.lockTimeout = lockTimeout;
  }

  public int getClosedRetentionDays() {
    return closedRetentionDays;
  }

  public void setClosedRetentionDays(int closedRetentionDays) {
    this.closedRetentionDays = closedRetentionDays;
  }

  public SummarizerType getSummarizer() {
    return summarizer;
  }

  public void setSummarizer(SummarizerType summarizer) {
    this.summarizer = summarizer;
  }

  public int getMaxSummaryLength() {
    return maxSummaryLength;
  }

  public void setMaxSummaryLength(int maxSummaryLength) {
    this.maxSummaryLength = maxSummaryLength;
  }

  public enum SummarizerType {
    EXTRACTIVE,
    LLM
  }
}
