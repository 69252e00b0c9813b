package com.callcenter.backend.dialog.domain;

import com.callcenter.backend.agent.context.DialogContext;
import com.callcenter.backend.agent.context.MessageRecord;
import com.callcenter.backend.agent.context.SummaryRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Persistent state of one dialog: customer, status, retained messages and optional summary. */
public class DialogRecord {

  private String dialogId;
  private CustomerInfo customerInfo;
  private DialogStatus status = DialogStatus.ACTIVE;
  private DialogPriority priority = DialogPriority.NORMAL;
  private String source;
  private Instant createdAt;
  private Instant updatedAt;
  private String currentAgent;
  private SummaryRecord summary;
  private List<MessageRecord> messages = new ArrayList<>();
  private Map<String, Object> metadata = new LinkedHashMap<>();

  public DialogRecord() {}

  public DialogRecord(
      String dialogId,
      CustomerInfo customerInfo,
      DialogPriority priority,
      String source,
      Instant createdAt) {
    this.dialogId = dialogId;
    this.customerInfo = customerInfo;
    this.priority = priority != null ? priority : DialogPriority.NORMAL;
    this.source = source;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public DialogContext toContext() {
    return new DialogContext(summary, messages);
  }

  public void applyContext(DialogContext context) {
    this.summary = context.summary();
    this.messages = new ArrayList<>(context.messages());
  }

  public void appendMessage(MessageRecord message) {
    messages.add(message);
  }

  @JsonIgnore
  public int getTotalMessageCount() {
    return messages.size() + (summary != null ? summary.coveredMessageCount() : 0);
  }

  public String getDialogId() {
    return dialogId;
  }

  public void setDialogId(String dialogId) {
    this.dialogId = dialogId;
  }

  public CustomerInfo getCustomerInfo() {
    return customerInfo;
  }

  public void setCustomerInfo(CustomerInfo customerInfo) {
    this.customerInfo = customerInfo;
  }

  public DialogStatus getStatus() {
    return status;
  }

  public void setStatus(DialogStatus status) {
    this.status = status;
  }

  public DialogPriority getPriority() {
    return priority;
  }

  public void setPriority(DialogPriority priority) {
    this.priority = priority;
  }

  public String getSource() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  public String getCurrentAgent() {
    return currentAgent;
  }

  public void setCurrentAgent(String currentAgent) {
    this.currentAgent = currentAgent;
  }

  public SummaryRecord getSummary() {
    return summary;
  }

  public void setSummary(SummaryRecord summary) {
    this.summary = summary;
  }

  public List<MessageRecord> getMessages() {
    return messages;
  }

  public void setMessages(List<MessageRecord> messages) {
    this.messages = messages != null ? new ArrayList<>(messages) : new ArrayList<>();
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, Object> metadata) {
    this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
  }
}
