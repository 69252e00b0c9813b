package com.callcenter.backend.dialog.service;

import com.callcenter.backend.dialog.domain.DialogPriority;
import com.callcenter.backend.dialog.domain.DialogStatus;
import java.time.Instant;

public record DialogStatusView(
    String dialogId,
    DialogStatus status,
    DialogPriority priority,
    String currentAgent,
    int messageCount,
    Instant createdAt,
    Instant updatedAt,
    String customerName) {}
