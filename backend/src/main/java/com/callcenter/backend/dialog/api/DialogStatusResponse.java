package com.callcenter.backend.dialog.api;

import com.callcenter.backend.dialog.domain.DialogPriority;
import com.callcenter.backend.dialog.domain.DialogStatus;
import java.time.Instant;

public record DialogStatusResponse(
    String dialogId,
    DialogStatus status,
    DialogPriority priority,
    String currentAgent,
    int messageCount,
    Instant createdAt,
    Instant updatedAt,
    String customerName) {}
