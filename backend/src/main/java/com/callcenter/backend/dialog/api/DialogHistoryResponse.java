package com.callcenter.backend.dialog.api;

import com.callcenter.backend.dialog.domain.CustomerInfo;
import com.callcenter.backend.dialog.domain.DialogPriority;
import com.callcenter.backend.dialog.domain.DialogStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Schema(description = "Dialog with its retained messages and summary")
public record DialogHistoryResponse(
    String dialogId,
    CustomerInfo customerInfo,
    DialogStatus status,
    DialogPriority priority,
    String source,
    String currentAgent,
    @Schema(description = "Summary of messages no longer in the retained window")
        String conversationSummary,
    @Schema(description = "Number of messages folded into the summary")
        int summarizedMessages,
    List<DialogMessageView> messages,
    Instant createdAt,
    Instant updatedAt,
    Map<String, Object> metadata) {}
