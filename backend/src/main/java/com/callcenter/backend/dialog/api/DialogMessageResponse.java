package com.callcenter.backend.dialog.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Map;

@Schema(description = "Result of one dialog turn")
public record DialogMessageResponse(
    String dialogId,
    @Schema(description = "Id of the stored customer message") String messageId,
    String agentResponse,
    @Schema(description = "Handler owning the dialog after this turn", example = "sales")
        String currentAgent,
    @Schema(description = "Owner before this turn; present only when ownership changed")
        String previousAgent,
    @Schema(description = "Why ownership changed", example = "refund_escalation")
        String handoffReason,
    @Schema(description = "Intent classified by the router, when routing happened")
        String userIntent,
    Instant timestamp,
    Map<String, Object> metadata) {}
