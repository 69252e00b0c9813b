package com.callcenter.backend.dialog.api;

import com.callcenter.backend.agent.context.SenderRole;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

public record MessageRequest(
    @NotBlank(message = "message must not be blank")
        @Size(max = 2000, message = "message must be at most 2000 characters")
        String message,
    @Schema(description = "user or system; defaults to user", example = "user")
        SenderRole messageType,
    @Schema(description = "Free-form attributes stored with the message")
        Map<String, Object> metadata) {}
