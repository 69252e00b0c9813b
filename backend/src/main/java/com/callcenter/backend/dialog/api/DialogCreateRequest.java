package com.callcenter.backend.dialog.api;

import com.callcenter.backend.dialog.domain.CustomerInfo;
import com.callcenter.backend.dialog.domain.DialogPriority;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record DialogCreateRequest(
    @Valid @NotNull(message = "customerInfo must be provided") CustomerInfo customerInfo,
    @Schema(description = "First customer message, processed as the first turn when present")
        @Size(max = 2000, message = "initialMessage must be at most 2000 characters")
        String initialMessage,
    @Schema(description = "Channel the dialog originates from", example = "api")
        @Size(max = 50, message = "source must be at most 50 characters")
        String source,
    @Schema(description = "low, normal, high or urgent", example = "normal")
        DialogPriority priority) {}
