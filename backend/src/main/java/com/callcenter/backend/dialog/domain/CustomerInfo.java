package com.callcenter.backend.dialog.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(description = "Customer the dialog is held with")
public record CustomerInfo(
    @Schema(example = "Jane Doe")
        @NotBlank(message = "customer name must not be blank")
        @Size(max = 100, message = "customer name must be at most 100 characters")
        String name,
    @Schema(example = "+1 555 0100")
        @Size(max = 20, message = "phone must be at most 20 characters")
        @Pattern(regexp = ".*\\d.*", message = "phone must contain at least one digit")
        String phone,
    @Schema(example = "jane@example.com")
        @Size(max = 100, message = "email must be at most 100 characters")
        @Pattern(regexp = ".*@.*", message = "email must contain @")
        String email,
    @Schema(description = "Identifier of the customer in the CRM")
        @Size(max = 50, message = "customerId must be at most 50 characters")
        String customerId) {}
