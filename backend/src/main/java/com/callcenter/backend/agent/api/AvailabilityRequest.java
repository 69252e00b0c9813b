package com.callcenter.backend.agent.api;

import jakarta.validation.constraints.NotNull;

public record AvailabilityRequest(@NotNull(message = "available must be provided") Boolean available) {}
