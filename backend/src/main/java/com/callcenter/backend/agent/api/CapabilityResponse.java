package com.callcenter.backend.agent.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Registered specialist handler")
public record CapabilityResponse(
    @Schema(description = "Capability name used in routing and handoffs", example = "sales")
        String name,
    @Schema(description = "Handler variant implementing the capability", example = "sales")
        String specialization,
    @Schema(description = "Declared skill tags") List<String> skills,
    @Schema(description = "Whether the handler currently accepts dispatches") boolean available,
    @Schema(description = "True for the handler receiving unroutable first-contact turns")
        boolean defaultHandler,
    @Schema(description = "True for the supervisory handler reachable only via handoff")
        boolean escalationHandler) {}
