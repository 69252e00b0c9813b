package com.callcenter.backend.dialog.api;

public record DialogMaintenanceResponse(String message, int affectedDialogs) {}
