package com.callcenter.backend.dialog.api;

public record DialogDeleteResponse(String dialogId, boolean deleted) {}
