package com.callcenter.backend.chat.provider;

public record IntentCandidate(String label, double confidence) {}
