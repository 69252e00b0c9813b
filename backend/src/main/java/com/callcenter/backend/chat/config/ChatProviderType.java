package com.callcenter.backend.chat.config;

public enum ChatProviderType {
  /** Any OpenAI-compatible chat completions endpoint. */
  OPENAI,
  /** Deterministic keyword-driven provider for local runs and tests; makes no network calls. */
  MOCK
}
