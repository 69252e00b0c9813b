package com.callcenter.backend.chat.provider;

public record GenerationOverrides(Double temperature, Integer maxTokens) {

  public static GenerationOverrides empty() {
    return new GenerationOverrides(null, null);
  }

  public static GenerationOverrides temperature(Double temperature) {
    return new GenerationOverrides(temperature, null);
  }
}
