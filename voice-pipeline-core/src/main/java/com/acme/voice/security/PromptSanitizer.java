package com.acme.voice.security;

/**
 * Screens free text before it reaches the intent analyzer. Used on envelope text by the
 * {@link SecurityGate} and on transcripts by the state machine.
 */
public class PromptSanitizer {

  private final int maxLength;

  public PromptSanitizer(int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    this.maxLength = maxLength;
  }

  public SanitizationResult check(Object text) {
    if (!(text instanceof String s)) {
      return SanitizationResult.blocked(SanitizationResult.NOT_A_STRING, "Input is not a string");
    }
    if (s.length() > maxLength) {
      return SanitizationResult.blocked(
          SanitizationResult.TOO_LONG, "Prompt too long (>" + maxLength + " characters)");
    }
    for (DangerPattern pattern : DangerPattern.values()) {
      if (pattern.matches(s)) {
        return SanitizationResult.blocked(
            pattern.label(), "Dangerous pattern detected: " + pattern.label());
      }
    }
    return SanitizationResult.pass();
  }

  public int maxLength() {
    return maxLength;
  }
}
