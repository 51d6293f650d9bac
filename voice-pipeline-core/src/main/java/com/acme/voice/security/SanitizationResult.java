package com.acme.voice.security;

/**
 * Outcome of a prompt check.
 *
 * @param allowed whether the text may be processed
 * @param violation label of the violated check, null when allowed
 * @param reason human readable reason, null when allowed
 */
public record SanitizationResult(boolean allowed, String violation, String reason) {

  public static final String NOT_A_STRING = "not_a_string";
  public static final String TOO_LONG = "too_long";

  private static final SanitizationResult ALLOWED = new SanitizationResult(true, null, null);

  public static SanitizationResult pass() {
    return ALLOWED;
  }

  public static SanitizationResult blocked(String violation, String reason) {
    return new SanitizationResult(false, violation, reason);
  }
}
