package com.acme.voice.security;

import com.acme.voice.audit.AuditEventKind;

/**
 * Whether a raw message may enter the pipeline.
 *
 * @param accepted true when every check passed
 * @param rejection the audit kind of the failed check, null when accepted
 * @param reason why the message was rejected, null when accepted
 */
public record GateDecision(boolean accepted, AuditEventKind rejection, String reason) {

  private static final GateDecision ACCEPTED = new GateDecision(true, null, null);

  public static GateDecision accept() {
    return ACCEPTED;
  }

  public static GateDecision reject(AuditEventKind rejection, String reason) {
    return new GateDecision(false, rejection, reason);
  }
}
