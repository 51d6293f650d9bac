package com.acme.voice.audit;

public enum AuditEventKind {
  INVALID_KEYS("invalid keys"),
  MISSING_KEYS("missing keys"),
  PROMPT_BLOCKED("prompt blocked"),
  INVALID_ENVELOPE("invalid envelope"),
  RETRY("retry"),
  PROCESSING_FAILED("processing failed"),
  INTERNAL_ERROR("internal error");

  private final String label;

  AuditEventKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
