package com.acme.voice.domain;

import java.util.Locale;

public enum ProcessingStatus {
  RECEIVED,
  TRANSCRIBING,
  ANALYZING,
  COMPLETED,
  FAILED;

  /** Value stored in the processing_status column. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static ProcessingStatus fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
