package com.acme.voice.domain;

import java.util.Locale;

/** Input modality of a queued command. */
public enum CommandKind {
  AUDIO("audio"),
  TEXT("text");

  private final String wire;

  CommandKind(String wire) {
    this.wire = wire;
  }

  public String wire() {
    return wire;
  }

  /**
   * @return the kind for a wire value, TEXT when the value is null
   * @throws IllegalArgumentException for any other value
   */
  public static CommandKind fromWire(String value) {
    if (value == null) {
      return TEXT;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (CommandKind kind : values()) {
      if (kind.wire.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown command type: " + value);
  }
}
