package com.acme.voice.core;

/** A queued message that passed the key checks but cannot be turned into a CommandEnvelope. */
public class EnvelopeFormatException extends PermanentException {
  public EnvelopeFormatException(String message) {
    super(message);
  }

  public EnvelopeFormatException(String message, Throwable e) {
    super(message, e);
  }
}
