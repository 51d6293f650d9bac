package com.acme.voice.core;

/**
 * Raised when the pipeline's own wiring is broken, e.g. an action type without a registered
 * handler. Never retried.
 */
public class InternalConsistencyException extends PermanentException {
  public InternalConsistencyException(String message) {
    super(message);
  }
}
