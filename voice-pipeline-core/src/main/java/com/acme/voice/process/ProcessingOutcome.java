package com.acme.voice.process;

/** What became of one queued message. */
public enum ProcessingOutcome {
  /** Dropped by the security gate. */
  REJECTED,
  /** Passed the gate but could not be read as an envelope. */
  INVALID,
  COMPLETED,
  FAILED
}
