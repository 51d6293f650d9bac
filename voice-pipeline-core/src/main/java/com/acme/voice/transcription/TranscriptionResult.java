package com.acme.voice.transcription;

import java.time.Instant;
import java.util.Objects;

/**
 * Text recognized from a recording.
 *
 * <p>Empty text is valid: silence or unclear audio may produce no transcription.
 */
public record TranscriptionResult(String text, double confidence, Instant timestamp, String engineName) {

  public TranscriptionResult {
    Objects.requireNonNull(text, "Transcription text must not be null");
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException(
          "Confidence must be between 0.0 and 1.0, got: " + confidence);
    }
    Objects.requireNonNull(timestamp, "Timestamp must not be null");
    Objects.requireNonNull(engineName, "Engine name must not be null");
  }

  public static TranscriptionResult of(String text, double confidence, String engineName) {
    return new TranscriptionResult(text, confidence, Instant.now(), engineName);
  }

  public boolean isBlank() {
    return text.isBlank();
  }
}
