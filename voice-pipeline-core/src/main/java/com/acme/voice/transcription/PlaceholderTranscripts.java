package com.acme.voice.transcription;

import java.util.Locale;

/** Deterministic stand-in transcripts used when no speech recognition is configured. */
public final class PlaceholderTranscripts {
  public static final String LIGHTS_ON = "Accendi le luci del soggiorno";
  public static final String MEETING = "Riunione di progetto programmata per domani";
  public static final String GENERIC = "Comando audio ricevuto e trascritto";

  private PlaceholderTranscripts() {}

  public static String forAudio(String audioRef) {
    String ref = audioRef == null ? "" : audioRef.toLowerCase(Locale.ROOT);
    if (ref.contains("voice-commands")) {
      return LIGHTS_ON;
    }
    if (ref.contains("meeting")) {
      return MEETING;
    }
    return GENERIC;
  }
}
