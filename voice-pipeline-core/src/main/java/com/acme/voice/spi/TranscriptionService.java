package com.acme.voice.spi;

import com.acme.voice.transcription.TranscriptionResult;

/** Speech recognition as seen by the pipeline. */
public interface TranscriptionService {

  /** @return false when transcription is disabled or no provider is configured */
  boolean isAvailable();

  /**
   * @param audioRef object storage reference of the recording
   * @param languageCode BCP-47 language hint, e.g. it-IT
   */
  TranscriptionResult transcribe(String audioRef, String languageCode);
}
