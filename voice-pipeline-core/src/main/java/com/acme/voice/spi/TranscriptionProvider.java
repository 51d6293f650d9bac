package com.acme.voice.spi;

import com.acme.voice.transcription.TranscriptionResult;

/** A concrete speech recognition engine. */
public interface TranscriptionProvider {

  String name();

  TranscriptionResult transcribe(String audioRef, String languageCode);
}
