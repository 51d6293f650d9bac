package com.acme.voice.transcription;

import com.acme.voice.domain.CommandEnvelope;
import com.acme.voice.domain.CommandRecord;
import com.acme.voice.spi.TranscriptionService;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Produces the text to analyze for a command, transcribing audio when needed. */
public class TranscriptionResolver {
  private static final Logger log = LoggerFactory.getLogger(TranscriptionResolver.class);

  private final TranscriptionService transcriptionService;
  private final String languageCode;

  public TranscriptionResolver(TranscriptionService transcriptionService, String languageCode) {
    this.transcriptionService = transcriptionService;
    this.languageCode = languageCode;
  }

  /** @return the text to analyze, empty when there is none */
  public Optional<String> resolve(CommandEnvelope envelope, CommandRecord record) {
    if (envelope.isAudio()) {
      String audioRef = envelope.audioUrl() != null ? envelope.audioUrl() : record.getAudioUrl();
      if (audioRef != null && !audioRef.isBlank()) {
        return nonBlank(transcribe(audioRef));
      }
      log.info("Audio command {} has no audio reference, using supplied text", envelope.recordId());
    }
    String text = envelope.transcribedText();
    if (text == null || text.isBlank()) {
      text = record.getInputText();
    }
    return nonBlank(text);
  }

  private String transcribe(String audioRef) {
    if (!transcriptionService.isAvailable()) {
      String placeholder = PlaceholderTranscripts.forAudio(audioRef);
      log.info("Transcription unavailable, using placeholder transcript for {}", audioRef);
      return placeholder;
    }
    TranscriptionResult result = transcriptionService.transcribe(audioRef, languageCode);
    log.info(
        "Transcription of {} by {}: {} chars, confidence {}",
        audioRef,
        result.engineName(),
        result.text().length(),
        result.confidence());
    return result.text();
  }

  private static Optional<String> nonBlank(String text) {
    return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.trim());
  }
}
