package com.acme.voice.transcription;

import com.acme.voice.core.TransientException;
import com.acme.voice.spi.TranscriptionProvider;
import com.acme.voice.spi.TranscriptionService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries the configured providers in order. A provider that fails or hears nothing hands over to
 * the next one; the last blank result is returned when nobody recognized anything.
 */
public class ProviderChainTranscriptionService implements TranscriptionService {
  private static final Logger log = LoggerFactory.getLogger(ProviderChainTranscriptionService.class);

  private final List<TranscriptionProvider> providers;
  private final boolean enabled;

  public ProviderChainTranscriptionService(List<TranscriptionProvider> providers, boolean enabled) {
    this.providers = List.copyOf(providers);
    this.enabled = enabled;
  }

  @Override
  public boolean isAvailable() {
    return enabled && !providers.isEmpty();
  }

  @Override
  public TranscriptionResult transcribe(String audioRef, String languageCode) {
    if (!isAvailable()) {
      throw new IllegalStateException("No transcription provider available");
    }
    RuntimeException lastFailure = null;
    TranscriptionResult lastBlank = null;
    for (TranscriptionProvider provider : providers) {
      try {
        TranscriptionResult result = provider.transcribe(audioRef, languageCode);
        if (result != null && !result.isBlank()) {
          log.debug(
              "Transcribed {} with {} (confidence {})",
              audioRef,
              provider.name(),
              result.confidence());
          return result;
        }
        log.info("Provider {} returned no text for {}", provider.name(), audioRef);
        if (result != null) {
          lastBlank = result;
        }
      } catch (RuntimeException e) {
        log.warn("Provider {} failed for {}: {}", provider.name(), audioRef, e.getMessage());
        lastFailure = e;
      }
    }
    if (lastBlank != null) {
      return lastBlank;
    }
    throw new TransientException("All transcription providers failed for " + audioRef, lastFailure);
  }
}
