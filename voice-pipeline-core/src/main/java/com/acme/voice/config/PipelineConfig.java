package com.acme.voice.config;

/**
 * Tunables of the command pipeline: retry budget, prompt limits, transcription and lookup sizes.
 * Pure POJO - bound from the {@code pipeline.*} properties by the worker.
 */
public class PipelineConfig {

  private int maxRetries = 1;
  private int maxTextLength = 500;
  private int documentListLimit = 10;
  private int recordListLimit = 5;
  private Transcription transcription = new Transcription();
  private DeadLetter deadLetter = new DeadLetter();
  private Idempotency idempotency = new Idempotency();

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public int getMaxTextLength() {
    return maxTextLength;
  }

  public void setMaxTextLength(int maxTextLength) {
    this.maxTextLength = maxTextLength;
  }

  public int getDocumentListLimit() {
    return documentListLimit;
  }

  public void setDocumentListLimit(int documentListLimit) {
    this.documentListLimit = documentListLimit;
  }

  public int getRecordListLimit() {
    return recordListLimit;
  }

  public void setRecordListLimit(int recordListLimit) {
    this.recordListLimit = recordListLimit;
  }

  public Transcription getTranscription() {
    return transcription;
  }

  public void setTranscription(Transcription transcription) {
    this.transcription = transcription;
  }

  public DeadLetter getDeadLetter() {
    return deadLetter;
  }

  public void setDeadLetter(DeadLetter deadLetter) {
    this.deadLetter = deadLetter;
  }

  public Idempotency getIdempotency() {
    return idempotency;
  }

  public void setIdempotency(Idempotency idempotency) {
    this.idempotency = idempotency;
  }

  public static class Transcription {
    private boolean enabled = false;
    private String languageCode = "it-IT";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getLanguageCode() {
      return languageCode;
    }

    public void setLanguageCode(String languageCode) {
      this.languageCode = languageCode;
    }
  }

  public static class DeadLetter {
    private boolean enabled = true;
    private String parkedBy = "voice-pipeline-worker";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getParkedBy() {
      return parkedBy;
    }

    public void setParkedBy(String parkedBy) {
      this.parkedBy = parkedBy;
    }
  }

  public static class Idempotency {
    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }
}
