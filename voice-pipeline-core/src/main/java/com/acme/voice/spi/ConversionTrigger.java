package com.acme.voice.spi;

/** Starts the long-running BIM conversion for a model. Fire and forget. */
public interface ConversionTrigger {

  /** @return id of the submitted conversion job */
  String trigger(long modelId, String conversionType);
}
