package com.acme.voice.repository;

import com.acme.voice.domain.CommandRecord;
import com.acme.voice.domain.ProcessingStatus;
import java.util.Optional;

/** Access to the command records driven through the pipeline. */
public interface CommandRecordRepository {

  Optional<CommandRecord> findById(long id);

  /** Persist a status change; the caller moves on only after this returns. */
  void transition(long id, ProcessingStatus status);

  /** Store the text the pipeline is about to analyze together with the ANALYZING status. */
  void recordInputText(long id, String inputText, ProcessingStatus status);

  /** Write the response text and the terminal status in a single update. */
  void recordResponse(long id, String responseText, ProcessingStatus status);
}
