package com.acme.voice.repository;

/** Dead letter store - parking envelopes the pipeline gave up on for manual intervention */
public interface DeadLetterRepository {

  /**
   * Insert a failed envelope into the dead letter table
   *
   * @param recordId the command record id
   * @param tenantId the tenant of the envelope
   * @param userId the user of the envelope
   * @param payload the envelope in wire form (JSON)
   * @param errorClass the exception class name
   * @param errorMessage the error message
   * @param attempts number of attempts before parking
   * @param parkedBy the component that parked this envelope
   */
  void park(
      long recordId,
      String tenantId,
      String userId,
      String payload,
      String errorClass,
      String errorMessage,
      int attempts,
      String parkedBy);
}
