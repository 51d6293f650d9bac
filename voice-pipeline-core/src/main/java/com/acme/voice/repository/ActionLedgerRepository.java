package com.acme.voice.repository;

import java.util.Optional;

/** Results of side-effecting actions, keyed so a redelivered command does not repeat them. */
public interface ActionLedgerRepository {

  /** @return the stored result JSON for the key, if the action already ran */
  Optional<String> findResult(String idempotencyKey);

  /**
   * Store a result unless the key is already present.
   *
   * @return true if a row was inserted
   */
  boolean recordIfAbsent(String idempotencyKey, long recordId, String actionType, String resultJson);
}
