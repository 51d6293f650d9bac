package com.acme.voice.intent;

import com.acme.voice.domain.CommandEnvelope;
import com.acme.voice.domain.CommandRecord;

/**
 * Who issued a command and where, as needed by the analyzer and the action handlers.
 *
 * @param houseId house of the command record, null when the record has none
 * @param nodeId node the command came from, null when unknown
 */
public record CommandContext(
    String tenantId, String userId, Long houseId, Long nodeId, long recordId) {

  public static CommandContext of(CommandEnvelope envelope, CommandRecord record) {
    Long nodeId = envelope.nodeId() != null ? envelope.nodeId() : record.getNodeId();
    return new CommandContext(
        envelope.tenantId(), envelope.userId(), record.getHouseId(), nodeId, record.getId());
  }
}
