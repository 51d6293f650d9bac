package com.acme.voice.domain;

import java.time.Instant;

public record BookingSummary(
    Long id, String tenantId, String userId, Long houseId, String roomName, String status,
    Instant createdAt) {

  public static final String STATUS_REQUESTED = "requested";
}
