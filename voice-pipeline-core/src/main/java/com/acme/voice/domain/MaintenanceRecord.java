package com.acme.voice.domain;

import java.time.Instant;

/** Maintenance request of a house, read for status and inserted by the create action. */
public record MaintenanceRecord(
    Long id, String tenantId, String userId, Long houseId, String description, String status,
    Instant createdAt) {

  public static final String STATUS_PENDING = "pending";
}
