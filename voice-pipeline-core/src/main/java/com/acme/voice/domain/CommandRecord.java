package com.acme.voice.domain;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Audio/text command log entry created by the producer in status RECEIVED (pure domain object, no
 * persistence annotations).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CommandRecord {

  private long id;
  private String tenantId;
  private String userId;
  private Long houseId;
  private Long nodeId;
  private String audioUrl;
  private String inputText;
  private String responseText;
  private ProcessingStatus status;
  private Instant createdAt;
  private Instant updatedAt;
}
