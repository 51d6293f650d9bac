package com.acme.voice.domain;

import com.acme.voice.core.EnvelopeFormatException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A command message as taken off the voice command queue.
 *
 * @param tenantId owning tenant
 * @param userId user who issued the command
 * @param nodeId node the command was issued from, may be null
 * @param audioUrl object storage reference of the recording, may be null
 * @param transcribedText text supplied by the producer, may be null
 * @param timestamp producer timestamp
 * @param recordId id of the command record to drive
 * @param kind audio or text
 * @param retryCount attempts already spent on this envelope
 */
public record CommandEnvelope(
    String tenantId,
    String userId,
    Long nodeId,
    String audioUrl,
    String transcribedText,
    Instant timestamp,
    long recordId,
    CommandKind kind,
    int retryCount) {

  public static final String TENANT_ID = "tenant_id";
  public static final String USER_ID = "user_id";
  public static final String NODE_ID = "node_id";
  public static final String AUDIO_URL = "audio_url";
  public static final String TRANSCRIBED_TEXT = "transcribed_text";
  public static final String TIMESTAMP = "timestamp";
  public static final String RECORD_ID = "audiolog_id";
  public static final String COMMAND_TYPE = "command_type";
  public static final String RETRY_COUNT = "_retry_count";

  public CommandEnvelope {
    if (kind == null) {
      kind = CommandKind.TEXT;
    }
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must not be negative");
    }
  }

  public boolean isAudio() {
    return kind == CommandKind.AUDIO;
  }

  public CommandEnvelope withRetryCount(int newRetryCount) {
    return new CommandEnvelope(
        tenantId, userId, nodeId, audioUrl, transcribedText, timestamp, recordId, kind, newRetryCount);
  }

  /** Wire form of the envelope, as it would be put back on the queue. */
  public Map<String, Object> toWireMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(TENANT_ID, tenantId);
    map.put(USER_ID, userId);
    if (nodeId != null) {
      map.put(NODE_ID, nodeId);
    }
    if (audioUrl != null) {
      map.put(AUDIO_URL, audioUrl);
    }
    if (transcribedText != null) {
      map.put(TRANSCRIBED_TEXT, transcribedText);
    }
    map.put(TIMESTAMP, timestamp == null ? null : timestamp.toString());
    map.put(RECORD_ID, recordId);
    map.put(COMMAND_TYPE, kind.wire());
    map.put(RETRY_COUNT, retryCount);
    return map;
  }

  /**
   * Build an envelope from a key-checked wire map.
   *
   * @throws EnvelopeFormatException when a value has the wrong shape
   */
  public static CommandEnvelope fromMap(Map<String, Object> raw) {
    String tenantId = requiredId(raw, TENANT_ID);
    String userId = requiredId(raw, USER_ID);
    Long nodeId = optionalLong(raw, NODE_ID);
    Long recordId = optionalLong(raw, RECORD_ID);
    if (recordId == null) {
      throw new EnvelopeFormatException("Missing " + RECORD_ID);
    }
    Long retry = optionalLong(raw, RETRY_COUNT);
    if (retry != null && (retry < 0 || retry > Integer.MAX_VALUE)) {
      throw new EnvelopeFormatException("Invalid " + RETRY_COUNT + ": " + retry);
    }

    CommandKind kind;
    try {
      kind = CommandKind.fromWire(optionalString(raw, COMMAND_TYPE));
    } catch (IllegalArgumentException e) {
      throw new EnvelopeFormatException(e.getMessage(), e);
    }

    return new CommandEnvelope(
        tenantId,
        userId,
        nodeId,
        blankToNull(optionalString(raw, AUDIO_URL)),
        optionalString(raw, TRANSCRIBED_TEXT),
        parseTimestamp(raw.get(TIMESTAMP)),
        recordId,
        kind,
        retry == null ? 0 : retry.intValue());
  }

  private static String requiredId(Map<String, Object> raw, String key) {
    Object value = raw.get(key);
    if (value instanceof String s && !s.isBlank()) {
      return s.trim();
    }
    if (value instanceof Number n) {
      return String.valueOf(n.longValue());
    }
    throw new EnvelopeFormatException("Invalid " + key + ": " + value);
  }

  private static String optionalString(Map<String, Object> raw, String key) {
    Object value = raw.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof String s) {
      return s;
    }
    throw new EnvelopeFormatException(key + " must be a string");
  }

  private static Long optionalLong(Map<String, Object> raw, String key) {
    Object value = raw.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        throw new EnvelopeFormatException(key + " is not a number: " + s, e);
      }
    }
    throw new EnvelopeFormatException(key + " is not an integer: " + value);
  }

  /** Accepts ISO-8601 instants, offset date-times and zone-less date-times (read as UTC). */
  static Instant parseTimestamp(Object value) {
    if (!(value instanceof String text) || text.isBlank()) {
      throw new EnvelopeFormatException("Invalid " + TIMESTAMP + ": " + value);
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException ignored) {
      // fall through to the offset and local forms
    }
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException ignored) {
      // fall through to the local form
    }
    try {
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new EnvelopeFormatException("Invalid " + TIMESTAMP + ": " + text, e);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
