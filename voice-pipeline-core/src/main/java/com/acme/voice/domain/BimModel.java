package com.acme.voice.domain;

public record BimModel(long id, String userId, String name, String status) {

  public static final String STATUS_PENDING = "pending";
}
