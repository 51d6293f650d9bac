package com.acme.voice.domain;

/** Controllable device of a house. */
public record IotNode(long id, long houseId, String name, String nodeType, boolean active) {}
