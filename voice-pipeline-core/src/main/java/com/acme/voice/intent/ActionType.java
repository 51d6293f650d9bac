package com.acme.voice.intent;

/** Closed set of actions the analyzer can produce, with their wire tags. */
public enum ActionType {
  IOT_CONTROL("iot_control", true),
  BIM_CONVERSION("bim_conversion", true),
  BIM_STATUS("bim_status", false),
  DOCUMENT_LIST("document_list", false),
  DOCUMENT_SEARCH("document_search", false),
  MAINTENANCE_STATUS("maintenance_status", false),
  MAINTENANCE_CREATE("maintenance_create", true),
  BOOKING_CREATE("booking_create", true),
  BOOKING_LIST("booking_list", false),
  SENSOR_READ("sensor_read", false),
  SYSTEM_STATUS("system_status", false),
  HELP("help", false);

  private final String wire;
  private final boolean sideEffecting;

  ActionType(String wire, boolean sideEffecting) {
    this.wire = wire;
    this.sideEffecting = sideEffecting;
  }

  public String wire() {
    return wire;
  }

  /** Side-effecting actions must not run twice for the same command. */
  public boolean isSideEffecting() {
    return sideEffecting;
  }
}
