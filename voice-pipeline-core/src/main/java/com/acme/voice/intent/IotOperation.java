package com.acme.voice.intent;

public enum IotOperation {
  TURN_ON("turn_on", "Accende"),
  TURN_OFF("turn_off", "Spegne");

  private final String wire;
  private final String verb;

  IotOperation(String wire, String verb) {
    this.wire = wire;
    this.verb = verb;
  }

  public String wire() {
    return wire;
  }

  public String verb() {
    return verb;
  }
}
