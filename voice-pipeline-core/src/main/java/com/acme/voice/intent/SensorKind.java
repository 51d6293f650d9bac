package com.acme.voice.intent;

public enum SensorKind {
  TEMPERATURE("temperature", "temperatura", "°C"),
  HUMIDITY("humidity", "umidità", "%");

  private final String wire;
  private final String italianName;
  private final String unit;

  SensorKind(String wire, String italianName, String unit) {
    this.wire = wire;
    this.italianName = italianName;
    this.unit = unit;
  }

  public String wire() {
    return wire;
  }

  public String italianName() {
    return italianName;
  }

  public String unit() {
    return unit;
  }
}
