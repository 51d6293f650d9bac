package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.intent.SensorKind;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/** Simulated house sensors with fixed readings. */
public class SensorReadHandler implements ActionHandler<Actions.SensorRead> {
  static final double TEMPERATURE = 22.5;
  static final double HUMIDITY = 45.2;

  private final Clock clock;

  public SensorReadHandler(Clock clock) {
    this.clock = clock;
  }

  @Override
  public ActionType type() {
    return ActionType.SENSOR_READ;
  }

  @Override
  public Class<Actions.SensorRead> actionClass() {
    return Actions.SensorRead.class;
  }

  @Override
  public Map<String, Object> execute(Actions.SensorRead action, CommandContext context) {
    SensorKind sensor = action.sensor();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(sensor.wire(), sensor == SensorKind.TEMPERATURE ? TEMPERATURE : HUMIDITY);
    payload.put("unit", sensor.unit());
    payload.put("timestamp", clock.instant().toString());
    return payload;
  }
}
