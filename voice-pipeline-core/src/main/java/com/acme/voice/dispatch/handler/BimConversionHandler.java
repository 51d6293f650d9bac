package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.spi.ConversionTrigger;
import java.util.LinkedHashMap;
import java.util.Map;

/** Starts the asynchronous conversion of a pending BIM model. */
public class BimConversionHandler implements ActionHandler<Actions.BimConversion> {

  private final ConversionTrigger conversionTrigger;

  public BimConversionHandler(ConversionTrigger conversionTrigger) {
    this.conversionTrigger = conversionTrigger;
  }

  @Override
  public ActionType type() {
    return ActionType.BIM_CONVERSION;
  }

  @Override
  public Class<Actions.BimConversion> actionClass() {
    return Actions.BimConversion.class;
  }

  @Override
  public Map<String, Object> execute(Actions.BimConversion action, CommandContext context) {
    String taskId = conversionTrigger.trigger(action.modelId(), action.conversionType());
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("model_id", action.modelId());
    payload.put("task_id", taskId);
    payload.put("status", "started");
    payload.put("message", "Conversione BIM " + action.modelId() + " avviata");
    return payload;
  }
}
