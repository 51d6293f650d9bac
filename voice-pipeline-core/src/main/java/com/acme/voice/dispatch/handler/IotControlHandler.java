package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Simulated device command; no device protocol is spoken yet. */
public class IotControlHandler implements ActionHandler<Actions.IotControl> {
  private static final Logger log = LoggerFactory.getLogger(IotControlHandler.class);

  @Override
  public ActionType type() {
    return ActionType.IOT_CONTROL;
  }

  @Override
  public Class<Actions.IotControl> actionClass() {
    return Actions.IotControl.class;
  }

  @Override
  public Map<String, Object> execute(Actions.IotControl action, CommandContext context) {
    log.info(
        "IoT {} on node {} ({}) for tenant {}",
        action.operation().wire(),
        action.nodeId(),
        action.nodeName(),
        context.tenantId());
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("node_id", action.nodeId());
    payload.put("action", action.operation().wire());
    payload.put("status", "executed");
    payload.put("message", "Nodo " + action.nodeId() + " " + action.operation().wire() + " eseguito");
    return payload;
  }
}
