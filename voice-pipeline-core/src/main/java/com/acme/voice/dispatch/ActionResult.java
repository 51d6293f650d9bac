package com.acme.voice.dispatch;

import com.acme.voice.intent.Action;
import java.util.Map;

/** Outcome of one dispatched action. */
public record ActionResult(Action action, boolean success, Map<String, Object> payload, String error) {

  public static ActionResult succeeded(Action action, Map<String, Object> payload) {
    return new ActionResult(action, true, payload == null ? Map.of() : payload, null);
  }

  public static ActionResult failed(Action action, String error) {
    return new ActionResult(action, false, Map.of(), error);
  }
}
