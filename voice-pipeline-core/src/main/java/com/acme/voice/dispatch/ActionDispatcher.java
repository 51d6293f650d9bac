package com.acme.voice.dispatch;

import com.acme.voice.core.InternalConsistencyException;
import com.acme.voice.core.Jsons;
import com.acme.voice.intent.Action;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.ActionLedgerRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the analyzed actions in order. A failing action does not stop its siblings. Results of
 * side-effecting actions are kept in the action ledger and replayed when the same command is
 * processed again.
 */
public class ActionDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

  static final String REPLAYED = "replayed";

  private final ActionHandlerRegistry registry;
  private final ActionLedgerRepository ledger;
  private final boolean idempotencyEnabled;

  public ActionDispatcher(
      ActionHandlerRegistry registry, ActionLedgerRepository ledger, boolean idempotencyEnabled) {
    this.registry = registry;
    this.ledger = ledger;
    this.idempotencyEnabled = idempotencyEnabled && ledger != null;
  }

  /**
   * @throws InternalConsistencyException when an action type has no handler
   */
  public List<ActionResult> dispatch(List<Action> actions, CommandContext context) {
    List<ActionResult> results = new ArrayList<>(actions.size());
    for (int i = 0; i < actions.size(); i++) {
      Action action = actions.get(i);
      registry.require(action.type());

      boolean guarded = idempotencyEnabled && action.type().isSideEffecting();
      String key = guarded ? idempotencyKey(context, i, action) : null;
      if (guarded) {
        Optional<String> previous = ledger.findResult(key);
        if (previous.isPresent()) {
          log.info("Replaying {} for command {} from ledger", action.type().wire(), context.recordId());
          results.add(ActionResult.succeeded(action, replayed(previous.get())));
          continue;
        }
      }

      ActionResult result = execute(action, context);
      if (guarded && result.success()) {
        remember(key, context, action, result);
      }
      results.add(result);
    }
    return results;
  }

  private ActionResult execute(Action action, CommandContext context) {
    try {
      Map<String, Object> payload = registry.execute(action, context);
      log.info("Action {} executed for command {}", action.type().wire(), context.recordId());
      return ActionResult.succeeded(action, payload);
    } catch (InternalConsistencyException e) {
      throw e;
    } catch (Exception e) {
      log.error(
          "Error executing action {} for command {}", action.type().wire(), context.recordId(), e);
      return ActionResult.failed(action, e.getMessage() != null ? e.getMessage() : e.toString());
    }
  }

  private void remember(String key, CommandContext context, Action action, ActionResult result) {
    try {
      ledger.recordIfAbsent(key, context.recordId(), action.type().wire(), Jsons.toJson(result.payload()));
    } catch (RuntimeException e) {
      log.warn("Could not record {} in the action ledger: {}", key, e.getMessage(), e);
    }
  }

  private static Map<String, Object> replayed(String json) {
    Map<String, Object> payload = new LinkedHashMap<>(Jsons.readMap(json));
    payload.put(REPLAYED, true);
    return payload;
  }

  static String idempotencyKey(CommandContext context, int index, Action action) {
    return context.recordId() + ":" + index + ":" + action.type().wire();
  }
}
