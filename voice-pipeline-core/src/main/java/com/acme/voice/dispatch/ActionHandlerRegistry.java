package com.acme.voice.dispatch;

import com.acme.voice.core.InternalConsistencyException;
import com.acme.voice.intent.Action;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.CommandContext;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps action types to their handlers. Pure POJO - no framework dependencies. */
public class ActionHandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

  private final Map<ActionType, ActionHandler<?>> handlers = new EnumMap<>(ActionType.class);

  /**
   * Register a handler for its action type
   *
   * @throws IllegalStateException if a handler is already registered for this action type
   */
  public void register(ActionHandler<?> handler) {
    if (handlers.containsKey(handler.type())) {
      String error = "Handler already registered for action type: " + handler.type().wire();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registering handler for action type: {}", handler.type().wire());
    handlers.put(handler.type(), handler);
  }

  public boolean isRegistered(ActionType type) {
    return handlers.containsKey(type);
  }

  public Set<ActionType> registeredTypes() {
    return Set.copyOf(handlers.keySet());
  }

  /**
   * Run the handler registered for the action's type.
   *
   * @throws InternalConsistencyException if no handler is registered for the type
   */
  public Map<String, Object> execute(Action action, CommandContext context) {
    return invoke(require(action.type()), action, context);
  }

  /** @throws InternalConsistencyException if no handler is registered for the type */
  ActionHandler<?> require(ActionType type) {
    ActionHandler<?> handler = handlers.get(type);
    if (handler == null) {
      String error = "No handler registered for action type: " + type.wire();
      log.error(error);
      throw new InternalConsistencyException(error);
    }
    return handler;
  }

  private static <A extends Action> Map<String, Object> invoke(
      ActionHandler<A> handler, Action action, CommandContext context) {
    if (!handler.actionClass().isInstance(action)) {
      throw new InternalConsistencyException(
          "Handler for "
              + handler.type().wire()
              + " cannot execute "
              + action.getClass().getSimpleName());
    }
    return handler.execute(handler.actionClass().cast(action), context);
  }
}
