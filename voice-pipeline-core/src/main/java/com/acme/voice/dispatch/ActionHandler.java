package com.acme.voice.dispatch;

import com.acme.voice.intent.Action;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.CommandContext;
import java.util.Map;

/**
 * Executes one kind of action.
 *
 * @param <A> the action variant handled
 */
public interface ActionHandler<A extends Action> {

  ActionType type();

  Class<A> actionClass();

  /**
   * @return the result payload, rendered by the response synthesizer
   * @throws RuntimeException on failure; the dispatcher turns it into a failed result
   */
  Map<String, Object> execute(A action, CommandContext context);
}
