package com.acme.voice.intent;

import java.util.List;
import java.util.Set;

/**
 * One row of the analyzer's rule table.
 *
 * @param category name used in logs
 * @param triggers keywords, any of which activates the rule
 * @param builder turns the normalized text into actions; may return an empty list
 */
public record IntentRule(String category, Set<String> triggers, ActionBuilder builder) {

  @FunctionalInterface
  public interface ActionBuilder {
    List<Action> build(String normalizedText, CommandContext context);
  }

  public boolean matches(String normalizedText) {
    for (String trigger : triggers) {
      if (normalizedText.contains(trigger)) {
        return true;
      }
    }
    return false;
  }
}
