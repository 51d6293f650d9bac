package com.acme.voice.intent;

/** Something the user asked for, ready to be dispatched. Variants live in {@link Actions}. */
public interface Action {

  ActionType type();

  /** Italian phrase describing the action, used in the spoken response. */
  String description();
}
