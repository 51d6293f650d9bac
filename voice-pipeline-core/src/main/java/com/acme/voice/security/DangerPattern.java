package com.acme.voice.security;

import java.util.Locale;
import java.util.regex.Pattern;

/** Prompt injection signatures, checked in declaration order. */
public enum DangerPattern {
  TEMPLATE_INJECTION("\\{\\{.*?\\}\\}"),
  SCRIPT_TAG("<script.*?>.*?</script>", Pattern.DOTALL),
  CODE_EXECUTION("(os\\.|subprocess\\.|eval\\(|exec\\()"),
  SHELL_EXPANSION("\\$\\{.*?\\}"),
  SQL_TERMINATOR("[\"']\\s*;"),
  SQL_COMMENT("--|/\\*|\\*/|;"),
  INSTRUCTION_OVERRIDE(
      "\\b(ignore|disregard|forget|ignora|dimentica)\\s+(all\\s+|tutte\\s+)?(the\\s+|le\\s+)?"
          + "(previous|prior|above|precedenti)?\\s*(instructions|prompts?|rules|istruzioni|regole)"),
  DESTRUCTIVE_STATEMENT(
      "\\b(drop|truncate|delete)\\s+(all\\s+)?(the\\s+)?(tables?|users?|database|records?)\\b"),
  MARKUP_TAG("<.*?>");

  private final Pattern pattern;

  DangerPattern(String regex) {
    this(regex, 0);
  }

  DangerPattern(String regex, int extraFlags) {
    this.pattern =
        Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | extraFlags);
  }

  public boolean matches(String text) {
    return pattern.matcher(text).find();
  }

  /** Name used in audit metadata, e.g. template_injection. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
