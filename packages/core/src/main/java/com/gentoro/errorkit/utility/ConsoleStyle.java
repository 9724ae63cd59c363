package com.gentoro.errorkit.utility;

import java.util.function.Function;

/**
 * ANSI styling for terminal output. A disabled style returns text unchanged; an enabled one only
 * wraps it, so the plain text stays a contiguous substring of the styled text.
 */
public final class ConsoleStyle {
  public static final String NO_COLOR_VARIABLE = "NO_COLOR";

  private static final String red = "\u001B[31m";
  private static final String yellow = "\u001B[33m";
  private static final String cyan = "\u001B[36m";
  private static final String green = "\u001B[32m";
  private static final String bold = "\u001B[1m";
  private static final String dim = "\u001B[2m";
  private static final String reset = "\u001B[0m";

  public static final ConsoleStyle PLAIN = new ConsoleStyle(false);
  public static final ConsoleStyle ANSI = new ConsoleStyle(true);

  private final boolean enabled;

  private ConsoleStyle(boolean enabled) {
    this.enabled = enabled;
  }

  /** Colors only when attached to a console and {@value #NO_COLOR_VARIABLE} is unset. */
  public static ConsoleStyle detect() {
    return detect(System::getenv, System.console() != null);
  }

  public static ConsoleStyle detect(Function<String, String> env, boolean interactive) {
    return interactive && env.apply(NO_COLOR_VARIABLE) == null ? ANSI : PLAIN;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public String error(String text) {
    return wrap(bold + red, text);
  }

  public String code(String text) {
    return wrap(yellow, text);
  }

  public String muted(String text) {
    return wrap(dim, text);
  }

  public String hint(String text) {
    return wrap(cyan, text);
  }

  public String suggestion(String text) {
    return wrap(green, text);
  }

  private String wrap(String style, String text) {
    return enabled ? style + text + reset : text;
  }
}
