package com.gentoro.errorkit.telemetry;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Whether error records capture a backtrace, read once from {@value #ENV_VARIABLE} and cached
 * for the rest of the process. Absent, blank, {@code 0}, {@code off} and {@code false} disable
 * capture; any other value enables it.
 */
public final class BacktracePreference {
  public static final String ENV_VARIABLE = "ERRORKIT_BACKTRACE";

  private static final int UNSET = 0;
  private static final int DISABLED = 1;
  private static final int ENABLED = 2;

  private static final AtomicInteger STATE = new AtomicInteger(UNSET);
  private static volatile Function<String, String> envLookup = System::getenv;

  private BacktracePreference() {}

  public static boolean isEnabled() {
    int state = STATE.get();
    if (state == UNSET) {
      int resolved = parse(envLookup.apply(ENV_VARIABLE)) ? ENABLED : DISABLED;
      STATE.compareAndSet(UNSET, resolved);
      state = STATE.get();
    }
    return state == ENABLED;
  }

  static boolean parse(String raw) {
    if (raw == null) return false;
    String value = raw.trim().toLowerCase(Locale.ROOT);
    return !(value.isEmpty() || value.equals("0") || value.equals("off") || value.equals("false"));
  }

  // Test hooks.

  static void reset() {
    STATE.set(UNSET);
    envLookup = System::getenv;
  }

  static void reset(Function<String, String> lookup) {
    STATE.set(UNSET);
    envLookup = lookup;
  }

  static void force(boolean enabled) {
    STATE.set(enabled ? ENABLED : DISABLED);
  }
}
