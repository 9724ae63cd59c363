package com.gentoro.errorkit.display;

import com.gentoro.errorkit.diagnostics.Visibility;
import java.util.concurrent.atomic.AtomicReference;

/** Rendering profile derived from the deployment environment. */
public enum DisplayMode {
  /** Minimal JSON; only unredacted data leaves the process. */
  PROD(Visibility.PUBLIC),
  /** Full human-readable text for a developer terminal. */
  LOCAL(Visibility.DEV_ONLY),
  /** JSON with a bounded source chain and sanitized metadata. */
  STAGING(Visibility.INTERNAL);

  private static final AtomicReference<DisplayMode> CURRENT = new AtomicReference<>();

  private final Visibility minimumVisibility;

  DisplayMode(Visibility minimumVisibility) {
    this.minimumVisibility = minimumVisibility;
  }

  /** Lowest diagnostic visibility shown in this mode. */
  public Visibility minimumVisibility() {
    return minimumVisibility;
  }

  /**
   * Mode of this process, resolved from the environment on first use and cached afterwards.
   *
   * @see DisplayModeResolver
   */
  public static DisplayMode current() {
    DisplayMode mode = CURRENT.get();
    if (mode == null) {
      CURRENT.compareAndSet(null, DisplayModeResolver.fromEnvironment().resolve());
      mode = CURRENT.get();
    }
    return mode;
  }

  // Test hooks.

  static void resetCurrent() {
    CURRENT.set(null);
  }

  static void overrideCurrent(DisplayMode mode) {
    CURRENT.set(mode);
  }
}
