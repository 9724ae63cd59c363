package com.gentoro.errorkit.telemetry;

import org.slf4j.event.Level;

/** Receiver of structured error events. */
public interface ErrorEventSink {

  /** Whether anyone is listening for events at {@code level}. */
  boolean isEnabled(Level level);

  /**
   * Drops any cached listener state so the next {@link #isEnabled(Level)} call sees listeners
   * registered since the last check.
   */
  void refreshInterest();

  void publish(ErrorEvent event, Level level);
}
