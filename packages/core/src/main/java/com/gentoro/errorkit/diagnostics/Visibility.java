package com.gentoro.errorkit.diagnostics;

/**
 * Audience of a diagnostic item, ordered from most to least restrictive. An item is shown when
 * its visibility is at least the minimum requested by the renderer.
 */
public enum Visibility {
  DEV_ONLY,
  INTERNAL,
  PUBLIC;

  public boolean isVisibleAt(Visibility minimum) {
    return compareTo(minimum) >= 0;
  }
}
