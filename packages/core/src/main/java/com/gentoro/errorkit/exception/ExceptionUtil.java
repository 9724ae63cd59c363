package com.gentoro.errorkit.exception;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Utility helpers for walking causal chains and describing throwables. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Collects {@code t} and its causes, in order, stopping after {@code maxDepth} entries or when a
   * cause repeats.
   *
   * @param t the throwable to start from (null yields an empty list)
   * @param maxDepth maximum number of entries; if <= 0, the list is empty
   */
  public static List<Throwable> causalChain(Throwable t, int maxDepth) {
    List<Throwable> chain = new ArrayList<>();
    Throwable current = t;
    while (current != null && chain.size() < maxDepth) {
      if (containsIdentity(chain, current)) break;
      chain.add(current);
      current = current.getCause();
    }
    return chain;
  }

  /** Deepest cause reachable from {@code t}; {@code t} itself when it has no cause. */
  public static Throwable rootCause(Throwable t) {
    Throwable current = t;
    List<Throwable> seen = new ArrayList<>();
    while (current != null && current.getCause() != null && !containsIdentity(seen, current)) {
      seen.add(current);
      current = current.getCause();
    }
    return current;
  }

  /**
   * One-line textual rendering of a single chain level. {@link AppError}s use their policy-aware
   * message; other throwables use {@link Throwable#toString()}.
   */
  public static String describe(Throwable t) {
    if (t == null) return "";
    if (t instanceof AppError app) return app.getMessage();
    return t.toString();
  }

  /** Renders each level of the chain below {@code t}, at most {@code maxDepth} levels. */
  public static List<String> describeCauses(Throwable t, int maxDepth) {
    List<String> lines = new ArrayList<>();
    if (t == null) return lines;
    for (Throwable level : causalChain(t.getCause(), maxDepth)) {
      lines.add(describe(level));
    }
    return lines;
  }

  /** {@code t} itself when it already is an {@link AppError}, otherwise {@code convert(t)}. */
  public static AppError asAppError(Throwable t, Function<Throwable, AppError> convert) {
    if (t instanceof AppError app) {
      return app;
    } else {
      return convert.apply(t);
    }
  }

  private static boolean containsIdentity(List<Throwable> list, Throwable candidate) {
    for (Throwable t : list) {
      if (t == candidate) return true;
    }
    return false;
  }
}
