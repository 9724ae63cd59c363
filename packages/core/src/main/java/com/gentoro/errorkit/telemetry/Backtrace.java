package com.gentoro.errorkit.telemetry;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Immutable snapshot of stack frames. */
public record Backtrace(List<StackTraceElement> frames) {
  public Backtrace {
    frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
  }

  /**
   * Captures the current stack, dropping this method's frame and any leading frames declared by
   * one of the {@code internal} classes.
   */
  public static Backtrace capture(Class<?>... internal) {
    List<Class<?>> skipped = Arrays.asList(internal);
    List<StackTraceElement> frames =
        StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE)
            .walk(
                s ->
                    s.dropWhile(
                            f ->
                                f.getDeclaringClass() == Backtrace.class
                                    || skipped.contains(f.getDeclaringClass()))
                        .map(StackWalker.StackFrame::toStackTraceElement)
                        .collect(Collectors.toList()));
    return new Backtrace(frames);
  }

  /** Frames recorded by an existing throwable. */
  public static Backtrace of(Throwable t) {
    return new Backtrace(List.of(t.getStackTrace()));
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  /** One {@code at frame} line per element, in call order from innermost outward. */
  public String render() {
    return frames.stream().map(f -> "at " + f).collect(Collectors.joining("\n"));
  }
}
