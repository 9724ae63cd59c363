package com.gentoro.errorkit.diagnostics;

import java.util.Objects;
import java.util.Optional;

/** Actionable fix, optionally with a command the reader can run. {@code command} may be null. */
public record Suggestion(String message, String command, Visibility visibility) {
  public Suggestion {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(visibility, "visibility");
  }

  public Optional<String> commandIfAny() {
    return Optional.ofNullable(command);
  }
}
