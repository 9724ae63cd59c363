package com.gentoro.errorkit.diagnostics;

import java.util.Objects;

public record Hint(String message, Visibility visibility) {
  public Hint {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(visibility, "visibility");
  }
}
