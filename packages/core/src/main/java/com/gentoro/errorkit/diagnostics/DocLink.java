package com.gentoro.errorkit.diagnostics;

import java.util.Objects;
import java.util.Optional;

/** Link to documentation; {@code title} may be null. */
public record DocLink(String url, String title, Visibility visibility) {
  public DocLink {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(visibility, "visibility");
  }

  public Optional<String> titleIfAny() {
    return Optional.ofNullable(title);
  }
}
