package com.gentoro.errorkit.display;

import com.gentoro.errorkit.diagnostics.Diagnostics;
import com.gentoro.errorkit.diagnostics.DocLink;
import com.gentoro.errorkit.diagnostics.Hint;
import com.gentoro.errorkit.diagnostics.Suggestion;
import com.gentoro.errorkit.diagnostics.Visibility;
import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.ExceptionUtil;
import com.gentoro.errorkit.metadata.Field;
import com.gentoro.errorkit.telemetry.Backtrace;
import com.gentoro.errorkit.utility.ConsoleStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Human-readable multi-line text for a developer terminal. Everything is shown: the message even
 * when redacted, the causal chain, unredacted metadata, all diagnostics and the backtrace.
 *
 * <pre>
 * Not found
 * Code: NOT_FOUND
 * Message: user 42 missing
 *
 *   Caused by: java.io.IOException: disk offline
 *
 * Context:
 *   user_id: 42
 * </pre>
 */
public final class LocalRenderer implements ErrorRenderer {
  private static final String COMMAND_INDENT = " ".repeat(14);

  private final int chainDepth;
  private final ConsoleStyle style;

  public LocalRenderer(int chainDepth, ConsoleStyle style) {
    if (chainDepth <= 0) throw new IllegalArgumentException("chainDepth must be > 0");
    this.chainDepth = chainDepth;
    this.style = Objects.requireNonNull(style, "style");
  }

  @Override
  public String render(AppError error) {
    List<String> lines = new ArrayList<>();
    lines.add(style.error(error.getKind().label()));
    lines.add(style.code("Code: " + error.getCode()));
    lines.add("Message: " + error.renderMessage());

    List<String> causes = ExceptionUtil.describeCauses(error, chainDepth);
    if (!causes.isEmpty()) {
      lines.add("");
      for (String cause : causes) {
        lines.add(style.muted("  Caused by: " + cause));
      }
    }

    if (!error.getMetadata().isEmpty()) {
      lines.add("");
      lines.add("Context:");
      for (Field field : error.getMetadata()) {
        lines.add("  " + field.name() + ": " + field.value().display());
      }
    }

    error.getDiagnostics().ifPresent(d -> appendDiagnostics(lines, d));

    Optional<Backtrace> backtrace = error.getBacktrace();
    if (backtrace.isPresent() && !backtrace.get().isEmpty()) {
      lines.add("");
      lines.add("Backtrace:");
      for (StackTraceElement frame : backtrace.get().frames()) {
        lines.add(style.muted("  at " + frame));
      }
    }
    return String.join("\n", lines);
  }

  private void appendDiagnostics(List<String> lines, Diagnostics diagnostics) {
    Visibility min = DisplayMode.LOCAL.minimumVisibility();

    List<Hint> hints = diagnostics.visibleHints(min).collect(Collectors.toList());
    if (!hints.isEmpty()) {
      lines.add("");
      for (Hint hint : hints) {
        lines.add(style.hint("  hint: " + hint.message()));
      }
    }

    diagnostics
        .visibleSuggestions(min)
        .forEach(
            (Suggestion s) -> {
              lines.add("");
              lines.add(style.suggestion("  suggestion: " + s.message()));
              s.commandIfAny().ifPresent(cmd -> lines.add(COMMAND_INDENT + cmd));
            });

    Optional<DocLink> doc = diagnostics.visibleDocLink(min);
    if (doc.isPresent()) {
      lines.add("");
      DocLink link = doc.get();
      lines.add(
          link.titleIfAny()
              .map(title -> "  docs: " + title + " (" + link.url() + ")")
              .orElse("  docs: " + link.url()));
    }

    if (!diagnostics.relatedCodes().isEmpty()) {
      lines.add("");
      lines.add("  see also: " + String.join(", ", diagnostics.relatedCodes()));
    }
  }
}
