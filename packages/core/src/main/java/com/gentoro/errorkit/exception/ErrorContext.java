package com.gentoro.errorkit.exception;

import com.gentoro.errorkit.metadata.Field;
import com.gentoro.errorkit.metadata.FieldRedaction;
import com.gentoro.errorkit.metadata.Fields;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent accumulator that turns a foreign failure into an {@link AppError}.
 *
 * <pre>{@code
 * try {
 *   repository.load(id);
 * } catch (IOException e) {
 *   throw ErrorContext.of(AppErrorKind.DATABASE)
 *       .with(Fields.str("user_id", id))
 *       .trackCaller()
 *       .intoError(e);
 * }
 * }</pre>
 *
 * <p>Not thread-safe. Each {@link #intoError} call produces a new record; the context can be
 * reused.
 */
public final class ErrorContext {
  public static final String CALLER_FILE = "caller.file";
  public static final String CALLER_LINE = "caller.line";
  public static final String CALLER_COLUMN = "caller.column";

  private AppErrorKind category;
  private AppCode code;
  private boolean codeOverridden;
  private final List<Field> fields = new ArrayList<>();
  private final Map<String, FieldRedaction> fieldPolicies = new LinkedHashMap<>();
  private boolean redactMessage;
  private StackTraceElement caller;

  private ErrorContext(AppErrorKind category) {
    this.category = Objects.requireNonNull(category, "category");
    this.code = AppCode.forKind(category);
  }

  public static ErrorContext of(AppErrorKind category) {
    return new ErrorContext(category);
  }

  /** Changes the category; the code follows unless it was set explicitly. */
  public ErrorContext category(AppErrorKind category) {
    this.category = Objects.requireNonNull(category, "category");
    if (!codeOverridden) {
      this.code = AppCode.forKind(category);
    }
    return this;
  }

  public ErrorContext code(AppCode code) {
    this.code = Objects.requireNonNull(code, "code");
    this.codeOverridden = true;
    return this;
  }

  /** Adds a field, applying any policy already registered for its name. */
  public ErrorContext with(Field field) {
    Objects.requireNonNull(field, "field");
    FieldRedaction policy = fieldPolicies.get(field.name());
    fields.add(policy == null ? field : field.withRedaction(policy));
    return this;
  }

  public ErrorContext withAll(Iterable<Field> source) {
    for (Field field : source) {
      with(field);
    }
    return this;
  }

  /** Registers a policy for {@code name} and applies it to fields already added. */
  public ErrorContext redactField(String name, FieldRedaction policy) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(policy, "policy");
    fieldPolicies.put(name, policy);
    fields.replaceAll(f -> f.name().equals(name) ? f.withRedaction(policy) : f);
    return this;
  }

  /** Toggles redaction of the top-level message. */
  public ErrorContext redact(boolean redact) {
    this.redactMessage = redact;
    return this;
  }

  /**
   * Records the location of the code calling this method. The produced error carries it as
   * {@value #CALLER_FILE}, {@value #CALLER_LINE} and {@value #CALLER_COLUMN}; the JVM exposes no
   * column information, so the column is always 0.
   */
  public ErrorContext trackCaller() {
    this.caller =
        StackWalker.getInstance()
            .walk(
                s ->
                    s.filter(f -> !f.getClassName().equals(ErrorContext.class.getName()))
                        .findFirst()
                        .map(StackWalker.StackFrame::toStackTraceElement)
                        .orElse(null));
    return this;
  }

  public AppErrorKind getCategory() {
    return category;
  }

  public AppCode getCode() {
    return code;
  }

  /** Builds an error without a source. */
  public AppError intoError() {
    return intoError(null);
  }

  /**
   * Materializes the accumulated state into a new {@link AppError} whose source is {@code cause}.
   * Telemetry fires once, after everything is attached.
   */
  public AppError intoError(Throwable cause) {
    AppError error = new AppError(category, null);
    if (caller != null) {
      String file = caller.getFileName() == null ? "Unknown Source" : caller.getFileName();
      error.withField(Fields.str(CALLER_FILE, file));
      error.withField(Fields.u64(CALLER_LINE, Math.max(caller.getLineNumber(), 0)));
      error.withField(Fields.u64(CALLER_COLUMN, 0));
    }
    if (codeOverridden || !code.equals(error.getCode())) {
      error.withCode(code);
    }
    fieldPolicies.forEach(error::redactField);
    error.withFields(fields);
    if (redactMessage) {
      error.redactable();
    }
    if (cause != null) {
      error.withSource(cause);
    }
    error.emitTelemetry();
    return error;
  }

  /**
   * Runs {@code action} and converts any checked or unchecked failure into an {@link AppError}
   * built from this context.
   */
  public <T> T call(ThrowingSupplier<T> action) {
    try {
      return action.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw intoError(e);
    } catch (Exception e) {
      throw intoError(e);
    }
  }

  public void run(ThrowingRunnable action) {
    call(
        () -> {
          action.run();
          return null;
        });
  }

  @FunctionalInterface
  public interface ThrowingSupplier<T> {
    T get() throws Exception;
  }

  @FunctionalInterface
  public interface ThrowingRunnable {
    void run() throws Exception;
  }
}
