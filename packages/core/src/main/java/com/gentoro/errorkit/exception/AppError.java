package com.gentoro.errorkit.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.errorkit.diagnostics.Diagnostics;
import com.gentoro.errorkit.diagnostics.DocLink;
import com.gentoro.errorkit.diagnostics.Visibility;
import com.gentoro.errorkit.display.DisplayMode;
import com.gentoro.errorkit.display.ErrorRenderers;
import com.gentoro.errorkit.metadata.Field;
import com.gentoro.errorkit.metadata.FieldRedaction;
import com.gentoro.errorkit.metadata.Metadata;
import com.gentoro.errorkit.telemetry.Backtrace;
import com.gentoro.errorkit.telemetry.BacktracePreference;
import com.gentoro.errorkit.telemetry.ErrorEvent;
import com.gentoro.errorkit.telemetry.ErrorTelemetry;
import com.gentoro.errorkit.telemetry.LogContext;
import com.gentoro.errorkit.utility.JacksonUtility;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Structured application error: a stable {@link AppCode}, a semantic {@link AppErrorKind}, an
 * optional message, typed {@link Metadata}, optional {@link Diagnostics} and an optional causal
 * source.
 *
 * <p>Construction is cheap: no JVM stack trace is filled in. A {@link Backtrace} is captured
 * lazily, at most once, and only when {@link BacktracePreference} allows it.
 *
 * <p>Builder methods ({@code with*}, {@link #redactable()}) mutate and return this instance and
 * re-arm telemetry. Telemetry fires when the record is created through a factory or {@link
 * ErrorContext}, and again when a consumer (renderer, problem details, {@link #log()}) sees the
 * record after further changes. Repeated {@link #emitTelemetry()} calls without intervening
 * changes are no-ops.
 */
public class AppError extends RuntimeException {
  private AppCode code;
  private final AppErrorKind kind;
  private final String message;
  private final Metadata metadata = new Metadata();
  private MessageEditPolicy editPolicy = MessageEditPolicy.PRESERVE;
  private RetryAdvice retry;
  private String wwwAuthenticate;
  private ErrorDetails details;
  private Throwable source;
  private Backtrace backtrace;
  private Diagnostics diagnostics;

  private static final Backtrace CAPTURING = new Backtrace(List.of());

  private final AtomicReference<Backtrace> capturedBacktrace = new AtomicReference<>();
  private final AtomicBoolean telemetryDirty = new AtomicBoolean(true);
  private final AtomicBoolean tracingDirty = new AtomicBoolean(true);

  protected AppError(AppErrorKind kind, String message) {
    super(null, null, false, false);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.code = AppCode.forKind(kind);
    this.message = message;
  }

  // ------------ Factories ------------

  public static AppError of(AppErrorKind kind, String message) {
    AppError error = new AppError(kind, message);
    error.emitTelemetry();
    return error;
  }

  /** Error without a message; renderers fall back to the kind label. */
  public static AppError bare(AppErrorKind kind) {
    return of(kind, null);
  }

  public static AppError notFound(String message) {
    return of(AppErrorKind.NOT_FOUND, message);
  }

  public static AppError validation(String message) {
    return of(AppErrorKind.VALIDATION, message);
  }

  public static AppError conflict(String message) {
    return of(AppErrorKind.CONFLICT, message);
  }

  public static AppError unauthorized(String message) {
    return of(AppErrorKind.UNAUTHORIZED, message);
  }

  public static AppError forbidden(String message) {
    return of(AppErrorKind.FORBIDDEN, message);
  }

  public static AppError notImplemented(String message) {
    return of(AppErrorKind.NOT_IMPLEMENTED, message);
  }

  public static AppError internal(String message) {
    return of(AppErrorKind.INTERNAL, message);
  }

  public static AppError badRequest(String message) {
    return of(AppErrorKind.BAD_REQUEST, message);
  }

  public static AppError telegramAuth(String message) {
    return of(AppErrorKind.TELEGRAM_AUTH, message);
  }

  public static AppError invalidJwt(String message) {
    return of(AppErrorKind.INVALID_JWT, message);
  }

  public static AppError database(String message) {
    return of(AppErrorKind.DATABASE, message);
  }

  public static AppError service(String message) {
    return of(AppErrorKind.SERVICE, message);
  }

  public static AppError config(String message) {
    return of(AppErrorKind.CONFIG, message);
  }

  public static AppError turnkey(String message) {
    return of(AppErrorKind.TURNKEY, message);
  }

  public static AppError timeout(String message) {
    return of(AppErrorKind.TIMEOUT, message);
  }

  public static AppError network(String message) {
    return of(AppErrorKind.NETWORK, message);
  }

  public static AppError rateLimited(String message) {
    return of(AppErrorKind.RATE_LIMITED, message);
  }

  public static AppError rateLimited(String message, long retryAfterSeconds) {
    AppError error = new AppError(AppErrorKind.RATE_LIMITED, message);
    error.retry = new RetryAdvice(retryAfterSeconds);
    error.emitTelemetry();
    return error;
  }

  public static AppError dependencyUnavailable(String message) {
    return of(AppErrorKind.DEPENDENCY_UNAVAILABLE, message);
  }

  public static AppError serialization(String message) {
    return of(AppErrorKind.SERIALIZATION, message);
  }

  public static AppError deserialization(String message) {
    return of(AppErrorKind.DESERIALIZATION, message);
  }

  public static AppError externalApi(String message) {
    return of(AppErrorKind.EXTERNAL_API, message);
  }

  public static AppError queue(String message) {
    return of(AppErrorKind.QUEUE, message);
  }

  public static AppError cache(String message) {
    return of(AppErrorKind.CACHE, message);
  }

  /**
   * Adds {@code message} as context on top of {@code error}.
   *
   * <p>An {@link AppError} keeps its kind, code, metadata, policies, retry advice, challenge,
   * details, diagnostics and backtrace, and becomes the source of the returned record. Any other
   * throwable becomes the source of a new {@code Internal} error.
   */
  public static AppError wrap(String message, Throwable error) {
    Objects.requireNonNull(error, "error");
    if (!(error instanceof AppError app)) {
      AppError wrapped = new AppError(AppErrorKind.INTERNAL, message);
      wrapped.source = error;
      wrapped.emitTelemetry();
      return wrapped;
    }
    AppError enriched = new AppError(app.kind, message);
    enriched.code = app.code;
    enriched.metadata.extend(app.metadata);
    app.metadata.policies().forEach(enriched.metadata::setRedaction);
    enriched.editPolicy = app.editPolicy;
    enriched.retry = app.retry;
    enriched.wwwAuthenticate = app.wwwAuthenticate;
    enriched.details = app.details;
    enriched.diagnostics = app.diagnostics == null ? null : app.diagnostics.copy();
    enriched.backtrace = app.getBacktrace().orElse(null);
    enriched.source = app;
    enriched.emitTelemetry();
    return enriched;
  }

  // ------------ Builders ------------

  public AppError withCode(AppCode code) {
    this.code = Objects.requireNonNull(code, "code");
    markDirty();
    return this;
  }

  public AppError withRetryAfterSecs(long seconds) {
    this.retry = new RetryAdvice(seconds);
    markDirty();
    return this;
  }

  /** Sets the {@code WWW-Authenticate} challenge sent with 401 responses. */
  public AppError withWwwAuthenticate(String challenge) {
    this.wwwAuthenticate = challenge;
    markDirty();
    return this;
  }

  public AppError withField(Field field) {
    metadata.insert(field);
    markDirty();
    return this;
  }

  public AppError withFields(Iterable<Field> fields) {
    metadata.extend(fields);
    markDirty();
    return this;
  }

  /** Merges another metadata set, including the policies registered on it. */
  public AppError withMetadata(Metadata other) {
    other.policies().forEach(metadata::setRedaction);
    metadata.extend(other);
    markDirty();
    return this;
  }

  /** Overrides the redaction of a field. A missing field is not an error. */
  public AppError redactField(String name, FieldRedaction policy) {
    metadata.setRedaction(name, policy);
    markDirty();
    return this;
  }

  /** Marks the message as sensitive: only the kind label leaves the process. */
  public AppError redactable() {
    this.editPolicy = MessageEditPolicy.REDACT;
    markDirty();
    return this;
  }

  public AppError withSource(Throwable source) {
    this.source = source;
    markDirty();
    return this;
  }

  public AppError withBacktrace(Backtrace backtrace) {
    this.backtrace = backtrace;
    markDirty();
    return this;
  }

  public AppError withDetailsJson(JsonNode json) {
    this.details = ErrorDetails.json(json);
    markDirty();
    return this;
  }

  public AppError withDetailsText(String text) {
    this.details = ErrorDetails.text(text);
    markDirty();
    return this;
  }

  /**
   * Serializes {@code payload} with Jackson and attaches it as JSON details.
   *
   * @throws AppError of kind {@code Serialization} when the payload cannot be serialized
   */
  public AppError withDetails(Object payload) {
    return withDetailsJson(JacksonUtility.toTree(payload));
  }

  public AppError withHint(String message) {
    return withHint(message, Visibility.DEV_ONLY);
  }

  public AppError withHint(String message, Visibility visibility) {
    diagnosticsForUpdate().addHint(message, visibility);
    markDirty();
    return this;
  }

  public AppError withSuggestion(String message) {
    return withSuggestion(message, null, Visibility.DEV_ONLY);
  }

  public AppError withSuggestion(String message, String command) {
    return withSuggestion(message, command, Visibility.DEV_ONLY);
  }

  public AppError withSuggestion(String message, String command, Visibility visibility) {
    diagnosticsForUpdate().addSuggestion(message, command, visibility);
    markDirty();
    return this;
  }

  public AppError withDocs(String url) {
    return withDocs(url, null);
  }

  public AppError withDocs(String url, String title) {
    return withDocs(url, title, Visibility.PUBLIC);
  }

  public AppError withDocs(String url, String title, Visibility visibility) {
    diagnosticsForUpdate().setDocLink(new DocLink(url, title, visibility));
    markDirty();
    return this;
  }

  public AppError withRelatedCode(String code) {
    diagnosticsForUpdate().addRelatedCode(code);
    markDirty();
    return this;
  }

  private Diagnostics diagnosticsForUpdate() {
    if (diagnostics == null) diagnostics = new Diagnostics();
    return diagnostics;
  }

  // ------------ Accessors ------------

  public AppCode getCode() {
    return code;
  }

  public AppErrorKind getKind() {
    return kind;
  }

  /** Message as supplied, regardless of the edit policy. */
  public Optional<String> getRawMessage() {
    return Optional.ofNullable(message);
  }

  /** Message, or the kind label when none was supplied. Ignores the edit policy. */
  public String renderMessage() {
    return message != null ? message : kind.label();
  }

  /** Message safe to log: the kind label when the message is absent or redacted. */
  @Override
  public String getMessage() {
    return editPolicy == MessageEditPolicy.REDACT ? kind.label() : renderMessage();
  }

  public MessageEditPolicy getEditPolicy() {
    return editPolicy;
  }

  /** Snapshot of the metadata; changes go through {@link #withField} and friends. */
  public Metadata getMetadata() {
    return metadata.copy();
  }

  public Optional<RetryAdvice> getRetry() {
    return Optional.ofNullable(retry);
  }

  public Optional<String> getWwwAuthenticate() {
    return Optional.ofNullable(wwwAuthenticate);
  }

  public Optional<ErrorDetails> getDetails() {
    return Optional.ofNullable(details);
  }

  /** Snapshot of the diagnostics; changes go through {@link #withHint} and friends. */
  public Optional<Diagnostics> getDiagnostics() {
    return Optional.ofNullable(diagnostics).map(Diagnostics::copy);
  }

  public Optional<Throwable> getSource() {
    return Optional.ofNullable(source);
  }

  @Override
  public synchronized Throwable getCause() {
    return source;
  }

  /** Explicitly attached backtrace if any, otherwise the lazily captured one. */
  public Optional<Backtrace> getBacktrace() {
    if (backtrace != null) return Optional.of(backtrace);
    Backtrace captured = capturedBacktrace.get();
    return captured == CAPTURING ? Optional.empty() : Optional.ofNullable(captured);
  }

  /** This error followed by its causes, at most {@code maxDepth} entries. */
  public List<Throwable> chain(int maxDepth) {
    return ExceptionUtil.causalChain(this, maxDepth);
  }

  public Throwable rootCause() {
    return ExceptionUtil.rootCause(this);
  }

  // ------------ Rendering ------------

  /** Renders for the process-wide {@link DisplayMode}. */
  public String render() {
    return render(DisplayMode.current());
  }

  public String render(DisplayMode mode) {
    emitTelemetry();
    return ErrorRenderers.forMode(mode).render(this);
  }

  // ------------ Telemetry ------------

  /** Flushes pending telemetry; equivalent to {@link #emitTelemetry()}. */
  public void log() {
    emitTelemetry();
  }

  /**
   * Increments the error counter and publishes the structured event if the record changed since
   * the last emission. The event is retried on the next call if nobody was listening.
   */
  public void emitTelemetry() {
    if (telemetryDirty.getAndSet(false)) {
      captureBacktrace();
      ErrorTelemetry.current().recordError(code.value(), kind.categoryName());
    }
    flushTracing();
  }

  private void flushTracing() {
    if (!tracingDirty.getAndSet(false)) return;
    if (!ErrorTelemetry.current().publish(this::toEvent)) {
      tracingDirty.set(true);
    }
  }

  private ErrorEvent toEvent() {
    boolean redacted = editPolicy == MessageEditPolicy.REDACT;
    return new ErrorEvent(
        code.value(),
        kind.categoryName(),
        redacted ? null : message,
        retry == null ? null : retry.afterSeconds(),
        redacted,
        metadata.size(),
        wwwAuthenticate,
        LogContext.currentTraceId());
  }

  private void captureBacktrace() {
    if (backtrace != null || capturedBacktrace.get() != null) return;
    if (!BacktracePreference.isEnabled()) return;
    // Only the thread that claims the cell walks the stack.
    if (capturedBacktrace.compareAndSet(null, CAPTURING)) {
      capturedBacktrace.set(Backtrace.capture(AppError.class, getClass(), ErrorContext.class));
    }
  }

  private void markDirty() {
    telemetryDirty.set(true);
    tracingDirty.set(true);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", kind="
        + kind.categoryName()
        + ", message="
        + (editPolicy == MessageEditPolicy.REDACT ? "[REDACTED]" : String.valueOf(message))
        + (metadata.isEmpty() ? "" : ", metadata=" + metadata)
        + (source == null ? "" : ", cause=" + source.getClass().getSimpleName())
        + '}';
  }
}
