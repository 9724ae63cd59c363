package com.gentoro.errorkit.telemetry;

import static com.gentoro.errorkit.telemetry.TelemetryConstants.*;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.event.Level;

/**
 * Process-wide telemetry backend for error records: an OpenTelemetry counter keyed by code and
 * category, and an {@link ErrorEventSink} for structured events.
 *
 * <p>Defaults to {@link OpenTelemetry#noop()} and the SLF4J sink on {@value
 * TelemetryConstants#EVENT_LOGGER} at {@code ERROR}. Applications replace the backend once at
 * startup with {@link #install}.
 */
public final class ErrorTelemetry {
  private static final AttributeKey<String> CODE_KEY = AttributeKey.stringKey(ATTR_CODE);
  private static final AttributeKey<String> CATEGORY_KEY = AttributeKey.stringKey(ATTR_CATEGORY);

  private static volatile ErrorTelemetry INSTANCE = defaults();

  private final OpenTelemetry openTelemetry;
  private final LongCounter errorsTotal;
  private final ErrorEventSink sink;
  private final Level eventLevel;

  private ErrorTelemetry(OpenTelemetry openTelemetry, ErrorEventSink sink, Level eventLevel) {
    this.openTelemetry = Objects.requireNonNull(openTelemetry, "openTelemetry");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.eventLevel = Objects.requireNonNull(eventLevel, "eventLevel");
    Meter meter = openTelemetry.meterBuilder(METER).build();
    this.errorsTotal =
        meter
            .counterBuilder(ERRORS_TOTAL)
            .setDescription("Error records emitted, by code and category")
            .build();
  }

  private static ErrorTelemetry defaults() {
    return new ErrorTelemetry(OpenTelemetry.noop(), Slf4jErrorEventSink.defaultSink(), Level.ERROR);
  }

  public static ErrorTelemetry current() {
    return INSTANCE;
  }

  /** Routes metrics to {@code openTelemetry}, keeping the current event sink. */
  public static void install(OpenTelemetry openTelemetry) {
    ErrorTelemetry active = INSTANCE;
    INSTANCE = new ErrorTelemetry(openTelemetry, active.sink, active.eventLevel);
  }

  public static void install(OpenTelemetry openTelemetry, ErrorEventSink sink, Level eventLevel) {
    INSTANCE = new ErrorTelemetry(openTelemetry, sink, eventLevel);
  }

  /** Replaces the event sink, keeping the current metrics backend. */
  public static void installEventSink(ErrorEventSink sink, Level eventLevel) {
    ErrorTelemetry active = INSTANCE;
    INSTANCE = new ErrorTelemetry(active.openTelemetry, sink, eventLevel);
  }

  /** Restores the defaults. Intended for tests. */
  public static void reset() {
    INSTANCE = defaults();
  }

  public ErrorEventSink sink() {
    return sink;
  }

  public Level eventLevel() {
    return eventLevel;
  }

  public void recordError(String code, String category) {
    errorsTotal.add(1, Attributes.of(CODE_KEY, code, CATEGORY_KEY, category));
  }

  /**
   * Publishes an event if the sink is listening at the configured level. Interest is checked a
   * second time after {@link ErrorEventSink#refreshInterest()} before giving up.
   *
   * @return {@code false} when nobody listened and the event was not built
   */
  public boolean publish(Supplier<ErrorEvent> event) {
    if (!sink.isEnabled(eventLevel)) {
      sink.refreshInterest();
      if (!sink.isEnabled(eventLevel)) {
        return false;
      }
    }
    sink.publish(event.get(), eventLevel);
    return true;
  }
}
