package com.gentoro.errorkit.telemetry;

/** Centralized telemetry constants for meter, counter, logger names and attribute keys. */
public final class TelemetryConstants {
  private TelemetryConstants() {}

  /** Meter name used for error metrics. */
  public static final String METER = "com.gentoro.errorkit";

  /** Counter incremented once per emitted error state. */
  public static final String ERRORS_TOTAL = "errorkit.errors.total";

  /** Attribute keys attached to the error counter. */
  public static final String ATTR_CODE = "code";

  public static final String ATTR_CATEGORY = "category";

  /** MDC key read to correlate error events with a trace. */
  public static final String MDC_TRACE_ID = "trace_id";

  /** Default logger receiving structured error events. */
  public static final String EVENT_LOGGER = "errorkit.error";

  public static final String EVENT_MESSAGE = "app error constructed";
}
