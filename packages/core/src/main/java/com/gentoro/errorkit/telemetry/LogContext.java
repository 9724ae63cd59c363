package com.gentoro.errorkit.telemetry;

import org.slf4j.MDC;

/** MDC scope that propagates a trace id into logs and structured error events. */
public final class LogContext implements AutoCloseable {
  private final String previous;

  public LogContext(String traceId) {
    this.previous = MDC.get(TelemetryConstants.MDC_TRACE_ID);
    if (traceId != null) MDC.put(TelemetryConstants.MDC_TRACE_ID, traceId);
  }

  public static String currentTraceId() {
    return MDC.get(TelemetryConstants.MDC_TRACE_ID);
  }

  @Override
  public void close() {
    if (previous == null) {
      MDC.remove(TelemetryConstants.MDC_TRACE_ID);
    } else {
      MDC.put(TelemetryConstants.MDC_TRACE_ID, previous);
    }
  }
}
