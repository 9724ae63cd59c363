package com.gentoro.errorkit.telemetry;

import com.gentoro.errorkit.logging.LoggingService;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;
import org.slf4j.event.Level;

/** Publishes error events as key/value enriched log lines on a dedicated SLF4J logger. */
public final class Slf4jErrorEventSink implements ErrorEventSink {
  private final String loggerName;
  private volatile Logger logger;

  public Slf4jErrorEventSink(String loggerName) {
    this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
    this.logger = LoggingService.getLogger(loggerName);
  }

  public static Slf4jErrorEventSink defaultSink() {
    return new Slf4jErrorEventSink(TelemetryConstants.EVENT_LOGGER);
  }

  public String loggerName() {
    return loggerName;
  }

  @Override
  public boolean isEnabled(Level level) {
    return logger.isEnabledForLevel(level);
  }

  @Override
  public void refreshInterest() {
    // Loggers handed out before the SLF4J provider finished binding are substitutes.
    this.logger = LoggerFactory.getLogger(loggerName);
  }

  @Override
  public void publish(ErrorEvent event, Level level) {
    LoggingEventBuilder builder =
        logger
            .atLevel(level)
            .addKeyValue("code", event.code())
            .addKeyValue("category", event.category())
            .addKeyValue("redactable", event.redactable())
            .addKeyValue("metadata_len", event.metadataLen());
    if (event.message() != null) builder = builder.addKeyValue("message", event.message());
    if (event.retrySeconds() != null) {
      builder = builder.addKeyValue("retry_seconds", event.retrySeconds());
    }
    if (event.wwwAuthenticate() != null) {
      builder = builder.addKeyValue("www_authenticate", event.wwwAuthenticate());
    }
    if (event.traceId() != null) builder = builder.addKeyValue("trace_id", event.traceId());
    builder.log(TelemetryConstants.EVENT_MESSAGE);
  }
}
