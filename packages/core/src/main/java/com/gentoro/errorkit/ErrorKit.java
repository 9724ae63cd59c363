package com.gentoro.errorkit;

import com.gentoro.errorkit.logging.LoggingService;
import com.gentoro.errorkit.telemetry.ErrorTelemetry;
import com.gentoro.errorkit.telemetry.Slf4jErrorEventSink;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Process-wide bootstrap. Without a call to {@link #configure} the library runs on {@link
 * ErrorKitSettings#DEFAULTS}.
 */
public final class ErrorKit {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ErrorKit.class);
  private static volatile ErrorKitSettings SETTINGS = ErrorKitSettings.DEFAULTS;

  private ErrorKit() {}

  public static ErrorKitSettings settings() {
    return SETTINGS;
  }

  /**
   * Loads YAML configuration from {@code location} ({@code classpath:...}, a {@code file:} URI or
   * a path), applies its {@code logging.level.*} entries and installs its settings.
   */
  public static ErrorKitSettings configure(String location) {
    return configure(new ConfigurationProvider(location).config());
  }

  public static ErrorKitSettings configure(Configuration cfg) {
    LoggingService.applyConfiguration(cfg);
    ErrorKitSettings settings = ErrorKitSettings.from(cfg);
    install(settings);
    return settings;
  }

  public static void install(ErrorKitSettings settings) {
    Objects.requireNonNull(settings, "settings");
    ErrorTelemetry.installEventSink(
        new Slf4jErrorEventSink(settings.eventLogger()), settings.eventLevel());
    SETTINGS = settings;
    log.debug("Installed error settings {}", settings);
  }

  /** Restores the defaults. Intended for tests. */
  public static void reset() {
    SETTINGS = ErrorKitSettings.DEFAULTS;
    ErrorTelemetry.reset();
  }
}
