package com.gentoro.errorkit;

import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.metadata.Fields;
import com.gentoro.errorkit.telemetry.TelemetryConstants;
import java.util.Locale;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.event.Level;

/**
 * Tunables read from the {@code errorkit.*} section of the configuration.
 *
 * <pre>
 * errorkit:
 *   render:
 *     staging-chain-depth: 5
 *     local-chain-depth: 10
 *   problem:
 *     base-uri: https://errors.errorkit.dev
 *   telemetry:
 *     event-logger: errorkit.error
 *     event-level: ERROR
 * </pre>
 */
public record ErrorKitSettings(
    int stagingChainDepth,
    int localChainDepth,
    String problemBaseUri,
    String eventLogger,
    Level eventLevel) {

  public static final int DEFAULT_STAGING_CHAIN_DEPTH = 5;
  public static final int DEFAULT_LOCAL_CHAIN_DEPTH = 10;
  public static final String DEFAULT_PROBLEM_BASE_URI = "https://errors.errorkit.dev";

  public static final ErrorKitSettings DEFAULTS =
      new ErrorKitSettings(
          DEFAULT_STAGING_CHAIN_DEPTH,
          DEFAULT_LOCAL_CHAIN_DEPTH,
          DEFAULT_PROBLEM_BASE_URI,
          TelemetryConstants.EVENT_LOGGER,
          Level.ERROR);

  public ErrorKitSettings {
    Objects.requireNonNull(problemBaseUri, "problemBaseUri");
    Objects.requireNonNull(eventLogger, "eventLogger");
    Objects.requireNonNull(eventLevel, "eventLevel");
    if (stagingChainDepth <= 0) {
      throw invalid("errorkit.render.staging-chain-depth", stagingChainDepth);
    }
    if (localChainDepth <= 0) {
      throw invalid("errorkit.render.local-chain-depth", localChainDepth);
    }
    while (problemBaseUri.endsWith("/")) {
      problemBaseUri = problemBaseUri.substring(0, problemBaseUri.length() - 1);
    }
  }

  /**
   * Reads settings, falling back to {@link #DEFAULTS} for missing keys.
   *
   * @throws AppError of kind {@code Config} for out-of-range depths or an unknown event level
   */
  public static ErrorKitSettings from(Configuration cfg) {
    if (cfg == null) return DEFAULTS;
    String level = cfg.getString("errorkit.telemetry.event-level", DEFAULTS.eventLevel.name());
    return new ErrorKitSettings(
        readInt(cfg, "errorkit.render.staging-chain-depth", DEFAULT_STAGING_CHAIN_DEPTH),
        readInt(cfg, "errorkit.render.local-chain-depth", DEFAULT_LOCAL_CHAIN_DEPTH),
        cfg.getString("errorkit.problem.base-uri", DEFAULT_PROBLEM_BASE_URI),
        cfg.getString("errorkit.telemetry.event-logger", TelemetryConstants.EVENT_LOGGER),
        parseLevel(level));
  }

  private static int readInt(Configuration cfg, String key, int fallback) {
    try {
      return cfg.getInt(key, fallback);
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw AppError.config("Configuration value is not an integer: " + key)
          .withField(Fields.str("config_key", key))
          .withSource(e);
    }
  }

  private static Level parseLevel(String raw) {
    try {
      return Level.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw AppError.config("Unknown event level: " + raw)
          .withField(Fields.str("config_key", "errorkit.telemetry.event-level"))
          .withSource(e);
    }
  }

  private static AppError invalid(String key, int value) {
    return AppError.config("Configuration value must be positive: " + key)
        .withField(Fields.str("config_key", key))
        .withField(Fields.i64("config_value", value));
  }
}
