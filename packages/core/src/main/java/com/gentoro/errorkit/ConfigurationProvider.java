package com.gentoro.errorkit;

import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.ExceptionUtil;
import com.gentoro.errorkit.logging.LoggingService;
import com.gentoro.errorkit.metadata.Fields;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: - "classpath:some/path.yaml" (loaded from the application
 * classpath; a missing resource yields an empty configuration) - "file:" URIs - absolute or
 * relative filesystem paths. {@code ${env:NAME}} placeholders resolve against the process
 * environment.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:errorkit.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this(location, System::getenv);
  }

  ConfigurationProvider(String location, Function<String, String> env) {
    this.configuration = addOns(loadYamlFromLocation(location), env);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = loader.getResourceAsStream(resourceName)) {
      if (input == null) {
        log.debug("No classpath resource {}; using an empty configuration", resourceName);
        return new YAMLConfiguration();
      }
      log.info("Loading configuration from classpath resource: {}", resourceName);
      return read(new InputStreamReader(input, StandardCharsets.UTF_8), resourceName);
    } catch (IOException e) {
      throw failure("Failed to read YAML from classpath resource", resourceName, e);
    }
  }

  private static YAMLConfiguration loadYamlFromFile(File file) {
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return read(reader, file.getPath());
    } catch (IOException e) {
      throw failure("Failed to load YAML file", file.getPath(), e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String location) {
    YAMLConfiguration config = new YAMLConfiguration();
    try {
      config.read(reader);
    } catch (Exception e) {
      throw ExceptionUtil.asAppError(
          e, ex -> failure("Failed to parse YAML configuration", location, ex));
    }
    return config;
  }

  private static YAMLConfiguration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromLocation(DEFAULT_LOCATION);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw failure("Invalid file URI", loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(YAMLConfiguration config, Function<String, String> env) {
    ConfigurationInterpolator interpolator = config.getInterpolator();
    interpolator.registerLookup("env", new EnvLookup(env));
    return config;
  }

  private static AppError failure(String message, String location, Throwable cause) {
    return AppError.config(message + ": " + location)
        .withField(Fields.str("config_location", location))
        .withSource(cause);
  }

  private static final class EnvLookup implements Lookup {
    private final Function<String, String> env;

    EnvLookup(Function<String, String> env) {
      this.env = env;
    }

    @Override
    public Object lookup(String key) {
      String val = env.apply(key);
      return val == null || val.isEmpty() ? null : val;
    }
  }
}
