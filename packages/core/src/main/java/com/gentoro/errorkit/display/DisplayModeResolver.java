package com.gentoro.errorkit.display;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the {@link DisplayMode} in priority order:
 *
 * <ol>
 *   <li>{@value #MODE_VARIABLE}: {@code prod|production}, {@code local|dev|development}, {@code
 *       staging|stage}; other values are ignored
 *   <li>{@value #ORCHESTRATION_VARIABLE} present: {@link DisplayMode#PROD}
 *   <li>debug build (assertions enabled): {@link DisplayMode#LOCAL}, otherwise {@link
 *       DisplayMode#PROD}
 * </ol>
 */
public final class DisplayModeResolver {
  public static final String MODE_VARIABLE = "ERRORKIT_ENV";
  public static final String ORCHESTRATION_VARIABLE = "KUBERNETES_SERVICE_HOST";

  private final Function<String, String> env;
  private final boolean debugBuild;

  public DisplayModeResolver(Function<String, String> env, boolean debugBuild) {
    this.env = Objects.requireNonNull(env, "env");
    this.debugBuild = debugBuild;
  }

  public static DisplayModeResolver fromEnvironment() {
    return new DisplayModeResolver(
        System::getenv, DisplayModeResolver.class.desiredAssertionStatus());
  }

  public DisplayMode resolve() {
    Optional<DisplayMode> explicit = parse(env.apply(MODE_VARIABLE));
    if (explicit.isPresent()) return explicit.get();
    if (env.apply(ORCHESTRATION_VARIABLE) != null) return DisplayMode.PROD;
    return debugBuild ? DisplayMode.LOCAL : DisplayMode.PROD;
  }

  public static Optional<DisplayMode> parse(String raw) {
    if (raw == null) return Optional.empty();
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "prod", "production" -> Optional.of(DisplayMode.PROD);
      case "local", "dev", "development" -> Optional.of(DisplayMode.LOCAL);
      case "staging", "stage" -> Optional.of(DisplayMode.STAGING);
      default -> Optional.empty();
    };
  }
}
