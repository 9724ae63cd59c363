package com.gentoro.errorkit.display;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DisplayModeResolverTest {
  private final Map<String, String> env = new HashMap<>();

  @AfterEach
  void tearDown() {
    DisplayMode.resetCurrent();
  }

  @ParameterizedTest
  @CsvSource({
    "prod, PROD",
    "Production, PROD",
    "local, LOCAL",
    "dev, LOCAL",
    "DEVELOPMENT, LOCAL",
    "staging, STAGING",
    "' stage ', STAGING"
  })
  void explicitOverrideWins(String value, DisplayMode expected) {
    env.put(DisplayModeResolver.MODE_VARIABLE, value);
    env.put(DisplayModeResolver.ORCHESTRATION_VARIABLE, "10.0.0.1");

    assertThat(new DisplayModeResolver(env::get, true).resolve()).isEqualTo(expected);
  }

  @Test
  void unrecognizedOverrideFallsThroughToOrchestrationMarker() {
    env.put(DisplayModeResolver.MODE_VARIABLE, "qa");
    env.put(DisplayModeResolver.ORCHESTRATION_VARIABLE, "10.0.0.1");

    assertThat(new DisplayModeResolver(env::get, true).resolve()).isEqualTo(DisplayMode.PROD);
  }

  @Test
  void buildModeIsTheLastResort() {
    assertThat(new DisplayModeResolver(env::get, true).resolve()).isEqualTo(DisplayMode.LOCAL);
    assertThat(new DisplayModeResolver(env::get, false).resolve()).isEqualTo(DisplayMode.PROD);
  }

  @Test
  void currentIsCachedUntilReset() {
    DisplayMode.overrideCurrent(DisplayMode.STAGING);

    assertThat(DisplayMode.current()).isEqualTo(DisplayMode.STAGING);
    assertThat(DisplayMode.current()).isSameAs(DisplayMode.current());

    DisplayMode.resetCurrent();
    assertThat(DisplayMode.current()).isEqualTo(DisplayModeResolver.fromEnvironment().resolve());
  }

  @Test
  void modesMapToMinimumVisibility() {
    assertThat(DisplayMode.PROD.minimumVisibility())
        .isEqualTo(com.gentoro.errorkit.diagnostics.Visibility.PUBLIC);
    assertThat(DisplayMode.LOCAL.minimumVisibility())
        .isEqualTo(com.gentoro.errorkit.diagnostics.Visibility.DEV_ONLY);
  }
}
