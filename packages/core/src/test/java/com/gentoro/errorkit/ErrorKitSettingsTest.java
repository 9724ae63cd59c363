package com.gentoro.errorkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.AppErrorKind;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

class ErrorKitSettingsTest {

  @Test
  void readsEveryKey() {
    Configuration cfg = new ConfigurationProvider("classpath:errorkit-test.yaml").config();

    ErrorKitSettings settings = ErrorKitSettings.from(cfg);

    assertThat(settings.stagingChainDepth()).isEqualTo(3);
    assertThat(settings.localChainDepth()).isEqualTo(7);
    assertThat(settings.problemBaseUri()).isEqualTo("https://errors.example.test");
    assertThat(settings.eventLogger()).isEqualTo("errorkit.test.events");
    assertThat(settings.eventLevel()).isEqualTo(Level.WARN);
  }

  @Test
  void missingKeysUseDefaults() {
    assertThat(ErrorKitSettings.from(new BaseConfiguration()))
        .isEqualTo(ErrorKitSettings.DEFAULTS);
    assertThat(ErrorKitSettings.from(null)).isSameAs(ErrorKitSettings.DEFAULTS);
  }

  @Test
  void nonPositiveDepthIsConfigError() {
    Configuration cfg = new ConfigurationProvider("classpath:errorkit-invalid.yaml").config();

    assertThatThrownBy(() -> ErrorKitSettings.from(cfg))
        .isInstanceOfSatisfying(
            AppError.class,
            e -> {
              assertThat(e.getKind()).isEqualTo(AppErrorKind.CONFIG);
              assertThat(e.getRawMessage())
                  .hasValueSatisfying(
                      m -> assertThat(m).contains("errorkit.render.staging-chain-depth"));
            });
  }

  @Test
  void nonIntegerDepthIsConfigError() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("errorkit.render.local-chain-depth", "deep");

    assertThatThrownBy(() -> ErrorKitSettings.from(cfg))
        .isInstanceOfSatisfying(
            AppError.class, e -> assertThat(e.getKind()).isEqualTo(AppErrorKind.CONFIG));
  }

  @Test
  void unknownEventLevelIsConfigError() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("errorkit.telemetry.event-level", "LOUD");

    assertThatThrownBy(() -> ErrorKitSettings.from(cfg))
        .isInstanceOfSatisfying(
            AppError.class, e -> assertThat(e.getKind()).isEqualTo(AppErrorKind.CONFIG));
  }
}
