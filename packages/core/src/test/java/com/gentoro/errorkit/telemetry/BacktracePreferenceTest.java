package com.gentoro.errorkit.telemetry;

import static org.assertj.core.api.Assertions.assertThat;

import com.gentoro.errorkit.exception.AppError;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class BacktracePreferenceTest {

  @AfterEach
  void tearDown() {
    BacktracePreference.reset();
  }

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "  ", "0", "off", "OFF", "false", "False"})
  void disablingValues(String raw) {
    assertThat(BacktracePreference.parse(raw)).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {"1", "full", "true", "yes", " on "})
  void enablingValues(String raw) {
    assertThat(BacktracePreference.parse(raw)).isTrue();
  }

  @Test
  void environmentIsReadOnce() {
    AtomicInteger lookups = new AtomicInteger();
    Map<String, String> env = Map.of(BacktracePreference.ENV_VARIABLE, "1");
    BacktracePreference.reset(
        name -> {
          lookups.incrementAndGet();
          return env.get(name);
        });

    assertThat(BacktracePreference.isEnabled()).isTrue();
    assertThat(BacktracePreference.isEnabled()).isTrue();
    assertThat(lookups).hasValue(1);
  }

  @Test
  void disabledPreferenceSkipsCapture() {
    BacktracePreference.force(false);

    AppError error = AppError.internal("no trace");

    assertThat(error.getBacktrace()).isEmpty();
    assertThat(error.getStackTrace()).isEmpty();
  }

  @Test
  void enabledPreferenceCapturesCallerFrames() {
    BacktracePreference.force(true);

    AppError error = AppError.internal("traced");

    assertThat(error.getBacktrace()).isPresent();
    Backtrace backtrace = error.getBacktrace().get();
    assertThat(backtrace.frames().get(0).getClassName()).isEqualTo(getClass().getName());
    assertThat(backtrace.frames().get(0).getMethodName())
        .isEqualTo("enabledPreferenceCapturesCallerFrames");
  }

  @Test
  void concurrentEmittersShareOneCapturedBacktrace() throws Exception {
    BacktracePreference.force(false);
    AppError error = AppError.internal("raced");
    BacktracePreference.force(true);

    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  error.redactable().emitTelemetry();
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    Backtrace first = error.getBacktrace().orElseThrow();
    assertThat(first.isEmpty()).isFalse();
    assertThat(error.getBacktrace()).containsSame(first);
  }

  @Test
  void explicitBacktraceWinsOverCapture() {
    BacktracePreference.force(true);
    Backtrace explicit = Backtrace.of(new IllegalStateException("elsewhere"));

    AppError error = AppError.internal("traced").withBacktrace(explicit);

    assertThat(error.getBacktrace()).containsSame(explicit);
  }
}
