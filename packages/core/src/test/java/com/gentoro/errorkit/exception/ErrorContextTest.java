package com.gentoro.errorkit.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gentoro.errorkit.metadata.Field;
import com.gentoro.errorkit.metadata.FieldRedaction;
import com.gentoro.errorkit.metadata.FieldValue;
import com.gentoro.errorkit.metadata.Fields;
import com.gentoro.errorkit.telemetry.ErrorTelemetry;
import com.gentoro.errorkit.telemetry.TelemetryConstants;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ErrorContextTest {
  private InMemoryMetricReader metricReader;
  private SdkMeterProvider meterProvider;

  @BeforeEach
  void setUp() {
    metricReader = InMemoryMetricReader.create();
    meterProvider = SdkMeterProvider.builder().registerMetricReader(metricReader).build();
    ErrorTelemetry.install(OpenTelemetrySdk.builder().setMeterProvider(meterProvider).build());
  }

  @AfterEach
  void tearDown() {
    ErrorTelemetry.reset();
    meterProvider.close();
  }

  @Test
  void categoryDefaultsCodeToCanonicalMapping() {
    AppError error = ErrorContext.of(AppErrorKind.NOT_FOUND).intoError();

    assertThat(error.getKind()).isEqualTo(AppErrorKind.NOT_FOUND);
    assertThat(error.getCode()).isEqualTo(AppCode.NOT_FOUND);
  }

  @Test
  void changingCategoryResyncsCodeUnlessOverridden() {
    ErrorContext context = ErrorContext.of(AppErrorKind.INTERNAL).category(AppErrorKind.TIMEOUT);
    assertThat(context.getCode()).isEqualTo(AppCode.TIMEOUT);

    context.code(AppCode.of("UPSTREAM_SLOW")).category(AppErrorKind.NETWORK);

    AppError error = context.intoError();
    assertThat(error.getKind()).isEqualTo(AppErrorKind.NETWORK);
    assertThat(error.getCode().value()).isEqualTo("UPSTREAM_SLOW");
  }

  @Test
  void policiesApplyToFieldsAddedBeforeAndAfter() {
    AppError error =
        ErrorContext.of(AppErrorKind.DATABASE)
            .with(Fields.str("email", "before@example.com"))
            .redactField("email", FieldRedaction.HASH)
            .redactField("phone", FieldRedaction.LAST4)
            .with(Fields.str("phone", "5551234567"))
            .intoError(new IOException("down"));

    assertThat(error.getMetadata().redaction("email")).contains(FieldRedaction.HASH);
    assertThat(error.getMetadata().redaction("phone")).contains(FieldRedaction.LAST4);
    assertThat(error.getCause()).isInstanceOf(IOException.class);
  }

  @Test
  void registeredPolicyStaysOnTheProducedError() {
    AppError error =
        ErrorContext.of(AppErrorKind.SERVICE)
            .redactField("card_pan", FieldRedaction.REDACT)
            .intoError();

    error.withField(Fields.str("card_pan", "4111"));

    assertThat(error.getMetadata().redaction("card_pan")).contains(FieldRedaction.REDACT);
  }

  @Test
  void redactToggleMarksMessage() {
    AppError error = ErrorContext.of(AppErrorKind.INTERNAL).redact(true).intoError();

    assertThat(error.getEditPolicy()).isEqualTo(MessageEditPolicy.REDACT);
  }

  @Test
  void trackCallerAddsExactlyThreeFieldsPerError() {
    List<AppError> errors = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      errors.add(
          ErrorContext.of(AppErrorKind.INTERNAL)
              .with(Fields.i64("attempt", i))
              .trackCaller()
              .intoError(new IllegalStateException("boom " + i)));
    }

    assertThat(errors).doesNotHaveDuplicates();
    for (AppError error : errors) {
      List<String> names =
          error.getMetadata().stream().map(Field::name).collect(Collectors.toList());
      assertThat(names)
          .containsExactly(
              "attempt",
              ErrorContext.CALLER_COLUMN,
              ErrorContext.CALLER_FILE,
              ErrorContext.CALLER_LINE);
      assertThat(error.getMetadata().get(ErrorContext.CALLER_FILE))
          .contains(new FieldValue.Str("ErrorContextTest.java"));
      assertThat(error.getMetadata().get(ErrorContext.CALLER_COLUMN))
          .contains(new FieldValue.UnsignedInt(0));
    }
    assertThat(errors.get(0).getMetadata().get(ErrorContext.CALLER_LINE))
        .isEqualTo(errors.get(2).getMetadata().get(ErrorContext.CALLER_LINE));
  }

  @Test
  void withoutTrackCallerNoLocationFields() {
    AppError error = ErrorContext.of(AppErrorKind.INTERNAL).intoError();

    assertThat(error.getMetadata().field(ErrorContext.CALLER_FILE)).isEmpty();
  }

  @Test
  void intoErrorEmitsTelemetryOnce() {
    ErrorContext.of(AppErrorKind.QUEUE)
        .with(Fields.str("queue", "billing"))
        .redactField("queue", FieldRedaction.HASH)
        .trackCaller()
        .intoError(new IllegalStateException("full"));

    assertThat(counterTotal()).isEqualTo(1);
  }

  @Test
  void callConvertsCheckedFailures() {
    ErrorContext context =
        ErrorContext.of(AppErrorKind.EXTERNAL_API).with(Fields.str("endpoint", "/v1/rates"));

    assertThatThrownBy(
            () ->
                context.call(
                    () -> {
                      throw new IOException("timeout talking to upstream");
                    }))
        .isInstanceOfSatisfying(
            AppError.class,
            e -> {
              assertThat(e.getKind()).isEqualTo(AppErrorKind.EXTERNAL_API);
              assertThat(e.getCause()).hasMessage("timeout talking to upstream");
              assertThat(e.getMetadata().get("endpoint")).isPresent();
            });
  }

  @Test
  void callReturnsValueOnSuccess() {
    String value = ErrorContext.of(AppErrorKind.CACHE).call(() -> "hit");

    assertThat(value).isEqualTo("hit");
  }

  @Test
  void runRestoresInterruptFlag() {
    try {
      assertThatThrownBy(
              () ->
                  ErrorContext.of(AppErrorKind.TIMEOUT)
                      .run(
                          () -> {
                            throw new InterruptedException("stop");
                          }))
          .isInstanceOf(AppError.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  private long counterTotal() {
    long total = 0;
    for (MetricData metric : metricReader.collectAllMetrics()) {
      if (!metric.getName().equals(TelemetryConstants.ERRORS_TOTAL)) continue;
      for (LongPointData point : metric.getLongSumData().getPoints()) {
        total += point.getValue();
      }
    }
    return total;
  }
}
