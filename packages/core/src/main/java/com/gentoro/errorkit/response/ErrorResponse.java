package com.gentoro.errorkit.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.errorkit.exception.AppCode;
import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.RetryAdvice;
import com.gentoro.errorkit.metadata.Fields;
import com.gentoro.errorkit.utility.JacksonUtility;
import java.util.Objects;

/** Minimal wire error: HTTP status, code, message and optional retry and auth hints. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    int status,
    AppCode code,
    String message,
    RetryAdvice retry,
    @JsonProperty("www_authenticate") String wwwAuthenticate) {

  public static final int MIN_STATUS = 100;
  public static final int MAX_STATUS = 599;

  /**
   * @throws AppError of kind {@code Validation} when {@code status} is outside 100..599
   */
  public static ErrorResponse of(int status, AppCode code, String message) {
    if (status < MIN_STATUS || status > MAX_STATUS) {
      throw AppError.validation("Invalid HTTP status code: " + status)
          .withField(Fields.i64("http_status", status));
    }
    return new ErrorResponse(
        status, Objects.requireNonNull(code, "code"), Objects.requireNonNull(message), null, null);
  }

  /**
   * Maps an error through {@link ProtocolMappings}. A redacted message is replaced by the kind
   * label.
   */
  public static ErrorResponse from(AppError error) {
    error.emitTelemetry();
    CodeMapping mapping = ProtocolMappings.mappingFor(error);
    return new ErrorResponse(
        mapping.httpStatus(),
        error.getCode(),
        error.getMessage(),
        error.getRetry().orElse(null),
        error.getWwwAuthenticate().orElse(null));
  }

  public ErrorResponse withRetryAfter(long seconds) {
    return new ErrorResponse(status, code, message, new RetryAdvice(seconds), wwwAuthenticate);
  }

  public ErrorResponse withWwwAuthenticate(String challenge) {
    return new ErrorResponse(status, code, message, retry, challenge);
  }

  public String toJson() {
    return JacksonUtility.toJson(this);
  }
}
