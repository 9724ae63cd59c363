package com.gentoro.errorkit.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.errorkit.metadata.Fields;
import java.util.Objects;
import java.util.Optional;

/**
 * Stable machine-readable error code in SCREAMING_SNAKE_CASE.
 *
 * <p>A valid code is non-empty, uses only {@code A-Z}, {@code 0-9} and {@code _}, and has no
 * leading, trailing or doubled underscore.
 */
public record AppCode(@JsonValue String value) {
  public static final AppCode NOT_FOUND = new AppCode("NOT_FOUND");
  public static final AppCode VALIDATION = new AppCode("VALIDATION");
  public static final AppCode CONFLICT = new AppCode("CONFLICT");
  public static final AppCode USER_ALREADY_EXISTS = new AppCode("USER_ALREADY_EXISTS");
  public static final AppCode UNAUTHORIZED = new AppCode("UNAUTHORIZED");
  public static final AppCode FORBIDDEN = new AppCode("FORBIDDEN");
  public static final AppCode NOT_IMPLEMENTED = new AppCode("NOT_IMPLEMENTED");
  public static final AppCode BAD_REQUEST = new AppCode("BAD_REQUEST");
  public static final AppCode RATE_LIMITED = new AppCode("RATE_LIMITED");
  public static final AppCode TELEGRAM_AUTH = new AppCode("TELEGRAM_AUTH");
  public static final AppCode INVALID_JWT = new AppCode("INVALID_JWT");
  public static final AppCode INTERNAL = new AppCode("INTERNAL");
  public static final AppCode DATABASE = new AppCode("DATABASE");
  public static final AppCode SERVICE = new AppCode("SERVICE");
  public static final AppCode CONFIG = new AppCode("CONFIG");
  public static final AppCode TURNKEY = new AppCode("TURNKEY");
  public static final AppCode TIMEOUT = new AppCode("TIMEOUT");
  public static final AppCode NETWORK = new AppCode("NETWORK");
  public static final AppCode DEPENDENCY_UNAVAILABLE = new AppCode("DEPENDENCY_UNAVAILABLE");
  public static final AppCode SERIALIZATION = new AppCode("SERIALIZATION");
  public static final AppCode DESERIALIZATION = new AppCode("DESERIALIZATION");
  public static final AppCode EXTERNAL_API = new AppCode("EXTERNAL_API");
  public static final AppCode QUEUE = new AppCode("QUEUE");
  public static final AppCode CACHE = new AppCode("CACHE");

  public AppCode {
    Objects.requireNonNull(value, "value");
    if (!isValid(value)) {
      throw new IllegalArgumentException(
          "Invalid app code '%s': expected SCREAMING_SNAKE_CASE".formatted(value));
    }
  }

  /**
   * Validating factory for codes that come from outside the program.
   *
   * @throws AppError of kind {@code Validation} when {@code value} is not a valid code
   */
  public static AppCode of(String value) {
    if (value == null || !isValid(value)) {
      throw AppError.validation("Invalid app code: " + value)
          .withField(Fields.str("app_code", String.valueOf(value)));
    }
    return new AppCode(value);
  }

  public static Optional<AppCode> parse(String value) {
    return value != null && isValid(value) ? Optional.of(new AppCode(value)) : Optional.empty();
  }

  public static boolean isValid(String value) {
    if (value.isEmpty() || value.startsWith("_") || value.endsWith("_")) return false;
    char prev = 0;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      boolean allowed = (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
      if (!allowed || (c == '_' && prev == '_')) return false;
      prev = c;
    }
    return true;
  }

  /** Canonical code of a category. */
  public static AppCode forKind(AppErrorKind kind) {
    return switch (kind) {
      case NOT_FOUND -> NOT_FOUND;
      case VALIDATION -> VALIDATION;
      case CONFLICT -> CONFLICT;
      case UNAUTHORIZED -> UNAUTHORIZED;
      case FORBIDDEN -> FORBIDDEN;
      case NOT_IMPLEMENTED -> NOT_IMPLEMENTED;
      case INTERNAL -> INTERNAL;
      case BAD_REQUEST -> BAD_REQUEST;
      case TELEGRAM_AUTH -> TELEGRAM_AUTH;
      case INVALID_JWT -> INVALID_JWT;
      case DATABASE -> DATABASE;
      case SERVICE -> SERVICE;
      case CONFIG -> CONFIG;
      case TURNKEY -> TURNKEY;
      case TIMEOUT -> TIMEOUT;
      case NETWORK -> NETWORK;
      case RATE_LIMITED -> RATE_LIMITED;
      case DEPENDENCY_UNAVAILABLE -> DEPENDENCY_UNAVAILABLE;
      case SERIALIZATION -> SERIALIZATION;
      case DESERIALIZATION -> DESERIALIZATION;
      case EXTERNAL_API -> EXTERNAL_API;
      case QUEUE -> QUEUE;
      case CACHE -> CACHE;
    };
  }

  @Override
  public String toString() {
    return value;
  }
}
