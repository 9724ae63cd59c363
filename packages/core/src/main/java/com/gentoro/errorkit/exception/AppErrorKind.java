package com.gentoro.errorkit.exception;

/**
 * Semantic category of an {@link AppError}. Variants may be added but are never removed or
 * renamed; {@link #categoryName()} is part of the wire contract.
 */
public enum AppErrorKind {
  NOT_FOUND("NotFound", "Not found", 404),
  VALIDATION("Validation", "Validation error", 422),
  CONFLICT("Conflict", "Conflict", 409),
  UNAUTHORIZED("Unauthorized", "Unauthorized", 401),
  FORBIDDEN("Forbidden", "Forbidden", 403),
  NOT_IMPLEMENTED("NotImplemented", "Not implemented", 501),
  INTERNAL("Internal", "Internal server error", 500),
  BAD_REQUEST("BadRequest", "Bad request", 400),
  TELEGRAM_AUTH("TelegramAuth", "Telegram authentication error", 401),
  INVALID_JWT("InvalidJwt", "Invalid JWT", 401),
  DATABASE("Database", "Database error", 500),
  SERVICE("Service", "Service error", 500),
  CONFIG("Config", "Configuration error", 500),
  TURNKEY("Turnkey", "Turnkey error", 500),
  TIMEOUT("Timeout", "Operation timed out", 504),
  NETWORK("Network", "Network error", 503),
  RATE_LIMITED("RateLimited", "Rate limit exceeded", 429),
  DEPENDENCY_UNAVAILABLE("DependencyUnavailable", "External dependency unavailable", 503),
  SERIALIZATION("Serialization", "Serialization error", 500),
  DESERIALIZATION("Deserialization", "Deserialization error", 500),
  EXTERNAL_API("ExternalApi", "External API error", 500),
  QUEUE("Queue", "Queue processing error", 500),
  CACHE("Cache", "Cache error", 500);

  private final String categoryName;
  private final String label;
  private final int httpStatus;

  AppErrorKind(String categoryName, String label, int httpStatus) {
    this.categoryName = categoryName;
    this.label = label;
    this.httpStatus = httpStatus;
  }

  /** Stable PascalCase name used as the {@code kind} and {@code category} value. */
  public String categoryName() {
    return categoryName;
  }

  /** Human-readable fallback used when an error carries no message. */
  public String label() {
    return label;
  }

  public int httpStatus() {
    return httpStatus;
  }

  /** Server-side failures (5xx) that usually warrant alerting. */
  public boolean isCritical() {
    return httpStatus >= 500;
  }

  @Override
  public String toString() {
    return label;
  }
}
