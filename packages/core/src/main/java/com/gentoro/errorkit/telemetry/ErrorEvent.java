package com.gentoro.errorkit.telemetry;

/**
 * Structured event describing an error record at the time telemetry fired. {@code message},
 * {@code retrySeconds}, {@code wwwAuthenticate} and {@code traceId} may be null.
 */
public record ErrorEvent(
    String code,
    String category,
    String message,
    Long retrySeconds,
    boolean redactable,
    int metadataLen,
    String wwwAuthenticate,
    String traceId) {}
