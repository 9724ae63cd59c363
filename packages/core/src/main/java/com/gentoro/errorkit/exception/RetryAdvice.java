package com.gentoro.errorkit.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Hint that the operation may be retried after the given number of seconds. */
public record RetryAdvice(@JsonProperty("after_seconds") long afterSeconds) {
  public RetryAdvice {
    if (afterSeconds < 0) {
      throw new IllegalArgumentException("afterSeconds must be >= 0");
    }
  }
}
