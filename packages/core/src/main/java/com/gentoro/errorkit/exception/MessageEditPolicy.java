package com.gentoro.errorkit.exception;

/** Whether the top-level message of an error may be shown outside the process. */
public enum MessageEditPolicy {
  PRESERVE,
  REDACT
}
