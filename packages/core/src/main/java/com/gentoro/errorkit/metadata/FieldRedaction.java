package com.gentoro.errorkit.metadata;

/** How a metadata value is treated when it leaves the process. */
public enum FieldRedaction {
  /** Emitted as-is. */
  NONE,
  /** Never emitted; replaced by a placeholder where a value is required. */
  REDACT,
  /** Replaced by the lowercase hex SHA-256 digest of the value. */
  HASH,
  /** Only the last four characters are kept, the rest masked with {@code *}. */
  LAST4
}
