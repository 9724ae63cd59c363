package com.gentoro.errorkit.metadata;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.util.Objects;

/**
 * Named metadata value together with the redaction applied when it is emitted.
 *
 * <p>The two-argument constructor derives the redaction from the field name (see {@link
 * Redactions#inferDefault(String)}).
 */
public record Field(String name, FieldValue value, FieldRedaction redaction) {
  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(redaction, "redaction");
  }

  public Field(String name, FieldValue value) {
    this(name, value, Redactions.inferDefault(name));
  }

  public Field withRedaction(FieldRedaction policy) {
    return policy == redaction ? this : new Field(name, value, policy);
  }

  /** Value as it may leave the process: digest, mask or placeholder depending on the policy. */
  public String sanitizedText() {
    return switch (redaction) {
      case NONE -> value.display();
      case REDACT -> Redactions.PLACEHOLDER;
      case HASH -> Redactions.sha256Hex(value.display());
      case LAST4 -> value.maskable() ? Redactions.last4(value.display()) : Redactions.PLACEHOLDER;
    };
  }

  /** Writes the sanitized value; unredacted fields keep their native JSON type. */
  public void writeSanitized(JsonGenerator gen) throws IOException {
    if (redaction == FieldRedaction.NONE) {
      value.writeJson(gen);
    } else {
      gen.writeString(sanitizedText());
    }
  }
}
