package com.gentoro.errorkit.display;

import com.fasterxml.jackson.core.JsonGenerator;
import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.ExceptionUtil;
import com.gentoro.errorkit.metadata.FieldRedaction;
import java.io.IOException;

/**
 * Staging JSON: production shape plus a {@code source_chain} of at most {@code chainDepth}
 * entries, every field not marked {@link FieldRedaction#REDACT} with hashed and masked values
 * sanitized, and {@code details} while the message is not redacted.
 */
public final class StagingRenderer extends JsonErrorRenderer {
  private final int chainDepth;

  public StagingRenderer(int chainDepth) {
    if (chainDepth <= 0) throw new IllegalArgumentException("chainDepth must be > 0");
    this.chainDepth = chainDepth;
  }

  public int chainDepth() {
    return chainDepth;
  }

  @Override
  protected void writeBody(JsonGenerator gen, AppError error) throws IOException {
    if (error.getCause() != null) {
      gen.writeArrayFieldStart("source_chain");
      for (String level : ExceptionUtil.describeCauses(error, chainDepth)) {
        gen.writeString(level);
      }
      gen.writeEndArray();
    }
    writeMetadata(gen, error, f -> f.redaction() != FieldRedaction.REDACT);
    writeDetails(gen, error);
  }
}
