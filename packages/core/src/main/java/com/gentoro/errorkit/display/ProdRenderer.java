package com.gentoro.errorkit.display;

import com.fasterxml.jackson.core.JsonGenerator;
import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.metadata.FieldRedaction;
import java.io.IOException;

/**
 * Production JSON. Only fields without redaction are emitted; source chain, backtrace, details
 * and diagnostics never are.
 */
public final class ProdRenderer extends JsonErrorRenderer {

  @Override
  protected void writeBody(JsonGenerator gen, AppError error) throws IOException {
    writeMetadata(gen, error, f -> f.redaction() == FieldRedaction.NONE);
  }
}
