package com.gentoro.errorkit.display;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.ErrorDetails;
import com.gentoro.errorkit.exception.MessageEditPolicy;
import com.gentoro.errorkit.logging.LoggingService;
import com.gentoro.errorkit.metadata.Field;
import com.gentoro.errorkit.utility.JacksonUtility;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Base for the JSON renderers: writes {@code kind}, {@code code} and the unredacted message,
 * then the mode-specific body.
 */
abstract class JsonErrorRenderer implements ErrorRenderer {
  private static final org.slf4j.Logger log = LoggingService.getLogger(JsonErrorRenderer.class);

  @Override
  public final String render(AppError error) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = JacksonUtility.getJsonMapper().createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("kind", error.getKind().categoryName());
      gen.writeStringField("code", error.getCode().value());
      Optional<String> message = error.getRawMessage();
      if (error.getEditPolicy() != MessageEditPolicy.REDACT && message.isPresent()) {
        gen.writeStringField("message", message.get());
      }
      writeBody(gen, error);
      gen.writeEndObject();
    } catch (IOException e) {
      throw AppError.serialization("Failed to render error").withSource(e);
    }
    return out.toString();
  }

  protected abstract void writeBody(JsonGenerator gen, AppError error) throws IOException;

  /** Writes a {@code metadata} object of the matching fields; nothing when none match. */
  protected static void writeMetadata(JsonGenerator gen, AppError error, Predicate<Field> include)
      throws IOException {
    List<Field> selected =
        error.getMetadata().stream().filter(include).collect(Collectors.toList());
    if (selected.isEmpty()) return;
    gen.writeObjectFieldStart("metadata");
    for (Field field : selected) {
      gen.writeFieldName(field.name());
      field.writeSanitized(gen);
    }
    gen.writeEndObject();
  }

  /**
   * Writes {@code details} unless the message is redacted. Details that fail to serialize are
   * left out.
   */
  protected static void writeDetails(JsonGenerator gen, AppError error) throws IOException {
    if (error.getEditPolicy() == MessageEditPolicy.REDACT || error.getDetails().isEmpty()) return;
    ErrorDetails details = error.getDetails().get();
    if (!details.isJson()) {
      gen.writeStringField("details", details.asText().orElse(""));
      return;
    }
    String json;
    try {
      json = JacksonUtility.getJsonMapper().writeValueAsString(details.asJson().get());
    } catch (JsonProcessingException e) {
      log.debug("Omitting error details for {}: {}", error.getCode(), e.getOriginalMessage());
      return;
    }
    gen.writeFieldName("details");
    gen.writeRawValue(json);
  }
}
