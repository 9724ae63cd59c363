package com.gentoro.errorkit.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import com.gentoro.errorkit.exception.AppError;
import com.gentoro.errorkit.exception.MessageEditPolicy;
import com.gentoro.errorkit.metadata.Field;
import com.gentoro.errorkit.utility.JacksonUtility;
import java.io.IOException;

/**
 * RFC 7807 problem details for an {@link AppError}.
 *
 * <p>Metadata values are sanitized: hashed and masked fields carry their digest or mask,
 * redacted fields a placeholder. When the message is redacted, both {@code detail} and {@code
 * metadata} are left out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemDetails(
    String type,
    String title,
    int status,
    String detail,
    String code,
    GrpcCode grpc,
    ObjectNode metadata,
    @JsonProperty("retry_after") Long retryAfter,
    @JsonProperty("www_authenticate") String wwwAuthenticate) {

  /** Builds problem details, flushing pending telemetry of {@code error} first. */
  public static ProblemDetails from(AppError error) {
    error.emitTelemetry();
    CodeMapping mapping = ProtocolMappings.mappingFor(error);
    boolean redacted = error.getEditPolicy() == MessageEditPolicy.REDACT;
    return new ProblemDetails(
        mapping.problemType(),
        error.getKind().label(),
        mapping.httpStatus(),
        redacted ? null : error.getRawMessage().orElse(null),
        error.getCode().value(),
        mapping.grpc(),
        redacted ? null : sanitizedMetadata(error),
        error.getRetry().map(r -> r.afterSeconds()).orElse(null),
        error.getWwwAuthenticate().orElse(null));
  }

  public String toJson() {
    return JacksonUtility.toJson(this);
  }

  private static ObjectNode sanitizedMetadata(AppError error) {
    if (error.getMetadata().isEmpty()) return null;
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ObjectNode node = mapper.createObjectNode();
    for (Field field : error.getMetadata()) {
      node.set(field.name(), sanitizedValue(mapper, field));
    }
    return node;
  }

  private static JsonNode sanitizedValue(ObjectMapper mapper, Field field) {
    try (TokenBuffer buffer = new TokenBuffer(mapper, false)) {
      field.writeSanitized(buffer);
      return mapper.readTree(buffer.asParser());
    } catch (IOException e) {
      throw AppError.serialization("Failed to serialize metadata field " + field.name())
          .withSource(e);
    }
  }
}
