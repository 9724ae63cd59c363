package com.gentoro.errorkit.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.errorkit.exception.AppError;

public class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // Ignore extra fields in JSON that aren't in the target class
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)

          // Allow serialization even if beans have no properties
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)

          // Include only non-null fields in output
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Compact JSON; wire payloads are never indented. */
  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw AppError.serialization("Failed to serialize object to JSON").withSource(e);
    }
  }

  public static String toPrettyJson(Object object) {
    try {
      return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(object);
    } catch (Exception e) {
      throw AppError.serialization("Failed to serialize object to JSON").withSource(e);
    }
  }

  /**
   * Converts an arbitrary value into a JSON tree.
   *
   * @throws AppError of kind {@code Serialization} when the value cannot be represented as JSON
   */
  public static JsonNode toTree(Object value) {
    try {
      return JSON_MAPPER.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw AppError.serialization("Failed to convert value to JSON")
          .withSource(e.getCause() == null ? e : e.getCause());
    }
  }
}
