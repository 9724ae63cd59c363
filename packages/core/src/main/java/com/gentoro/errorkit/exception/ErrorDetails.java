package com.gentoro.errorkit.exception;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/** Structured payload attached to an error: either a JSON tree or plain text. */
public final class ErrorDetails {
  private final JsonNode json;
  private final String text;

  private ErrorDetails(JsonNode json, String text) {
    this.json = json;
    this.text = text;
  }

  public static ErrorDetails json(JsonNode json) {
    return new ErrorDetails(Objects.requireNonNull(json, "json"), null);
  }

  public static ErrorDetails text(String text) {
    return new ErrorDetails(null, Objects.requireNonNull(text, "text"));
  }

  public boolean isJson() {
    return json != null;
  }

  public Optional<JsonNode> asJson() {
    return Optional.ofNullable(json);
  }

  public Optional<String> asText() {
    return Optional.ofNullable(text);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ErrorDetails other)) return false;
    return Objects.equals(json, other.json) && Objects.equals(text, other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(json, text);
  }

  @Override
  public String toString() {
    return isJson() ? json.toString() : text;
  }
}
