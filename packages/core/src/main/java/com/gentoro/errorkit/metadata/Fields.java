package com.gentoro.errorkit.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.InetAddress;
import java.time.Duration;
import java.util.UUID;

/** Factories for {@link Field}s with the redaction inferred from the field name. */
public final class Fields {
  private Fields() {}

  public static Field str(String name, String value) {
    return new Field(name, new FieldValue.Str(value));
  }

  public static Field i64(String name, long value) {
    return new Field(name, new FieldValue.SignedInt(value));
  }

  public static Field u64(String name, long value) {
    return new Field(name, new FieldValue.UnsignedInt(value));
  }

  public static Field bool(String name, boolean value) {
    return new Field(name, new FieldValue.Bool(value));
  }

  public static Field uuid(String name, UUID value) {
    return new Field(name, new FieldValue.Uuid(value));
  }

  public static Field f64(String name, double value) {
    return new Field(name, new FieldValue.Float(value));
  }

  public static Field duration(String name, Duration value) {
    return new Field(name, new FieldValue.Duration(value));
  }

  public static Field ip(String name, InetAddress value) {
    return new Field(name, new FieldValue.Ip(value));
  }

  public static Field json(String name, JsonNode value) {
    return new Field(name, new FieldValue.Json(value));
  }
}
