package com.gentoro.errorkit.metadata;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.math.BigInteger;
import java.net.InetAddress;
import java.util.Objects;
import java.util.UUID;

/**
 * Typed value stored in {@link Metadata}. Every variant is immutable and knows how to render
 * itself as text and as a JSON value.
 */
public interface FieldValue {

  /** Textual form used by the local renderer and as input for hashing and masking. */
  String display();

  void writeJson(JsonGenerator gen) throws IOException;

  /** Whether a {@link FieldRedaction#LAST4} mask can be applied to this value. */
  default boolean maskable() {
    return true;
  }

  record Str(String value) implements FieldValue {
    public Str {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value;
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      gen.writeString(value);
    }
  }

  record SignedInt(long value) implements FieldValue {
    @Override
    public String display() {
      return Long.toString(value);
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      gen.writeNumber(value);
    }
  }

  /** 64-bit unsigned integer kept in a {@code long}; values above {@code Long.MAX_VALUE} wrap. */
  record UnsignedInt(long value) implements FieldValue {
    @Override
    public String display() {
      return Long.toUnsignedString(value);
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      if (value >= 0) {
        gen.writeNumber(value);
      } else {
        gen.writeNumber(new BigInteger(Long.toUnsignedString(value)));
      }
    }
  }

  record Bool(boolean value) implements FieldValue {
    @Override
    public String display() {
      return Boolean.toString(value);
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      gen.writeBoolean(value);
    }

    @Override
    public boolean maskable() {
      return false;
    }
  }

  record Uuid(UUID value) implements FieldValue {
    public Uuid {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value.toString();
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      gen.writeString(value.toString());
    }
  }

  /** Non-finite values are written as JSON {@code null}. */
  record Float(double value) implements FieldValue {
    @Override
    public String display() {
      return Double.toString(value);
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      if (Double.isFinite(value)) {
        gen.writeNumber(value);
      } else {
        gen.writeNull();
      }
    }
  }

  /** Written as {@code {"secs":..,"nanos":..}}. */
  record Duration(java.time.Duration value) implements FieldValue {
    public Duration {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value.toString();
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      gen.writeStartObject();
      gen.writeNumberField("secs", value.getSeconds());
      gen.writeNumberField("nanos", value.getNano());
      gen.writeEndObject();
    }
  }

  record Ip(InetAddress value) implements FieldValue {
    public Ip {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value.getHostAddress();
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      gen.writeString(value.getHostAddress());
    }
  }

  record Json(JsonNode value) implements FieldValue {
    public Json {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String display() {
      return value.toString();
    }

    @Override
    public void writeJson(JsonGenerator gen) throws IOException {
      gen.writeTree(value);
    }
  }
}
