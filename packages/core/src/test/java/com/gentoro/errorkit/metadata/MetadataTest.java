package com.gentoro.errorkit.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class MetadataTest {

  @Test
  void iteratesInNameOrderRegardlessOfInsertionOrder() {
    Metadata metadata = new Metadata();
    metadata.insert(Fields.str("zeta", "z"));
    metadata.insert(Fields.i64("alpha", 1));
    metadata.insert(Fields.bool("mid", true));

    assertThat(metadata.stream().map(Field::name)).containsExactly("alpha", "mid", "zeta");
  }

  @Test
  void insertReplacesAndReturnsPreviousValue() {
    Metadata metadata = new Metadata();
    assertThat(metadata.insert(Fields.str("user", "a"))).isEmpty();

    assertThat(metadata.insert(Fields.str("user", "b")))
        .contains(new FieldValue.Str("a"));
    assertThat(metadata.get("user")).contains(new FieldValue.Str("b"));
    assertThat(metadata.size()).isEqualTo(1);
  }

  @Test
  void setRedactionAppliesToExistingField() {
    Metadata metadata = new Metadata();
    metadata.insert(Fields.str("email", "a@b.c"));

    metadata.setRedaction("email", FieldRedaction.HASH);

    assertThat(metadata.redaction("email")).contains(FieldRedaction.HASH);
  }

  @Test
  void setRedactionAppliesToFieldsInsertedLater() {
    Metadata metadata = new Metadata();
    metadata.setRedaction("email", FieldRedaction.REDACT);
    assertThat(metadata.redaction("email")).isEmpty();

    metadata.insert(Fields.str("email", "a@b.c"));
    metadata.insert(Fields.str("email", "x@y.z"));

    assertThat(metadata.redaction("email")).contains(FieldRedaction.REDACT);
    assertThat(metadata.policies()).containsEntry("email", FieldRedaction.REDACT);
  }

  @Test
  void setRedactionDoesNotTouchOtherFields() {
    Metadata metadata = new Metadata();
    metadata.insert(Fields.str("a", "1"));
    metadata.insert(Fields.str("b", "2"));

    metadata.setRedaction("b", FieldRedaction.LAST4);

    assertThat(metadata.redaction("a")).contains(FieldRedaction.NONE);
    assertThat(metadata.stream().map(Field::name)).containsExactly("a", "b");
  }

  @Test
  void fromFieldsRoundTripIsOrderIndependent() {
    List<Field> fields =
        List.of(Fields.str("c", "3"), Fields.u64("a", 1), Fields.f64("b", 2.5));
    List<Field> reversed = new ArrayList<>(fields);
    java.util.Collections.reverse(reversed);

    Metadata first = Metadata.fromFields(fields);
    Metadata second = Metadata.fromFields(reversed);
    Metadata reinserted = new Metadata();
    first.forEach(reinserted::insert);

    assertThat(first.fields()).containsExactlyElementsOf(second.fields());
    assertThat(reinserted.fields()).containsExactlyElementsOf(first.fields());
    assertThat(reinserted).isEqualTo(first);
  }

  @Test
  void explicitPolicyOverridesInferredDefault() {
    Metadata metadata = new Metadata();
    metadata.insert(Fields.str("password", "hunter2"));
    assertThat(metadata.redaction("password")).contains(FieldRedaction.REDACT);

    metadata.setRedaction("password", FieldRedaction.NONE);

    assertThat(metadata.redaction("password")).contains(FieldRedaction.NONE);
  }

  @Test
  void toStringNeverShowsRedactedValues() {
    Metadata metadata = new Metadata();
    metadata.insert(Fields.str("session_id", "s3cr3t-session"));
    metadata.insert(Fields.str("user", "alice"));

    assertThat(metadata.toString()).contains("user=alice").doesNotContain("s3cr3t-session");
  }

  @Test
  void copyIsIndependent() {
    Metadata original = new Metadata();
    original.insert(Fields.str("a", "1"));
    Metadata copy = original.copy();

    copy.insert(Fields.str("b", "2"));

    assertThat(original.size()).isEqualTo(1);
    assertThat(copy.stream().map(Field::name).collect(Collectors.toList()))
        .containsExactly("a", "b");
  }
}
