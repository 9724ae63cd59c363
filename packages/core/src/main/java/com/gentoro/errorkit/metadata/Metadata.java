package com.gentoro.errorkit.metadata;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Ordered collection of {@link Field}s keyed by name.
 *
 * <p>Iteration follows the natural order of field names, never insertion order, so two
 * collections built from the same fields serialize identically. Redaction policies are tracked
 * per name independently of field presence: registering a policy rewrites the matching field
 * already stored and is applied to any field inserted later under that name.
 *
 * <p>Not thread-safe; an instance is owned by a single error record.
 */
public final class Metadata implements Iterable<Field> {
  private final TreeMap<String, Field> fields = new TreeMap<>();
  private final Map<String, FieldRedaction> policies = new HashMap<>();

  public Metadata() {}

  public static Metadata fromFields(Iterable<Field> source) {
    Metadata metadata = new Metadata();
    metadata.extend(source);
    return metadata;
  }

  /**
   * Inserts a field, replacing any field stored under the same name.
   *
   * @return the value previously stored under the name, if any
   */
  public Optional<FieldValue> insert(Field field) {
    Objects.requireNonNull(field, "field");
    FieldRedaction policy = policies.get(field.name());
    Field stored = policy == null ? field : field.withRedaction(policy);
    Field previous = fields.put(stored.name(), stored);
    return previous == null ? Optional.empty() : Optional.of(previous.value());
  }

  public void extend(Iterable<Field> source) {
    if (source == null) return;
    for (Field field : source) {
      insert(field);
    }
  }

  public Optional<FieldValue> get(String name) {
    Field field = fields.get(name);
    return field == null ? Optional.empty() : Optional.of(field.value());
  }

  public Optional<Field> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  /** Redaction of the stored field, empty when no field exists under {@code name}. */
  public Optional<FieldRedaction> redaction(String name) {
    Field field = fields.get(name);
    return field == null ? Optional.empty() : Optional.of(field.redaction());
  }

  /**
   * Registers a policy for {@code name}. A missing field is not an error: the policy is kept and
   * applied when a field with that name is inserted.
   */
  public void setRedaction(String name, FieldRedaction policy) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(policy, "policy");
    policies.put(name, policy);
    fields.computeIfPresent(name, (k, field) -> field.withRedaction(policy));
  }

  /** Policies registered through {@link #setRedaction}, keyed by field name. */
  public Map<String, FieldRedaction> policies() {
    return Collections.unmodifiableMap(policies);
  }

  /** Fields in name order, each carrying its effective redaction. */
  public Collection<Field> fields() {
    return Collections.unmodifiableCollection(fields.values());
  }

  public Stream<Field> stream() {
    return fields.values().stream();
  }

  @Override
  public Iterator<Field> iterator() {
    return fields().iterator();
  }

  public int size() {
    return fields.size();
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  public Metadata copy() {
    Metadata copy = new Metadata();
    copy.policies.putAll(policies);
    copy.fields.putAll(fields);
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Metadata other)) return false;
    return fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (Field field : fields.values()) {
      if (sb.length() > 1) sb.append(", ");
      sb.append(field.name()).append('=').append(field.sanitizedText());
    }
    return sb.append('}').toString();
  }
}
