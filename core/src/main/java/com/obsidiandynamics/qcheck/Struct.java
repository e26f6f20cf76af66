package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;

/**
 *  An immutable set of named fields, ordered by name. Field values may be {@code null}.
 */
public final class Struct {
  private final Map<String, Object> fields;

  private Struct(SortedMap<String, Object> fields) {
    this.fields = Collections.unmodifiableSortedMap(fields);
  }

  public static Struct of(Map<String, ?> fields) {
    return new Struct(new TreeMap<>(fields));
  }

  public Set<String> names() {
    return fields.keySet();
  }

  public boolean has(String name) {
    return fields.containsKey(name);
  }

  @SuppressWarnings("unchecked")
  public <V> V get(String name) {
    Assert.argument(fields.containsKey(name), () -> "No such field: " + name);
    return (V) fields.get(name);
  }

  public Struct with(String name, Object value) {
    final var copy = new TreeMap<>(fields);
    copy.put(name, value);
    return new Struct(copy);
  }

  public Map<String, Object> asMap() {
    return fields;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Struct) o;
    return fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return Struct.class.getSimpleName() + fields;
  }
}
