package com.obsidiandynamics.qcheck;

import java.util.*;

/**
 *  An immutable, fixed-arity sequence of values of arbitrary types. Elements may be
 *  {@code null}.
 */
public final class Tuple {
  private final List<Object> values;

  private Tuple(List<Object> values) {
    this.values = Collections.unmodifiableList(values);
  }

  public static Tuple of(Object... values) {
    return new Tuple(new ArrayList<>(Arrays.asList(values)));
  }

  public int arity() {
    return values.size();
  }

  @SuppressWarnings("unchecked")
  public <V> V get(int index) {
    return (V) values.get(index);
  }

  public Tuple with(int index, Object value) {
    final var copy = new ArrayList<>(values);
    copy.set(index, value);
    return new Tuple(copy);
  }

  public List<Object> asList() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Tuple) o;
    return values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return Tuple.class.getSimpleName() + values;
  }
}
