package com.obsidiandynamics.qcheck;

import java.util.*;

/**
 *  A value tagged with the index of the union branch that produced it.
 *
 *  @param <T> The value type common to all branches.
 */
public final class Variant<T> {
  private final int tag;

  private final T value;

  public Variant(int tag, T value) {
    this.tag = tag;
    this.value = value;
  }

  public static <T> Variant<T> of(int tag, T value) {
    return new Variant<>(tag, value);
  }

  public int getTag() {
    return tag;
  }

  public T getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final var that = (Variant<?>) o;
    if (tag != that.tag) return false;
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * tag + Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return Variant.class.getSimpleName() + "[tag=" + tag + ", value=" + value + ']';
  }
}
