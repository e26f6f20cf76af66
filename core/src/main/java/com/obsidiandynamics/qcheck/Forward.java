package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.stream.*;

/**
 *  A placeholder for an arbitrary that is defined later, allowing recursive definitions
 *  such as trees. The definition may be assigned once, and must be assigned before the
 *  placeholder is used.
 *
 *  @param <T> The value type.
 */
public final class Forward<T> implements Arbitrary<T> {
  private Arbitrary<T> definition;

  Forward() {}

  public Forward<T> define(Arbitrary<T> definition) {
    Assert.argument(definition != null, () -> "Definition cannot be null");
    Assert.state(this.definition == null, () -> "Definition already assigned");
    this.definition = definition;
    return this;
  }

  public boolean isDefined() {
    return definition != null;
  }

  private Arbitrary<T> resolve() {
    Assert.state(definition != null, () -> "Definition not assigned");
    return definition;
  }

  @Override
  public T generate(XorShift random, int size) {
    return resolve().generate(random, size);
  }

  @Override
  public Stream<T> shrink(T value) {
    return resolve().shrink(value);
  }

  @Override
  public String toString() {
    return Forward.class.getSimpleName() + "[defined=" + isDefined() + ']';
  }
}
