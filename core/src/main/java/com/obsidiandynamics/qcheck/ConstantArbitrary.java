package com.obsidiandynamics.qcheck;

import java.util.stream.*;

final class ConstantArbitrary<T> implements Arbitrary<T> {
  private final T value;

  ConstantArbitrary(T value) {
    this.value = value;
  }

  @Override
  public T generate(XorShift random, int size) {
    return value;
  }

  @Override
  public Stream<T> shrink(T value) {
    return Stream.empty();
  }

  @Override
  public String toString() {
    return ConstantArbitrary.class.getSimpleName() + "[value=" + value + ']';
  }
}
