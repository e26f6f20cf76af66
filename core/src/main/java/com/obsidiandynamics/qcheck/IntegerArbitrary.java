package com.obsidiandynamics.qcheck;

import java.util.stream.*;

final class IntegerArbitrary implements Arbitrary<Integer> {
  static final IntegerArbitrary INSTANCE = new IntegerArbitrary();

  private IntegerArbitrary() {}

  @Override
  public Integer generate(XorShift random, int size) {
    return (int) random.range(-size, size);
  }

  @Override
  public Stream<Integer> shrink(Integer value) {
    return shrinkInteger(value);
  }

  static Stream<Integer> shrinkInteger(int n) {
    if (n == 0) return Stream.empty();

    return Stream.of(n - Integer.signum(n), n / 2, 0);
  }

  @Override
  public String toString() {
    return IntegerArbitrary.class.getSimpleName();
  }
}
