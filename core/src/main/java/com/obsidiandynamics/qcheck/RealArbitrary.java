package com.obsidiandynamics.qcheck;

import java.util.stream.*;

/**
 *  Generates a pseudo-rational: a truncated numerator scaled by the size over a truncated
 *  positive denominator.
 */
final class RealArbitrary implements Arbitrary<Double> {
  static final RealArbitrary INSTANCE = new RealArbitrary();

  static final double PRECISION = 9_999_999_999_999d;

  private RealArbitrary() {}

  @Override
  public Double generate(XorShift random, int size) {
    final var numerator = truncate(random.range(-size * PRECISION, size * PRECISION));
    final var denominator = truncate(random.range(1, PRECISION));
    return numerator / denominator;
  }

  @Override
  public Stream<Double> shrink(Double value) {
    final Stream<Double> negated = value < 0 ? Stream.of(-value) : Stream.empty();
    return Stream.concat(negated, shrinkWhole(truncate(value)));
  }

  private static Stream<Double> shrinkWhole(double n) {
    if (n == 0) return Stream.empty();

    return Stream.of(n - Math.signum(n), truncate(n / 2), 0d);
  }

  static double truncate(double value) {
    return value < 0 ? Math.ceil(value) : Math.floor(value);
  }

  @Override
  public String toString() {
    return RealArbitrary.class.getSimpleName();
  }
}
