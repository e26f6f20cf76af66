package com.obsidiandynamics.qcheck;

import java.util.function.*;
import java.util.stream.*;

/**
 *  Transforms the values of an underlying arbitrary. {@code convertFrom} must undo
 *  {@code convertTo} on every generated value so that shrinking can resume in the
 *  underlying domain.
 */
final class MapArbitrary<T, U> implements Arbitrary<U> {
  private final Arbitrary<T> arbitrary;

  private final Function<? super T, ? extends U> convertTo;

  private final Function<? super U, ? extends T> convertFrom;

  MapArbitrary(Arbitrary<T> arbitrary, Function<? super T, ? extends U> convertTo, Function<? super U, ? extends T> convertFrom) {
    this.arbitrary = arbitrary;
    this.convertTo = convertTo;
    this.convertFrom = convertFrom;
  }

  @Override
  public U generate(XorShift random, int size) {
    return convertTo.apply(arbitrary.generate(random, size));
  }

  @Override
  public Stream<U> shrink(U value) {
    return arbitrary.shrink(convertFrom.apply(value)).map(convertTo);
  }

  @Override
  public String toString() {
    return MapArbitrary.class.getSimpleName() + "[arbitrary=" + arbitrary + ']';
  }
}
