package com.obsidiandynamics.qcheck;

import java.util.function.*;
import java.util.stream.*;

/**
 *  Restricts an arbitrary to values satisfying a predicate. Generation redraws until the
 *  predicate holds and does not give up, so a predicate that never holds will not return.
 */
final class FilterArbitrary<T> implements Arbitrary<T> {
  private final Arbitrary<T> arbitrary;

  private final Predicate<? super T> predicate;

  FilterArbitrary(Arbitrary<T> arbitrary, Predicate<? super T> predicate) {
    this.arbitrary = arbitrary;
    this.predicate = predicate;
  }

  @Override
  public T generate(XorShift random, int size) {
    while (true) {
      final var value = arbitrary.generate(random, size);
      if (predicate.test(value)) {
        return value;
      }
    }
  }

  @Override
  public Stream<T> shrink(T value) {
    return arbitrary.shrink(value).filter(predicate);
  }

  @Override
  public String toString() {
    return FilterArbitrary.class.getSimpleName() + "[arbitrary=" + arbitrary + ']';
  }
}
