package com.obsidiandynamics.qcheck;

import java.util.*;
import java.util.function.*;
import java.util.stream.*;

/**
 *  Generates values of type {@code T} and proposes simpler alternatives to a given value.<p>
 *
 *  Implementations are immutable and free of side effects, so one instance may be shared
 *  across any number of runs.
 *
 *  @param <T> The value type.
 */
public interface Arbitrary<T> {
  /**
   *  Draws a value.
   *
   *  @param random The source of randomness.
   *  @param size A hint biasing the magnitude or length of the value.
   *  @return The generated value.
   */
  T generate(XorShift random, int size);

  /**
   *  Lists candidates simpler than {@code value}, simplest-first. The stream is finite,
   *  deterministic, never contains {@code value} itself and consumes no randomness.
   *
   *  @param value The value to shrink.
   *  @return The shrink candidates.
   */
  Stream<T> shrink(T value);

  default <U> Arbitrary<U> map(Function<? super T, ? extends U> convertTo, Function<? super U, ? extends T> convertFrom) {
    return Arbitraries.map(this, convertTo, convertFrom);
  }

  default Arbitrary<T> filter(Predicate<? super T> predicate) {
    return Arbitraries.filter(this, predicate);
  }

  default Arbitrary<List<T>> array() {
    return Arbitraries.array(this, 0);
  }

  default Arbitrary<List<T>> array(int minLength) {
    return Arbitraries.array(this, minLength);
  }

  default Arbitrary<T> nullable() {
    return Arbitraries.nullable(this);
  }

  default Arbitrary<Optional<T>> optional() {
    return Arbitraries.optional(this);
  }
}
