package com.obsidiandynamics.qcheck;

import java.util.*;
import java.util.function.*;

/**
 *  One alternative of a sum: an arbitrary together with a predicate recognizing the values
 *  that belong to it. The recognizers of a sum's branches must partition its value space.
 *
 *  @param <T> The value type common to all branches of the sum.
 */
public final class Branch<T> {
  private final Arbitrary<? extends T> arbitrary;

  private final Predicate<? super T> recognizer;

  private Branch(Arbitrary<? extends T> arbitrary, Predicate<? super T> recognizer) {
    this.arbitrary = arbitrary;
    this.recognizer = recognizer;
  }

  public static <T> Branch<T> of(Arbitrary<? extends T> arbitrary, Predicate<? super T> recognizer) {
    return new Branch<>(arbitrary, recognizer);
  }

  /**
   *  A branch that always yields {@code value} and recognizes values equal to it.
   */
  public static <T> Branch<T> constant(T value) {
    return new Branch<>(Arbitraries.constant(value), other -> Objects.equals(value, other));
  }

  public Arbitrary<? extends T> getArbitrary() {
    return arbitrary;
  }

  public boolean recognizes(T value) {
    return recognizer.test(value);
  }

  @Override
  public String toString() {
    return Branch.class.getSimpleName() + "[arbitrary=" + arbitrary + ']';
  }
}
