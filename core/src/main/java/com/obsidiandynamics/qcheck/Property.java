package com.obsidiandynamics.qcheck;

/**
 *  The property under test.<p>
 *
 *  An {@link Outcome} return value is taken as is; {@link Boolean#FALSE} is a failure and
 *  any other return value, {@code null} included, is a success. Anything thrown, errors
 *  included, is a failure that carries the throwable.
 *
 *  @param <T> The value type.
 */
@FunctionalInterface
public interface Property<T> {
  Object test(T value) throws Exception;

  @FunctionalInterface
  interface Assertion<T> {
    void verify(T value) throws Exception;
  }

  /**
   *  Adapts a block that signals failure only by throwing.
   */
  static <T> Property<T> asserting(Assertion<? super T> assertion) {
    return value -> {
      assertion.verify(value);
      return null;
    };
  }
}
