package com.obsidiandynamics.qcheck;

/**
 *  Renders values for reports. Rendering is never used to compare values.
 *
 *  @param <T> The value type.
 */
@FunctionalInterface
public interface Show<T> {
  String stringify(T value);

  static <T> Show<T> any() {
    return String::valueOf;
  }
}
