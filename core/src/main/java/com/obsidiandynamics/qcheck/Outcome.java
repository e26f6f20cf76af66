package com.obsidiandynamics.qcheck;

import java.util.*;

/**
 *  The result of evaluating a property against one value.
 */
public final class Outcome {
  public enum Kind {
    SUCCESS,
    FAILURE,
    EXCEPTION
  }

  private final Kind kind;

  private final String value;

  private final Set<String> labels;

  private final Throwable error;

  private Outcome(Kind kind, String value, Set<String> labels, Throwable error) {
    this.kind = kind;
    this.value = value;
    this.labels = labels != null ? Set.copyOf(labels) : Set.of();
    this.error = error;
  }

  public static Outcome success(String value) {
    return success(value, Set.of());
  }

  public static Outcome success(String value, Set<String> labels) {
    return new Outcome(Kind.SUCCESS, value, labels, null);
  }

  public static Outcome failure(String value) {
    return failure(value, Set.of());
  }

  public static Outcome failure(String value, Set<String> labels) {
    return new Outcome(Kind.FAILURE, value, labels, null);
  }

  public static Outcome exception(Throwable error, String value) {
    return exception(error, value, Set.of());
  }

  public static Outcome exception(Throwable error, String value, Set<String> labels) {
    return new Outcome(Kind.EXCEPTION, value, labels, error);
  }

  static <T> Outcome evaluate(Property<? super T> property, Show<T> show, T value) {
    final Object result;
    try {
      result = property.test(value);
    } catch (Throwable e) {
      return exception(e, show.stringify(value));
    }

    if (result instanceof Outcome) {
      return (Outcome) result;
    } else if (Boolean.FALSE.equals(result)) {
      return failure(show.stringify(value));
    } else {
      return success(show.stringify(value));
    }
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCESS;
  }

  public String getValue() {
    return value;
  }

  public Set<String> getLabels() {
    return labels;
  }

  public Throwable getError() {
    return error;
  }

  @Override
  public String toString() {
    return Outcome.class.getSimpleName() + "[kind=" + kind + ", value=" + value + ", labels=" + labels +
        ", error=" + error + ']';
  }
}
