package com.obsidiandynamics.qcheck.util;

import java.util.function.*;

public final class Assert {
  private Assert() {}

  public static void that(boolean condition) {
    that(condition, () -> "");
  }

  public static Supplier<String> withMessage(String message) {
    return () -> message;
  }

  public static void that(boolean condition, Supplier<String> messageBuilder) {
    that(condition, AssertionError::new, messageBuilder);
  }

  public static void argument(boolean condition, Supplier<String> messageBuilder) {
    that(condition, IllegalArgumentException::new, messageBuilder);
  }

  public static void state(boolean condition, Supplier<String> messageBuilder) {
    that(condition, IllegalStateException::new, messageBuilder);
  }

  public static <X extends Throwable> void that(boolean condition, Function<String, X> errorMaker, Supplier<String> messageBuilder) throws X {
    if (! condition) {
      throw errorMaker.apply(messageBuilder.get());
    }
  }
}
