package com.obsidiandynamics.qcheck;

import java.io.*;
import java.util.function.*;

public final class Reporters {
  private Reporters() {}

  private static final Reporter SILENT = fromFunction(__ -> {});

  private static final Reporter THROW_ON_FAILURE = new Reporter() {
    @Override
    public void onTrial(int index, String value) {}

    @Override
    public void onShrink(int shrinkCount, String maxFail, String candidate) {}

    @Override
    public void onFinish(TestResult<?> result) {
      if (! result.isSuccess()) {
        throw new TestFailureError(result);
      }
    }

    @Override
    public String toString() {
      return "throwOnFailure";
    }
  };

  /**
   *  Writes every trial, shrink step and the final summary through {@code log}, one line
   *  per call.
   */
  public static Reporter fromFunction(Consumer<String> log) {
    return new Reporter() {
      @Override
      public void onTrial(int index, String value) {
        log.accept(index + ": " + value);
      }

      @Override
      public void onShrink(int shrinkCount, String maxFail, String candidate) {
        log.accept("shrink[" + shrinkCount + "]: " + maxFail + " => " + candidate);
      }

      @Override
      public void onFinish(TestResult<?> result) {
        describe(result, log);
      }
    };
  }

  public static Reporter printing(PrintStream out) {
    return fromFunction(line -> out.format("%s%n", line));
  }

  public static Reporter console() {
    return printing(System.out);
  }

  public static Reporter silent() {
    return SILENT;
  }

  /**
   *  Stays quiet while the run progresses and throws a {@link TestFailureError} if it
   *  fails. This is the default reporter.
   */
  public static Reporter throwOnFailure() {
    return THROW_ON_FAILURE;
  }

  static <T> void describe(TestResult<T> result, Consumer<String> log) {
    if (result.isSuccess()) {
      log.accept("Ok passed " + result.getTestCount() + " tests.");
      return;
    }

    final var show = result.getShow();
    log.accept(String.format("Falsifiable, after %d tests (%d shrink) (seed: %d):",
                             result.getTestCount(), result.getShrinkCount(), result.getSeed()));
    log.accept("Original: " + show.stringify(result.getOriginalFail()));
    log.accept("Shrunk: " + show.stringify(result.getMinFail()));
    if (result.getKind() == TestResult.Kind.EXCEPTION) {
      log.accept("with exception: " + result.getError());
    }
  }
}
