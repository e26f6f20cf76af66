package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

/**
 *  Runs a property against generated values and, on the first failure, shrinks the
 *  failing value to a locally minimal counterexample.
 */
public final class Checker {
  public static class Options {
    /** The seed of the run, or {@code null} to derive one from the clock at the start of the run. */
    public Long seed;
    public int maxTrials = 100;
    public int startSize = 1;
    public int endSize = 100;
    public Reporter reporter = Reporters.throwOnFailure();

    void validate() {
      Assert.that(maxTrials > 0, () -> "Number of trials must exceed 0");
      Assert.that(reporter != null, () -> "Reporter cannot be null");
    }

    @Override
    public String toString() {
      return Options.class.getSimpleName() + "[seed=" + seed + ", maxTrials=" + maxTrials + ", startSize=" + startSize +
          ", endSize=" + endSize + ", reporter=" + reporter + ']';
    }
  }

  private Checker() {}

  public static <T> TestResult<T> check(Arbitrary<T> arbitrary, Property<? super T> property) {
    return check(arbitrary, property, new Options());
  }

  public static <T> TestResult<T> check(Arbitrary<T> arbitrary, Property<? super T> property, Options options) {
    return check(arbitrary, Show.any(), property, options);
  }

  public static <T> TestResult<T> check(Arbitrary<T> arbitrary, Show<T> show, Property<? super T> property, Options options) {
    options.validate();
    final var seed = options.seed != null ? options.seed : XorShift.seedOfNow();
    final var maxTrials = options.maxTrials;
    final var reporter = options.reporter;
    final var minSize = Math.max(1, options.startSize);
    final var maxSize = Math.max(options.endSize, minSize);
    final var random = new XorShift(seed);

    for (var index = 0; index < maxTrials; index++) {
      final var size = currentSize(minSize, maxSize, maxTrials, index);
      final var value = arbitrary.generate(random, size);
      reporter.onTrial(index, show.stringify(value));
      final var outcome = Outcome.evaluate(property, show, value);
      if (outcome.isSuccess()) continue;

      final var result = new ShrinkSearch<>(arbitrary, show, property, reporter).search(seed, index + 1, value, outcome);
      reporter.onFinish(result);
      return result;
    }

    final var result = TestResult.success(show, seed, maxTrials);
    reporter.onFinish(result);
    return result;
  }

  static int currentSize(int minSize, int maxSize, int maxTrials, int index) {
    return (int) (minSize + (maxSize - minSize) * ((index + 1) / (double) maxTrials));
  }
}
