package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;

/**
 *  Draws values from an arbitrary outside of a run, for inspecting what it produces.
 */
public final class Sampler {
  public static class Options {
    public int count = 100;
    public int initialSize = 0;
    public int delta = 2;
    public Long seed;

    void validate() {
      Assert.that(count >= 0, () -> "Count cannot be negative");
      Assert.that(initialSize >= 0, () -> "Initial size cannot be negative");
      Assert.that(delta >= 0, () -> "Size delta cannot be negative");
    }
  }

  private Sampler() {}

  public static <T> List<T> sample(Arbitrary<T> arbitrary) {
    return sample(arbitrary, new Options());
  }

  public static <T> List<T> sample(Arbitrary<T> arbitrary, Options options) {
    options.validate();
    final var random = new XorShift(options.seed != null ? options.seed : XorShift.seedOfNow());
    final var values = new ArrayList<T>(options.count);
    for (int i = 0, size = options.initialSize; i < options.count; i++, size += options.delta) {
      values.add(arbitrary.generate(random, size));
    }
    return values;
  }
}
