package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;
import java.util.stream.*;

/**
 *  A union whose values are plain {@code T}s rather than {@link Variant}s. The branch of a
 *  value being shrunk is recovered from the branch recognizers, which must match exactly
 *  once.
 */
final class SumArbitrary<T> implements Arbitrary<T> {
  private final List<Branch<T>> branches;

  private final UnionArbitrary<T> union;

  SumArbitrary(List<Branch<T>> branches) {
    Assert.argument(! branches.isEmpty(), () -> "At least one branch is required");
    this.branches = List.copyOf(branches);
    final var arbitraries = new ArrayList<Arbitrary<? extends T>>(branches.size());
    for (var branch : branches) {
      arbitraries.add(branch.getArbitrary());
    }
    union = new UnionArbitrary<>(arbitraries);
  }

  @Override
  public T generate(XorShift random, int size) {
    return union.generate(random, size).getValue();
  }

  @Override
  public Stream<T> shrink(T value) {
    return union.shrink(Variant.of(classify(value), value)).map(Variant::getValue);
  }

  int classify(T value) {
    var tag = -1;
    for (var i = 0; i < branches.size(); i++) {
      if (branches.get(i).recognizes(value)) {
        final var firstTag = tag;
        final var secondTag = i;
        Assert.argument(firstTag == -1, () -> String.format("Value %s is recognized by branches %d and %d", value, firstTag, secondTag));
        tag = i;
      }
    }
    Assert.argument(tag != -1, () -> String.format("Value %s is not recognized by any branch", value));
    return tag;
  }

  @Override
  public String toString() {
    return SumArbitrary.class.getSimpleName() + "[branches=" + branches + ']';
  }
}
