package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;
import java.util.stream.*;

/**
 *  Chooses a branch uniformly and tags the generated value with the branch index, so that
 *  shrinking is always delegated back to the branch that produced the value.
 */
final class UnionArbitrary<T> implements Arbitrary<Variant<T>> {
  private final List<Arbitrary<? extends T>> branches;

  UnionArbitrary(List<? extends Arbitrary<? extends T>> branches) {
    Assert.argument(! branches.isEmpty(), () -> "At least one branch is required");
    this.branches = List.copyOf(branches);
  }

  @Override
  public Variant<T> generate(XorShift random, int size) {
    final var tag = (int) (random.nextUnit() * branches.size());
    return Variant.of(tag, branches.get(tag).generate(random, size));
  }

  @Override
  public Stream<Variant<T>> shrink(Variant<T> variant) {
    final var tag = variant.getTag();
    Assert.argument(tag >= 0 && tag < branches.size(), () -> "No branch for tag " + tag);
    final Arbitrary<T> branch = Arbitraries.erase(branches.get(tag));
    return branch.shrink(variant.getValue()).map(value -> Variant.of(tag, value));
  }

  @Override
  public String toString() {
    return UnionArbitrary.class.getSimpleName() + "[branches=" + branches + ']';
  }
}
