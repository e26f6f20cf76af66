package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;
import java.util.stream.*;

final class TupleArbitrary implements Arbitrary<Tuple> {
  private final List<Arbitrary<?>> arbitraries;

  TupleArbitrary(List<? extends Arbitrary<?>> arbitraries) {
    Assert.argument(! arbitraries.isEmpty(), () -> "At least one position is required");
    this.arbitraries = List.copyOf(arbitraries);
  }

  @Override
  public Tuple generate(XorShift random, int size) {
    final var values = new Object[arbitraries.size()];
    for (var i = 0; i < values.length; i++) {
      values[i] = arbitraries.get(i).generate(random, size);
    }
    return Tuple.of(values);
  }

  @Override
  public Stream<Tuple> shrink(Tuple tuple) {
    if (tuple.arity() != arbitraries.size()) return Stream.empty();

    return IntStream.range(0, arbitraries.size()).boxed().flatMap(index -> {
      final Arbitrary<Object> arbitrary = Arbitraries.erase(arbitraries.get(index));
      return arbitrary.shrink(tuple.get(index)).map(value -> tuple.with(index, value));
    });
  }

  @Override
  public String toString() {
    return TupleArbitrary.class.getSimpleName() + "[arity=" + arbitraries.size() + ']';
  }
}
