package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;
import java.util.stream.*;

/**
 *  Picks uniformly from a fixed list; shrinks toward the first-listed element.
 */
final class ElementsArbitrary<T> implements Arbitrary<T> {
  private final List<T> values;

  ElementsArbitrary(List<T> values) {
    Assert.argument(! values.isEmpty(), () -> "At least one element is required");
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  @Override
  public T generate(XorShift random, int size) {
    return values.get((int) (random.nextUnit() * values.size()));
  }

  @Override
  public Stream<T> shrink(T value) {
    final var index = values.indexOf(value);
    return IntStream.iterate(index - 1, i -> i >= 0, i -> i - 1).mapToObj(values::get);
  }

  @Override
  public String toString() {
    return ElementsArbitrary.class.getSimpleName() + "[values=" + values + ']';
  }
}
