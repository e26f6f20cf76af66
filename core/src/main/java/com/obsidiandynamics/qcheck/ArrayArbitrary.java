package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;
import java.util.stream.*;

/**
 *  Generates lists of independently drawn elements, no shorter than {@code minLength}.<p>
 *
 *  Shrinking halves the length repeatedly, down to {@code minLength}. Each prefix is
 *  offered as is, followed by every variant of it with a single element replaced by one
 *  of that element's own shrinks. For example, with a minimum length of 0:
 *  <pre>
 *  [1, 2, 3, 4]
 *  =&gt; [1, 2]
 *     =&gt; [0, 2]
 *     =&gt; [1, 1]
 *     =&gt; [1, 0]
 *  =&gt; [1]
 *     =&gt; [0]
 *  =&gt; []
 *  </pre>
 */
final class ArrayArbitrary<T> implements Arbitrary<List<T>> {
  private final Arbitrary<T> element;

  private final int minLength;

  ArrayArbitrary(Arbitrary<T> element, int minLength) {
    Assert.argument(minLength >= 0, () -> "Minimum length cannot be negative: " + minLength);
    this.element = element;
    this.minLength = minLength;
  }

  @Override
  public List<T> generate(XorShift random, int size) {
    final var length = Math.max(minLength, (int) random.range(0, size));
    final var values = new ArrayList<T>(length);
    for (var i = 0; i < length; i++) {
      values.add(element.generate(random, size));
    }
    return Collections.unmodifiableList(values);
  }

  @Override
  public Stream<List<T>> shrink(List<T> values) {
    if (values.size() <= minLength) return Stream.empty();

    return prefixLengths(values.size(), minLength).boxed().flatMap(length -> {
      final var prefix = Collections.unmodifiableList(new ArrayList<>(values.subList(0, length)));
      final var replacements = IntStream.range(0, length).boxed()
          .flatMap(index -> element.shrink(prefix.get(index)).map(replacement -> replace(prefix, index, replacement)));
      return Stream.concat(Stream.of(prefix), replacements);
    });
  }

  static IntStream prefixLengths(int length, int minLength) {
    final var first = Math.max(length / 2, minLength);
    return IntStream.iterate(first, i -> i >= minLength, i -> i > 0 ? i / 2 : -1);
  }

  private static <T> List<T> replace(List<T> values, int index, T replacement) {
    final var copy = new ArrayList<>(values);
    copy.set(index, replacement);
    return Collections.unmodifiableList(copy);
  }

  @Override
  public String toString() {
    return ArrayArbitrary.class.getSimpleName() + "[element=" + element + ", minLength=" + minLength + ']';
  }
}
