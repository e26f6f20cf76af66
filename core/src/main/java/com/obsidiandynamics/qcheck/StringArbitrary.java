package com.obsidiandynamics.qcheck;

import java.util.*;
import java.util.stream.*;

final class StringArbitrary implements Arbitrary<String> {
  static final StringArbitrary INSTANCE = new StringArbitrary();

  private final ArrayArbitrary<Integer> codePoints = new ArrayArbitrary<>(CodePointArbitrary.INSTANCE, 0);

  private StringArbitrary() {}

  @Override
  public String generate(XorShift random, int size) {
    return toText(codePoints.generate(random, size));
  }

  @Override
  public Stream<String> shrink(String value) {
    final var decoded = value.codePoints().boxed().collect(Collectors.toList());
    return codePoints.shrink(decoded).map(StringArbitrary::toText);
  }

  private static String toText(List<Integer> codePoints) {
    final var array = codePoints.stream().mapToInt(Integer::intValue).toArray();
    return new String(array, 0, array.length);
  }

  @Override
  public String toString() {
    return StringArbitrary.class.getSimpleName();
  }
}
