package com.obsidiandynamics.qcheck;

import java.util.*;
import java.util.stream.*;

/**
 *  Draws every field independently, in ascending order of field name so that a given seed
 *  always yields the same struct. Shrinking varies one field at a time.
 */
final class StructArbitrary implements Arbitrary<Struct> {
  private final SortedMap<String, Arbitrary<?>> fields;

  StructArbitrary(Map<String, ? extends Arbitrary<?>> fields) {
    this.fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields));
  }

  @Override
  public Struct generate(XorShift random, int size) {
    final var values = new TreeMap<String, Object>();
    for (var field : fields.entrySet()) {
      values.put(field.getKey(), field.getValue().generate(random, size));
    }
    return Struct.of(values);
  }

  @Override
  public Stream<Struct> shrink(Struct struct) {
    return fields.entrySet().stream().flatMap(field -> {
      final var name = field.getKey();
      final Arbitrary<Object> arbitrary = Arbitraries.erase(field.getValue());
      return arbitrary.shrink(struct.get(name)).map(value -> struct.with(name, value));
    });
  }

  @Override
  public String toString() {
    return StructArbitrary.class.getSimpleName() + "[fields=" + fields.keySet() + ']';
  }
}
