package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

import java.util.*;
import java.util.function.*;

/**
 *  Factories for the built-in arbitraries and combinators.
 */
public final class Arbitraries {
  private Arbitraries() {}

  public static <T> Arbitrary<T> constant(T value) {
    return new ConstantArbitrary<>(value);
  }

  /**
   *  Picks one of the given values uniformly. Shrinks toward values listed earlier.
   */
  @SafeVarargs
  public static <T> Arbitrary<T> elements(T first, T... rest) {
    final var values = new ArrayList<T>(rest.length + 1);
    values.add(first);
    values.addAll(Arrays.asList(rest));
    return new ElementsArbitrary<>(values);
  }

  /**
   *  Integers in (-size, size), shrinking toward zero.
   */
  public static Arbitrary<Integer> int32() {
    return IntegerArbitrary.INSTANCE;
  }

  public static Arbitrary<Double> real() {
    return RealArbitrary.INSTANCE;
  }

  /**
   *  Code points from the ASCII and Latin-1 ranges.
   */
  public static Arbitrary<Integer> codePoint() {
    return CodePointArbitrary.INSTANCE;
  }

  public static Arbitrary<String> string() {
    return StringArbitrary.INSTANCE;
  }

  public static <T, U> Arbitrary<U> map(Arbitrary<T> arbitrary,
                                        Function<? super T, ? extends U> convertTo,
                                        Function<? super U, ? extends T> convertFrom) {
    return new MapArbitrary<>(arbitrary, convertTo, convertFrom);
  }

  public static <T> Arbitrary<T> filter(Arbitrary<T> arbitrary, Predicate<? super T> predicate) {
    return new FilterArbitrary<>(arbitrary, predicate);
  }

  public static <T> Arbitrary<List<T>> array(Arbitrary<T> element) {
    return array(element, 0);
  }

  public static <T> Arbitrary<List<T>> array(Arbitrary<T> element, int minLength) {
    return new ArrayArbitrary<>(element, minLength);
  }

  public static Arbitrary<Struct> struct(Map<String, ? extends Arbitrary<?>> fields) {
    return new StructArbitrary(fields);
  }

  public static Arbitrary<Tuple> tuple(Arbitrary<?> first, Arbitrary<?>... rest) {
    final var arbitraries = new ArrayList<Arbitrary<?>>(rest.length + 1);
    arbitraries.add(first);
    arbitraries.addAll(Arrays.asList(rest));
    return new TupleArbitrary(arbitraries);
  }

  /**
   *  A tagged union of the given arbitraries.
   */
  @SafeVarargs
  public static <T> Arbitrary<Variant<T>> union(Arbitrary<? extends T> first, Arbitrary<? extends T>... rest) {
    final var branches = new ArrayList<Arbitrary<? extends T>>(rest.length + 1);
    branches.add(first);
    branches.addAll(Arrays.asList(rest));
    return new UnionArbitrary<>(branches);
  }

  /**
   *  An untagged union, where the branch of a value is identified by the branch recognizers.
   *
   *  @throws IllegalArgumentException When shrinking a value recognized by no branch or by
   *  more than one.
   */
  @SafeVarargs
  public static <T> Arbitrary<T> sum(Branch<T> first, Branch<T>... rest) {
    final var branches = new ArrayList<Branch<T>>(rest.length + 1);
    branches.add(first);
    branches.addAll(Arrays.asList(rest));
    return new SumArbitrary<>(branches);
  }

  public static <T> Arbitrary<T> nullable(Arbitrary<T> arbitrary) {
    Assert.argument(arbitrary != null, () -> "Arbitrary cannot be null");
    return sum(Branch.<T>of(constant(null), Objects::isNull),
               Branch.of(arbitrary, Objects::nonNull));
  }

  public static <T> Arbitrary<Optional<T>> optional(Arbitrary<T> arbitrary) {
    final Arbitrary<Optional<T>> present = map(arbitrary, Optional::of, Optional::get);
    return sum(Branch.<Optional<T>>of(constant(Optional.empty()), Optional::isEmpty),
               Branch.of(present, Optional::isPresent));
  }

  public static <T> Forward<T> forward() {
    return new Forward<>();
  }

  /**
   *  Recovers the value type of an arbitrary held under a wildcard, for containers whose
   *  positions or fields are typed only at the call site.
   */
  @SuppressWarnings("unchecked")
  static <T> Arbitrary<T> erase(Arbitrary<?> arbitrary) {
    return (Arbitrary<T>) arbitrary;
  }
}
