package com.obsidiandynamics.qcheck;

import org.junit.jupiter.api.*;
import org.mockito.*;

import java.util.*;
import java.util.stream.*;

import static com.obsidiandynamics.qcheck.PrimitiveArbitrariesTest.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

final class SumArbitraryTest {
  private interface IntArbitrary extends Arbitrary<Integer> {}

  @Nested
  final class UnionTests {
    @Test
    void testGenerateTagsBranch() {
      final Arbitrary<Variant<Object>> arbitrary = Arbitraries.union(Arbitraries.int32(), Arbitraries.string());
      final var variants = Sampler.sample(arbitrary, seeded(73, 200, 1));
      assertThat(variants).extracting(Variant::getTag).containsOnly(0, 1).contains(0, 1);
      for (var variant : variants) {
        if (variant.getTag() == 0) {
          assertThat(variant.getValue()).isInstanceOf(Integer.class);
        } else {
          assertThat(variant.getValue()).isInstanceOf(String.class);
        }
      }
    }

    @Test
    void testShrinkKeepsTag() {
      final Arbitrary<Variant<Object>> arbitrary = Arbitraries.union(Arbitraries.int32(), Arbitraries.string());
      assertThat(arbitrary.shrink(Variant.of(0, 3))).containsExactly(Variant.of(0, 2), Variant.of(0, 1), Variant.of(0, 0));
      assertThat(arbitrary.shrink(Variant.of(1, "ab"))).containsExactly(Variant.of(1, "a"), Variant.of(1, ""));
    }

    @Test
    void testShrinkUnknownTag() {
      final Arbitrary<Variant<Object>> arbitrary = Arbitraries.union(Arbitraries.int32(), Arbitraries.string());
      assertThat(catchThrowable(() -> arbitrary.shrink(Variant.of(2, 3)))).isExactlyInstanceOf(IllegalArgumentException.class);
      assertThat(catchThrowable(() -> arbitrary.shrink(Variant.of(-1, 3)))).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testShrinkDelegatesToTaggedBranchOnly() {
      final var first = Mockito.mock(IntArbitrary.class);
      final var second = Mockito.mock(IntArbitrary.class);
      when(second.shrink(5)).thenReturn(Stream.of(4));
      final Arbitrary<Variant<Integer>> arbitrary = Arbitraries.union(first, second);

      assertThat(arbitrary.shrink(Variant.of(1, 5))).containsExactly(Variant.of(1, 4));
      verify(second).shrink(5);
      verify(first, never()).shrink(any());
    }
  }

  @Nested
  final class SumTests {
    @Test
    void testConstants() {
      final Arbitrary<Object> arbitrary = Arbitraries.sum(Branch.constant("a"), Branch.constant(42));
      assertThat(Sampler.sample(arbitrary, seeded(79, 100, 1))).containsOnly("a", 42).contains("a", 42);
      assertThat(arbitrary.shrink("a")).isEmpty();
      assertThat(arbitrary.shrink(42)).isEmpty();
    }

    @Test
    void testShrinkDelegatesToRecognizingBranchOnly() {
      final var negative = Mockito.mock(IntArbitrary.class);
      final var nonNegative = Mockito.mock(IntArbitrary.class);
      when(nonNegative.shrink(5)).thenReturn(Stream.of(4, 2));
      final var arbitrary = Arbitraries.sum(Branch.<Integer>of(negative, v -> v < 0),
                                            Branch.<Integer>of(nonNegative, v -> v >= 0));

      assertThat(arbitrary.shrink(5)).containsExactly(4, 2);
      verify(negative, never()).shrink(any());
    }

    @Test
    void testOverlappingBranches() {
      final var arbitrary = Arbitraries.sum(Branch.<Integer>of(Arbitraries.int32(), v -> v >= 0),
                                            Branch.<Integer>of(Arbitraries.int32(), v -> v <= 0));
      assertThat(catchThrowable(() -> arbitrary.shrink(0)))
          .isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("branches 0 and 1");
      assertThat(arbitrary.shrink(3)).containsExactly(2, 1, 0);
    }

    @Test
    void testUnrecognizedValue() {
      final var arbitrary = Arbitraries.sum(Branch.<Integer>of(Arbitraries.int32(), v -> v > 0),
                                            Branch.<Integer>of(Arbitraries.int32(), v -> v < 0));
      assertThat(catchThrowable(() -> arbitrary.shrink(0)))
          .isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("not recognized");
    }
  }

  @Nested
  final class NullableTests {
    @Test
    void testGenerate() {
      final var values = Sampler.sample(Arbitraries.int32().nullable(), seeded(83, 100, 1));
      assertThat(values).containsNull();
      assertThat(values.stream().filter(Objects::nonNull).count()).isGreaterThan(0);
    }

    @Test
    void testShrink() {
      final var arbitrary = Arbitraries.nullable(Arbitraries.int32());
      assertThat(arbitrary.shrink(null)).isEmpty();
      assertThat(arbitrary.shrink(5)).containsExactly(4, 2, 0);
    }

    @Test
    void testNullArbitrary() {
      assertThat(catchThrowable(() -> Arbitraries.nullable(null))).isExactlyInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  final class OptionalTests {
    @Test
    void testGenerate() {
      final var values = Sampler.sample(Arbitraries.int32().optional(), seeded(89, 100, 1));
      assertThat(values).contains(Optional.empty());
      assertThat(values).anyMatch(Optional::isPresent);
    }

    @Test
    void testShrink() {
      final var arbitrary = Arbitraries.optional(Arbitraries.int32());
      assertThat(arbitrary.shrink(Optional.of(3))).containsExactly(Optional.of(2), Optional.of(1), Optional.of(0));
      assertThat(arbitrary.shrink(Optional.empty())).isEmpty();
    }
  }
}
