package com.obsidiandynamics.qcheck;

import org.junit.jupiter.api.*;

import static com.obsidiandynamics.qcheck.PrimitiveArbitrariesTest.*;
import static org.assertj.core.api.Assertions.*;

final class ForwardTest {
  /**
   *  Trees whose leaves are integers or strings, and whose nodes are pairs of subtrees.
   */
  private static Forward<Object> tree() {
    final Forward<Object> tree = Arbitraries.forward();
    return tree.define(Arbitraries.sum(Branch.<Object>of(Arbitraries.int32(), Integer.class::isInstance),
                                       Branch.<Object>of(Arbitraries.string(), String.class::isInstance),
                                       Branch.<Object>of(Arbitraries.tuple(tree, tree), Tuple.class::isInstance)));
  }

  private static int depth(Object tree) {
    if (tree instanceof Tuple) {
      final var node = (Tuple) tree;
      return 1 + Math.max(depth(node.get(0)), depth(node.get(1)));
    } else {
      return 0;
    }
  }

  @Test
  void testRecursiveGenerate() {
    final var trees = Sampler.sample(tree(), seeded(107, 100, 1));
    assertThat(trees).allMatch(t -> t instanceof Integer || t instanceof String || t instanceof Tuple);
    assertThat(trees).anyMatch(t -> depth(t) >= 2);
  }

  @Test
  void testRecursiveShrink() {
    final var tree = tree();
    final var value = Tuple.of(Tuple.of(2, "a"), 1);
    assertThat(tree.shrink(value)).containsExactly(
        Tuple.of(Tuple.of(1, "a"), 1),
        Tuple.of(Tuple.of(1, "a"), 1),
        Tuple.of(Tuple.of(0, "a"), 1),
        Tuple.of(Tuple.of(2, ""), 1),
        Tuple.of(Tuple.of(2, "a"), 0),
        Tuple.of(Tuple.of(2, "a"), 0),
        Tuple.of(Tuple.of(2, "a"), 0));
  }

  @Test
  void testUseBeforeDefine() {
    final Forward<Integer> forward = Arbitraries.forward();
    assertThat(forward.isDefined()).isFalse();
    assertThat(catchThrowable(() -> forward.generate(new XorShift(1), 1)))
        .isExactlyInstanceOf(IllegalStateException.class).hasMessage("Definition not assigned");
    assertThat(catchThrowable(() -> forward.shrink(1)))
        .isExactlyInstanceOf(IllegalStateException.class).hasMessage("Definition not assigned");
  }

  @Test
  void testDefineTwice() {
    final Forward<Integer> forward = Arbitraries.forward();
    forward.define(Arbitraries.int32());
    assertThat(forward.isDefined()).isTrue();
    assertThat(catchThrowable(() -> forward.define(Arbitraries.constant(0))))
        .isExactlyInstanceOf(IllegalStateException.class).hasMessage("Definition already assigned");
    assertThat(forward.shrink(3)).containsExactly(2, 1, 0);
  }

  @Test
  void testDefineNull() {
    final Forward<Integer> forward = Arbitraries.forward();
    assertThat(catchThrowable(() -> forward.define(null))).isExactlyInstanceOf(IllegalArgumentException.class);
    assertThat(forward.isDefined()).isFalse();
  }

  @Test
  void testToString() {
    final Forward<Integer> forward = Arbitraries.forward();
    assertThat(forward.toString()).contains("defined=false");
  }
}
