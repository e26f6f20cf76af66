package com.obsidiandynamics.qcheck;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

final class XorShiftTest {
  @Test
  void testNextUInt32_referenceSequence() {
    final var random = new XorShift(88675123);
    final var actual = new long[20];
    for (var i = 0; i < actual.length; i++) {
      actual[i] = random.nextUInt32();
    }
    assertThat(actual).containsExactly(
        3701687786L, 458299110L, 2500872618L, 3633119408L, 516391518L,
        2377269574L, 2599949379L, 717229868L, 137866584L, 395339113L,
        1301295572L, 1728310821L, 3538670320L, 1187274473L, 2316753268L,
        4061953237L, 2129415220L, 448488982L, 643481932L, 934407046L);
  }

  @Test
  void testSameSeedSameSequence() {
    final var first = new XorShift(1873066016);
    final var second = new XorShift(1873066016);
    for (var i = 0; i < 1_000; i++) {
      assertThat(first.nextUInt32()).isEqualTo(second.nextUInt32());
    }
  }

  @Test
  void testSeedUsesLow32Bits() {
    final var narrow = new XorShift(88675123);
    final var wide = new XorShift(88675123L | 1L << 40);
    assertThat(wide.nextUInt32()).isEqualTo(narrow.nextUInt32());
  }

  @Test
  void testNextUnit() {
    assertThat(new XorShift(88675123).nextUnit()).isEqualTo(3701687786L / 0x1p32);

    final var random = new XorShift(5);
    for (var i = 0; i < 1_000; i++) {
      assertThat(random.nextUnit()).isGreaterThanOrEqualTo(0).isLessThan(1);
    }
  }

  @Test
  void testRange() {
    final var random = new XorShift(11);
    for (var i = 0; i < 1_000; i++) {
      assertThat(random.range(-3, 7)).isGreaterThanOrEqualTo(-3).isLessThan(7);
    }
  }

  @Test
  void testRange_equalBounds() {
    assertThat(new XorShift(11).range(5, 5)).isEqualTo(5);
  }

  @Test
  void testRange_invertedBounds() {
    assertThat(catchThrowable(() -> new XorShift(11).range(7, -3)))
        .isExactlyInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("min");
  }

  @Test
  void testSeedOfNow() {
    assertThat(XorShift.seedOfNow()).isBetween(0L, 0xFFFF_FFFFL);
  }

  @Test
  void testToString() {
    final var toString = new XorShift(42).toString();
    assertThat(toString).contains(XorShift.class.getSimpleName());
    assertThat(toString).contains("w=42");
  }
}
