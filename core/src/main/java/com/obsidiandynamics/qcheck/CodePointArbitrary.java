package com.obsidiandynamics.qcheck;

import java.util.stream.*;

/**
 *  Draws from the ASCII or Latin-1 range with equal probability. Shrinks move toward
 *  lowercase letters, then uppercase, digits, other ASCII and finally non-ASCII.
 */
final class CodePointArbitrary implements Arbitrary<Integer> {
  static final CodePointArbitrary INSTANCE = new CodePointArbitrary();

  static final int MIN = 0;

  static final int ASCII_MAX = 0x7F;

  static final int LATIN1_MAX = 0xFF;

  static final int MAX = Character.MAX_CODE_POINT;

  enum Category {
    ASCII_LOWER,
    ASCII_UPPER,
    ASCII_DIGIT,
    ASCII_OTHER,
    LATIN1_NON_ASCII,
    BEYOND_LATIN1;

    static Category of(int codePoint) {
      if (codePoint <= ASCII_MAX) {
        if ('a' <= codePoint && codePoint <= 'z') return ASCII_LOWER;
        if ('A' <= codePoint && codePoint <= 'Z') return ASCII_UPPER;
        if ('0' <= codePoint && codePoint <= '9') return ASCII_DIGIT;
        return ASCII_OTHER;
      }
      return codePoint <= LATIN1_MAX ? LATIN1_NON_ASCII : BEYOND_LATIN1;
    }
  }

  private CodePointArbitrary() {}

  static boolean isSimpler(int candidate, int codePoint) {
    final var candidateCategory = Category.of(candidate);
    final var category = Category.of(codePoint);
    final var order = candidateCategory.compareTo(category);
    return order < 0 || order == 0 && candidate < codePoint;
  }

  @Override
  public Integer generate(XorShift random, int size) {
    if (random.nextUnit() < 0.5) {
      return (int) random.range(MIN, ASCII_MAX);
    } else {
      return (int) random.range(MIN, LATIN1_MAX);
    }
  }

  @Override
  public Stream<Integer> shrink(Integer value) {
    final int codePoint = Math.max(MIN, Math.min(MAX, value));
    return IntStream.of(Math.max(MIN, codePoint - 1), codePoint / 2, ' ', '\n', '0', 'a')
        .filter(candidate -> isSimpler(candidate, codePoint))
        .boxed();
  }

  @Override
  public String toString() {
    return CodePointArbitrary.class.getSimpleName();
  }
}
