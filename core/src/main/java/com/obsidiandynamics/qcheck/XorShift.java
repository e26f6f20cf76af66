package com.obsidiandynamics.qcheck;

import com.obsidiandynamics.qcheck.util.*;

/**
 *  Marsaglia's 128-bit xorshift generator. The output sequence is fully determined
 *  by the seed, which is what makes a failing run reproducible.<p>
 *
 *  Instances are not thread-safe; each run owns its own.
 */
public final class XorShift {
  private static final double UINT32_RANGE = 0x1p32;

  private int x = 123456789;

  private int y = 362436069;

  private int z = 521288629;

  private int w;

  public XorShift(long seed) {
    w = (int) seed;
  }

  public static long seedOfNow() {
    return System.currentTimeMillis() & 0xFFFF_FFFFL;
  }

  public long nextUInt32() {
    final var t = x ^ (x << 11);
    x = y;
    y = z;
    z = w;
    w = (w ^ (w >>> 19)) ^ (t ^ (t >>> 8));
    return w & 0xFFFF_FFFFL;
  }

  /**
   *  @return A uniform value in [0, 1).
   */
  public double nextUnit() {
    return nextUInt32() / UINT32_RANGE;
  }

  /**
   *  Draws a uniform value in [min, max). Equal bounds are permitted and yield {@code min}.
   *
   *  @param min The lower bound.
   *  @param max The upper bound.
   *  @return The drawn value.
   *  @throws IllegalArgumentException If {@code max < min}.
   */
  public double range(double min, double max) {
    Assert.argument(! (max < min), () -> String.format("Expected min (%s) <= max (%s)", min, max));
    final var lo = Math.min(min, max);
    final var hi = Math.max(min, max);
    return lo + nextUnit() * (hi - lo);
  }

  @Override
  public String toString() {
    return XorShift.class.getSimpleName() + "[x=" + Integer.toUnsignedString(x) + ", y=" + Integer.toUnsignedString(y) +
        ", z=" + Integer.toUnsignedString(z) + ", w=" + Integer.toUnsignedString(w) + ']';
  }
}
