package com.obsidiandynamics.qcheck;

/**
 *  The terminal report of a run.
 *
 *  @param <T> The value type.
 */
public final class TestResult<T> {
  public enum Kind {
    SUCCESS,
    FAILURE,
    EXCEPTION
  }

  private final Kind kind;

  private final Show<T> show;

  private final long seed;

  private final int testCount;

  private final int shrinkCount;

  private final T originalFail;

  private final T minFail;

  private final Throwable error;

  private TestResult(Kind kind, Show<T> show, long seed, int testCount, int shrinkCount, T originalFail, T minFail, Throwable error) {
    this.kind = kind;
    this.show = show;
    this.seed = seed;
    this.testCount = testCount;
    this.shrinkCount = shrinkCount;
    this.originalFail = originalFail;
    this.minFail = minFail;
    this.error = error;
  }

  static <T> TestResult<T> success(Show<T> show, long seed, int testCount) {
    return new TestResult<>(Kind.SUCCESS, show, seed, testCount, 0, null, null, null);
  }

  static <T> TestResult<T> failure(Show<T> show, long seed, int testCount, int shrinkCount, T originalFail, T minFail, Throwable error) {
    final var kind = error != null ? Kind.EXCEPTION : Kind.FAILURE;
    return new TestResult<>(kind, show, seed, testCount, shrinkCount, originalFail, minFail, error);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isSuccess() {
    return kind == Kind.SUCCESS;
  }

  public Show<T> getShow() {
    return show;
  }

  public long getSeed() {
    return seed;
  }

  public int getTestCount() {
    return testCount;
  }

  public int getShrinkCount() {
    return shrinkCount;
  }

  public T getOriginalFail() {
    return originalFail;
  }

  public T getMinFail() {
    return minFail;
  }

  /**
   *  @return The error thrown by the property for the minimal failing value, or
   *  {@code null} if it failed without throwing.
   */
  public Throwable getError() {
    return error;
  }

  @Override
  public String toString() {
    return TestResult.class.getSimpleName() + "[kind=" + kind + ", seed=" + seed + ", testCount=" + testCount +
        ", shrinkCount=" + shrinkCount + ", originalFail=" + originalFail + ", minFail=" + minFail +
        ", error=" + error + ']';
  }
}
