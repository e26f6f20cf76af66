package com.obsidiandynamics.qcheck;

/**
 *  Raised by {@link Reporters#throwOnFailure()} when a run fails. The message carries the
 *  rendered report; the cause, if any, is the error thrown for the minimal failing value.
 */
public final class TestFailureError extends AssertionError {
  private static final long serialVersionUID = 1L;

  private final transient TestResult<?> testResult;

  TestFailureError(TestResult<?> testResult) {
    super(render(testResult), testResult.getError());
    this.testResult = testResult;
  }

  private static String render(TestResult<?> testResult) {
    final var message = new StringBuilder();
    Reporters.describe(testResult, line -> message.append(line).append('\n'));
    return message.toString();
  }

  public TestResult<?> getTestResult() {
    return testResult;
  }
}
