package com.obsidiandynamics.qcheck;

/**
 *  Hill-climbs from a failing value to a locally minimal one.<p>
 *
 *  The shrinks of the current basis are tried in order, and each failing candidate becomes
 *  the best known failure. The first passing candidate ends the pass: if no candidate of the
 *  pass has failed yet, the basis is locally minimal and the search stops; otherwise the
 *  best failure becomes the new basis and a fresh pass begins. Running out of candidates
 *  also ends the search.
 */
final class ShrinkSearch<T> {
  private final Arbitrary<T> arbitrary;

  private final Show<T> show;

  private final Property<? super T> property;

  private final Reporter reporter;

  ShrinkSearch(Arbitrary<T> arbitrary, Show<T> show, Property<? super T> property, Reporter reporter) {
    this.arbitrary = arbitrary;
    this.show = show;
    this.property = property;
    this.reporter = reporter;
  }

  TestResult<T> search(long seed, int testCount, T originalFail, Outcome originalOutcome) {
    var shrinkCount = 0;
    var maxFail = originalFail;
    var minFail = originalFail;
    var minOutcome = originalOutcome;
    var failCount = 0;

    findMin:
    while (true) {
      for (var candidates = arbitrary.shrink(maxFail).iterator(); candidates.hasNext(); ) {
        final var candidate = candidates.next();
        reporter.onShrink(shrinkCount, show.stringify(maxFail), show.stringify(candidate));
        final var outcome = Outcome.evaluate(property, show, candidate);

        if (outcome.isSuccess()) {
          if (failCount == 0) break findMin;

          maxFail = minFail;
          failCount = 0;
          continue findMin;
        } else {
          failCount++;
          shrinkCount++;
          minFail = candidate;
          minOutcome = outcome;
        }
      }
      break;
    }

    final var error = minOutcome.getKind() == Outcome.Kind.EXCEPTION ? minOutcome.getError() : null;
    return TestResult.failure(show, seed, testCount, shrinkCount, originalFail, minFail, error);
  }
}
