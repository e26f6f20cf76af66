package com.obsidiandynamics.qcheck;

/**
 *  Receives progress of a run. Values arrive already rendered.
 */
public interface Reporter {
  void onTrial(int index, String value);

  void onShrink(int shrinkCount, String maxFail, String candidate);

  void onFinish(TestResult<?> result);
}
