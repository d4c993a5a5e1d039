package com.github.automata;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Holder of statistics for one engine. Evaluations run under the shared lock, so the counters are
 * atomic rather than guarded by the engine.
 */
public final class EngineStatistics {
  private final String engineId;
  private final long startTstampMillis = System.currentTimeMillis();

  final AtomicLong totalCompilations = new AtomicLong();
  final AtomicLong failedCompilations = new AtomicLong();
  final AtomicLong totalEvaluations = new AtomicLong();
  final AtomicLong acceptedEvaluations = new AtomicLong();
  final AtomicLong rejectedEvaluations = new AtomicLong();
  // bad input, step budget, timeout
  final AtomicLong failedEvaluations = new AtomicLong();

  EngineStatistics(final String engineId) {
    this.engineId = engineId;
  }

  void recordEvaluation(final EvalResult result) {
    totalEvaluations.incrementAndGet();
    if (result.getResult()) {
      acceptedEvaluations.incrementAndGet();
    } else {
      rejectedEvaluations.incrementAndGet();
    }
  }

  void recordEvaluation(final TestCaseResult result) {
    if (result.getEvalResult().isPresent()) {
      recordEvaluation(result.getEvalResult().get());
    } else {
      totalEvaluations.incrementAndGet();
      failedEvaluations.incrementAndGet();
    }
  }

  public String getEngineId() {
    return engineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getTotalCompilations() {
    return totalCompilations.get();
  }

  public long getFailedCompilations() {
    return failedCompilations.get();
  }

  public long getTotalEvaluations() {
    return totalEvaluations.get();
  }

  public long getAcceptedEvaluations() {
    return acceptedEvaluations.get();
  }

  public long getRejectedEvaluations() {
    return rejectedEvaluations.get();
  }

  public long getFailedEvaluations() {
    return failedEvaluations.get();
  }

  @Override
  public String toString() {
    return "EngineStatistics [engineId=" + engineId + ", startTstampMillis=" + startTstampMillis
        + ", totalCompilations=" + totalCompilations + ", failedCompilations="
        + failedCompilations + ", totalEvaluations=" + totalEvaluations
        + ", acceptedEvaluations=" + acceptedEvaluations + ", rejectedEvaluations="
        + rejectedEvaluations + ", failedEvaluations=" + failedEvaluations + "]";
  }
}
