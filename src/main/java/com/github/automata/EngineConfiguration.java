package com.github.automata;

import java.util.concurrent.TimeUnit;

import com.github.automata.AutomatonException.Code;

/**
 * This class encapsulates all the configuration parameters for the AutomatonEngine. Use the
 * {@code EngineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. maxEvaluationSteps bounds the configurations a single eval or simulation may enter; a step
 * that forks several timelines is charged for each of them. Machines whose branches can grow
 * forever (a PDA pushing on an epsilon loop, a Turing machine walking off into blank tape) stop
 * there.<br>
 * 2. evaluationTimeoutMillis bounds a single test case of a batch evaluation.<br>
 * 3. evaluationParallelism > 1 runs the test cases of a batch on that many threads.<br>
 * 4. Non-positive values fall back to the defaults.<br>
 */
public final class EngineConfiguration {
  static final long DEFAULT_MAX_EVALUATION_STEPS = 100_000L;
  static final long DEFAULT_EVALUATION_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(10L);
  static final int DEFAULT_EVALUATION_PARALLELISM = 1;
  static final long DEFAULT_LOCK_ACQUISITION_MILLIS = 100L;

  // upper bound on the batch thread pool
  static final int MAX_EVALUATION_PARALLELISM = 64;

  private final long maxEvaluationSteps;
  private final long evaluationTimeoutMillis;
  private final int evaluationParallelism;
  private final long lockAcquisitionMillis;

  public long getMaxEvaluationSteps() {
    return maxEvaluationSteps;
  }

  public long getEvaluationTimeoutMillis() {
    return evaluationTimeoutMillis;
  }

  public int getEvaluationParallelism() {
    return evaluationParallelism;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public final static class EngineConfigurationBuilder {
    private long maxEvaluationSteps;
    private long evaluationTimeoutMillis;
    private int evaluationParallelism;
    private long lockAcquisitionMillis;

    public static EngineConfigurationBuilder newBuilder() {
      return new EngineConfigurationBuilder();
    }

    public EngineConfigurationBuilder maxEvaluationSteps(final long maxEvaluationSteps) {
      this.maxEvaluationSteps = maxEvaluationSteps;
      return this;
    }

    public EngineConfigurationBuilder evaluationTimeoutMillis(final long evaluationTimeoutMillis) {
      this.evaluationTimeoutMillis = evaluationTimeoutMillis;
      return this;
    }

    public EngineConfigurationBuilder evaluationParallelism(final int evaluationParallelism) {
      this.evaluationParallelism = evaluationParallelism;
      return this;
    }

    public EngineConfigurationBuilder lockAcquisitionMillis(final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public EngineConfiguration build() throws AutomatonException {
      final EngineConfiguration config = new EngineConfiguration(maxEvaluationSteps,
          evaluationTimeoutMillis, evaluationParallelism, lockAcquisitionMillis);
      config.validate();
      return config;
    }

    private EngineConfigurationBuilder() {}
  }

  /**
   * All defaults.
   */
  public static EngineConfiguration defaults() {
    return new EngineConfiguration(0L, 0L, 0, 0L);
  }

  private void validate() throws AutomatonException {
    final StringBuilder messages = new StringBuilder();
    if (evaluationParallelism > MAX_EVALUATION_PARALLELISM) {
      messages.append("evaluationParallelism cannot exceed ").append(MAX_EVALUATION_PARALLELISM)
          .append(". ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(Code.INVALID_ENGINE_CONFIG, messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "EngineConfiguration [maxEvaluationSteps=" + maxEvaluationSteps
        + ", evaluationTimeoutMillis=" + evaluationTimeoutMillis + ", evaluationParallelism="
        + evaluationParallelism + ", lockAcquisitionMillis=" + lockAcquisitionMillis + "]";
  }

  private EngineConfiguration(final long maxEvaluationSteps, final long evaluationTimeoutMillis,
      final int evaluationParallelism, final long lockAcquisitionMillis) {
    this.maxEvaluationSteps =
        maxEvaluationSteps <= 0L ? DEFAULT_MAX_EVALUATION_STEPS : maxEvaluationSteps;
    this.evaluationTimeoutMillis = evaluationTimeoutMillis <= 0L
        ? DEFAULT_EVALUATION_TIMEOUT_MILLIS : evaluationTimeoutMillis;
    this.evaluationParallelism =
        evaluationParallelism <= 0 ? DEFAULT_EVALUATION_PARALLELISM : evaluationParallelism;
    this.lockAcquisitionMillis =
        lockAcquisitionMillis <= 0L ? DEFAULT_LOCK_ACQUISITION_MILLIS : lockAcquisitionMillis;
  }

}
