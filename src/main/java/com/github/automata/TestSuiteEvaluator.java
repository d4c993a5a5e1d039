package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AutomatonException.Code;

/**
 * Runs a batch of {@link TestCase}s against a compiled machine. Every case gets its own eval, so a
 * case that fails (bad input, step budget, timeout) is reported on its own result and the rest of
 * the suite carries on. Results come back in the order of the cases.
 *
 * Every case is bounded by the step budget and by evaluationTimeoutMillis of its own running time,
 * counted from the moment the case starts rather than from when it was queued. With
 * evaluationParallelism > 1 the cases run on a pool owned by this evaluator; with the default of 1
 * they run on the calling thread.
 */
public final class TestSuiteEvaluator {
  private static final Logger logger =
      LogManager.getLogger(TestSuiteEvaluator.class.getSimpleName());

  private final EngineConfiguration config;
  private final ExecutorService executor;

  public TestSuiteEvaluator(final EngineConfiguration config) {
    this.config = config == null ? EngineConfiguration.defaults() : config;
    if (this.config.getEvaluationParallelism() > 1) {
      executor = Executors.newFixedThreadPool(this.config.getEvaluationParallelism(),
          new EvaluatorThreadFactory());
    } else {
      executor = null;
    }
  }

  /**
   * Fails only when there is no machine or the calling thread is interrupted.
   */
  public List<TestCaseResult> evaluate(final CompiledMachine<?> machine,
      final List<TestCase> testCases) throws AutomatonException {
    if (machine == null) {
      throw new AutomatonException(Code.NO_ACTIVE_MACHINE);
    }
    if (testCases == null || testCases.isEmpty()) {
      return Collections.emptyList();
    }
    final List<TestCaseResult> results =
        executor == null ? evaluateInline(machine, testCases) : evaluatePooled(machine, testCases);
    if (logger.isDebugEnabled()) {
      int matched = 0;
      for (final TestCaseResult result : results) {
        if (result.isMatch()) {
          matched++;
        }
      }
      logger.debug(String.format("Evaluated %d test cases against %s, matched:%d",
          results.size(), machine, matched));
    }
    return results;
  }

  private List<TestCaseResult> evaluateInline(final CompiledMachine<?> machine,
      final List<TestCase> testCases) throws AutomatonException {
    final List<TestCaseResult> results = new ArrayList<>(testCases.size());
    for (final TestCase testCase : testCases) {
      try {
        results.add(TestCaseResult.evaluated(testCase, run(machine, testCase)));
      } catch (AutomatonException failure) {
        if (failure.getCode() == Code.INTERRUPTED) {
          throw failure;
        }
        results.add(TestCaseResult.failed(testCase, failure.getCode(), failure.getMessage()));
      }
    }
    return results;
  }

  private List<TestCaseResult> evaluatePooled(final CompiledMachine<?> machine,
      final List<TestCase> testCases) throws AutomatonException {
    final List<Future<EvalResult>> futures = new ArrayList<>(testCases.size());
    for (final TestCase testCase : testCases) {
      futures.add(executor.submit(new Callable<EvalResult>() {
        @Override
        public EvalResult call() throws AutomatonException {
          return run(machine, testCase);
        }
      }));
    }
    final List<TestCaseResult> results = new ArrayList<>(testCases.size());
    try {
      for (int iter = 0; iter < testCases.size(); iter++) {
        results.add(await(testCases.get(iter), futures.get(iter)));
      }
    } catch (InterruptedException exception) {
      for (final Future<EvalResult> future : futures) {
        future.cancel(true);
      }
      Thread.currentThread().interrupt();
      throw new AutomatonException(Code.INTERRUPTED, "Test suite evaluation was interrupted",
          exception);
    }
    return results;
  }

  private EvalResult run(final CompiledMachine<?> machine, final TestCase testCase)
      throws AutomatonException {
    return Simulator.run(machine, testCase.getInput(), config.getMaxEvaluationSteps(),
        config.getEvaluationTimeoutMillis());
  }

  private static TestCaseResult await(final TestCase testCase, final Future<EvalResult> future)
      throws InterruptedException {
    try {
      return TestCaseResult.evaluated(testCase, future.get());
    } catch (ExecutionException exception) {
      final Throwable cause = exception.getCause();
      if (cause instanceof AutomatonException) {
        final AutomatonException failure = (AutomatonException) cause;
        return TestCaseResult.failed(testCase, failure.getCode(), failure.getMessage());
      }
      logger.error("Unexpected failure evaluating " + testCase, cause);
      return TestCaseResult.failed(testCase, Code.UNKNOWN_FAILURE, String.valueOf(cause));
    }
  }

  /**
   * Stop the pool, if any. Running cases are interrupted.
   */
  public void shutdown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  private static final class EvaluatorThreadFactory implements ThreadFactory {
    private final AtomicInteger threadCounter = new AtomicInteger();

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread = new Thread(runnable);
      thread.setName("Evaluator-" + threadCounter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
