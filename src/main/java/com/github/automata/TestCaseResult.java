package com.github.automata;

import java.util.List;
import java.util.Optional;

import com.github.automata.AutomatonException.Code;

/**
 * Outcome of one {@link TestCase}. Either the evaluation finished and {@link #getEvalResult()} is
 * present, or it failed (bad input, step budget, timeout) and {@link #getFailure()} says why. A
 * failed case never matches.
 */
public final class TestCaseResult {
  private final TestCase testCase;
  private final Optional<EvalResult> evalResult;
  private final Optional<Code> failureCode;
  private final Optional<String> failure;

  static TestCaseResult evaluated(final TestCase testCase, final EvalResult evalResult) {
    return new TestCaseResult(testCase, evalResult, null, null);
  }

  static TestCaseResult failed(final TestCase testCase, final Code code, final String failure) {
    return new TestCaseResult(testCase, null, code, failure);
  }

  private TestCaseResult(final TestCase testCase, final EvalResult evalResult, final Code code,
      final String failure) {
    this.testCase = testCase;
    this.evalResult = Optional.ofNullable(evalResult);
    this.failureCode = Optional.ofNullable(code);
    this.failure = Optional.ofNullable(failure);
  }

  public TestCase getTestCase() {
    return testCase;
  }

  /**
   * True iff the evaluation finished and its verdict equals the expectation.
   */
  public boolean isMatch() {
    return evalResult.isPresent() && evalResult.get().getResult() == testCase.isExpected();
  }

  public Optional<EvalResult> getEvalResult() {
    return evalResult;
  }

  public Optional<List<String>> getTape() {
    return evalResult.isPresent() ? evalResult.get().getTape() : Optional.<List<String>>empty();
  }

  public Optional<List<String>> getStack() {
    return evalResult.isPresent() ? evalResult.get().getStack() : Optional.<List<String>>empty();
  }

  public Optional<Code> getFailureCode() {
    return failureCode;
  }

  public Optional<String> getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return "TestCaseResult [testCase=" + testCase + ", match=" + isMatch() + ", evalResult="
        + evalResult + ", failure=" + failure + "]";
  }
}
