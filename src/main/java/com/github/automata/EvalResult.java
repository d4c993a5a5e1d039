package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Verdict of a complete evaluation. The tape is reported for Turing machines, the stack of the
 * accepting branch for PDAs; both are absent for DFA/NFA.
 */
public final class EvalResult {
  private final StepResult verdict;
  private final Optional<List<String>> tape;
  private final Optional<List<String>> stack;

  EvalResult(final StepResult verdict, final List<String> tape, final List<String> stack) {
    this.verdict = verdict;
    this.tape = freeze(tape);
    this.stack = freeze(stack);
  }

  public boolean getResult() {
    return verdict.isAccepting();
  }

  public StepResult getVerdict() {
    return verdict;
  }

  public Optional<List<String>> getTape() {
    return tape;
  }

  public Optional<List<String>> getStack() {
    return stack;
  }

  private static Optional<List<String>> freeze(final List<String> symbols) {
    return symbols == null ? Optional.<List<String>>empty()
        : Optional.of(Collections.unmodifiableList(new ArrayList<>(symbols)));
  }

  @Override
  public String toString() {
    return "EvalResult [result=" + getResult() + ", verdict=" + verdict + ", tape=" + tape
        + ", stack=" + stack + "]";
  }
}
