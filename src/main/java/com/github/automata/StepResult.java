package com.github.automata;

/**
 * Outcome of one simulation step, returned by value. Only {@link #CONTINUE} is non-terminal.
 */
public enum StepResult {
  // at least one timeline is still alive
  CONTINUE,
  // some timeline consumed all input in a final state, or the Turing machine reached accept
  ACCEPTED,
  // every timeline died, or the Turing machine reached reject
  REJECTED,
  // the Turing machine had no transition for the symbol under its head
  CRASHED;

  public boolean isTerminal() {
    return this != CONTINUE;
  }

  public boolean isAccepting() {
    return this == ACCEPTED;
  }
}
