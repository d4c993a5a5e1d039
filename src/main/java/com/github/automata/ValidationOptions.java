package com.github.automata;

/**
 * Per-request validation switches.
 */
public final class ValidationOptions {
  public static final ValidationOptions DEFAULT = new ValidationOptions(false);

  // every state with outgoing transitions must cover every symbol exactly once. Always on for DFA.
  private final boolean requireAllTransitions;

  public static ValidationOptions requireAllTransitions(final boolean requireAllTransitions) {
    return requireAllTransitions ? new ValidationOptions(true) : DEFAULT;
  }

  public boolean isRequireAllTransitions() {
    return requireAllTransitions;
  }

  @Override
  public String toString() {
    return "ValidationOptions [requireAllTransitions=" + requireAllTransitions + "]";
  }

  private ValidationOptions(final boolean requireAllTransitions) {
    this.requireAllTransitions = requireAllTransitions;
  }
}
