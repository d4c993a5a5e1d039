package com.github.automata;

/**
 * Root of the exceptions thrown by the automaton engine. The idea is to use the code enum to
 * encapsulate the various failure conditions so callers do not need to match on message text.
 * Messages stay human-readable and are meant to be shown to the user who drew the graph.
 */
public class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomatonException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public AutomatonException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    NO_INITIAL_STATE("Machine has no initial state"),
    // 2.
    MULTIPLE_INITIAL_STATES("Machine has more than one initial state"),
    // 3.
    MISSING_ACCEPT_STATE("Turing machine has no accept state"),
    // 4.
    MISSING_REJECT_STATE("Turing machine has no reject state"),
    // 5.
    MULTIPLE_ACCEPT_STATES("Turing machine has more than one accept state"),
    // 6.
    MULTIPLE_REJECT_STATES("Turing machine has more than one reject state"),
    // 7.
    ILLEGAL_FINAL_STATE("Turing machine end states must be labeled accept or reject"),
    // 8.
    MALFORMED_CONDITION("Transition condition could not be parsed"),
    // 9.
    INVALID_SYMBOL("Transition symbol must be exactly one character long"),
    // 10.
    SYMBOL_NOT_IN_ALPHABET("Transition symbol is not a member of the supplied alphabet"),
    // 11.
    DUPLICATE_TRANSITION("State has more than one outgoing transition for a symbol"),
    // 12.
    MISSING_TRANSITIONS("State is missing outgoing transitions for some symbols"),
    // 13.
    UNRECOGNIZED_SYMBOL("Compiler found a symbol outside the machine alphabet"),
    // 14.
    NO_MATCHING_MACHINE_TYPE(
        "Unable to compile as any automaton model; check your machine and try again."),
    // 15.
    INVALID_INPUT_SYMBOL("Input contains a character outside the machine alphabet"),
    // 16.
    NO_ACTIVE_MACHINE("No compiled machine."),
    // 17.
    NO_ACTIVE_SIMULATION("No simulation is running"),
    // 18.
    EVALUATION_LIMIT_EXCEEDED("Evaluation exceeded the configured step budget"),
    // 19.
    EVALUATION_TIMEOUT("Evaluation did not finish within the configured timeout"),
    // 20.
    INVALID_GRAPH("Graph records are invalid"),
    // 21.
    INVALID_ENGINE_CONFIG("Engine configuration is invalid"),
    // 22.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    // 23.
    INTERRUPTED("Engine was interrupted"),
    // 24.
    ENGINE_NOT_ALIVE("Engine has been shut down"),
    // 25.
    UNKNOWN_FAILURE("Engine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
