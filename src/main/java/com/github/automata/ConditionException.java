package com.github.automata;

/**
 * A transition condition does not fit the grammar of the machine type, or names a symbol outside a
 * closed alphabet.
 */
public final class ConditionException extends MachineValidationException {
  private static final long serialVersionUID = 1L;
  private final String condition;

  public ConditionException(final Code code, final MachineType machineType, final String condition,
      final GraphTransition transition, final String extra) {
    super(code, machineType, "Transition condition " + condition + " between '"
        + transition.getFrom().getLabel() + "' and '" + transition.getTo().getLabel() + "' "
        + extra + ".");
    this.condition = condition;
  }

  public String getCondition() {
    return condition;
  }
}
