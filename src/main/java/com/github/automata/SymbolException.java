package com.github.automata;

/**
 * A single symbol field of a condition is malformed (not exactly one character) or unknown to the
 * compiled alphabet.
 */
public final class SymbolException extends MachineValidationException {
  private static final long serialVersionUID = 1L;
  private final String symbol;

  public SymbolException(final Code code, final MachineType machineType, final String symbol,
      final GraphTransition transition, final String extra) {
    super(code, machineType, "Transition symbol " + symbol + " between '"
        + transition.getFrom().getLabel() + "' and '" + transition.getTo().getLabel() + "' "
        + extra + ".");
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}
