package com.github.automata;

import java.util.Objects;

/**
 * Parsed pushdown condition: consume {@code symbol} (or nothing for epsilon) while
 * {@code readStackSymbol} is on top of the stack, then apply {@code action} with
 * {@code actionStackSymbol}.
 */
public final class PdaCondition {
  private final String symbol;
  private final String readStackSymbol;
  private final StackAction action;
  private final String actionStackSymbol;

  public PdaCondition(final String symbol, final String readStackSymbol, final StackAction action,
      final String actionStackSymbol) {
    this.symbol = symbol;
    this.readStackSymbol = readStackSymbol;
    this.action = action;
    this.actionStackSymbol = actionStackSymbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getReadStackSymbol() {
    return readStackSymbol;
  }

  public StackAction getAction() {
    return action;
  }

  public String getActionStackSymbol() {
    return actionStackSymbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PdaCondition)) {
      return false;
    }
    final PdaCondition other = (PdaCondition) o;
    return Objects.equals(symbol, other.symbol)
        && Objects.equals(readStackSymbol, other.readStackSymbol) && action == other.action
        && Objects.equals(actionStackSymbol, other.actionStackSymbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(symbol, readStackSymbol, action, actionStackSymbol);
  }

  @Override
  public String toString() {
    return symbol + " " + readStackSymbol + " " + action.getToken() + " " + actionStackSymbol;
  }
}
