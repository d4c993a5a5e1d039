package com.github.automata;

import java.util.Objects;

/**
 * Parsed Turing machine condition: on {@code readSymbol} under the head, write
 * {@code writeSymbol} and move.
 */
public final class TmCondition {
  private final String readSymbol;
  private final String writeSymbol;
  private final TapeMovement movement;

  public TmCondition(final String readSymbol, final String writeSymbol,
      final TapeMovement movement) {
    this.readSymbol = readSymbol;
    this.writeSymbol = writeSymbol;
    this.movement = movement;
  }

  public String getReadSymbol() {
    return readSymbol;
  }

  public String getWriteSymbol() {
    return writeSymbol;
  }

  public TapeMovement getMovement() {
    return movement;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TmCondition)) {
      return false;
    }
    final TmCondition other = (TmCondition) o;
    return Objects.equals(readSymbol, other.readSymbol)
        && Objects.equals(writeSymbol, other.writeSymbol) && movement == other.movement;
  }

  @Override
  public int hashCode() {
    return Objects.hash(readSymbol, writeSymbol, movement);
  }

  @Override
  public String toString() {
    return readSymbol + " " + writeSymbol + " " + movement.getToken();
  }
}
