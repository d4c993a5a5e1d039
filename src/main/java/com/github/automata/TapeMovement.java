package com.github.automata;

/**
 * Head movement of a Turing machine transition.
 */
public enum TapeMovement {
  NONE('N', 0),
  LEFT('L', -1),
  RIGHT('R', 1);

  private final char token;
  private final int offset;

  private TapeMovement(final char token, final int offset) {
    this.token = token;
    this.offset = offset;
  }

  public char getToken() {
    return token;
  }

  public int getOffset() {
    return offset;
  }

  static TapeMovement fromToken(final String token) {
    for (final TapeMovement movement : values()) {
      if (token.length() == 1 && token.charAt(0) == movement.token) {
        return movement;
      }
    }
    return null;
  }
}
