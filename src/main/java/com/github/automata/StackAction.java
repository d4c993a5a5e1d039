package com.github.automata;

/**
 * What a pushdown transition does to the stack. Conditions spell it as a single letter.
 */
public enum StackAction {
  PUSH('P'),
  POP('p');

  private final char token;

  private StackAction(final char token) {
    this.token = token;
  }

  public char getToken() {
    return token;
  }

  /**
   * Returns null for anything other than the two tokens.
   */
  static StackAction fromToken(final String token) {
    for (final StackAction action : values()) {
      if (token.length() == 1 && token.charAt(0) == action.token) {
        return action;
      }
    }
    return null;
  }
}
