package com.github.automata;

import java.util.ArrayList;
import java.util.List;

import com.github.automata.AutomatonException.Code;

/**
 * Parses raw transition conditions into typed conditions. Validation and compilation both go
 * through here so they can never disagree about what a condition means.
 *
 * Grammars:<br>
 * DFA/NFA: a single character, or {@link #EPSILON} (NFA only)<br>
 * PDA: {@code <symbol> <readStackSymbol> <P|p> <actionStackSymbol>}<br>
 * Turing machine: {@code <readSymbol> <writeSymbol> <N|R|L>}<br>
 */
public final class ConditionGrammar {
  public static final String EPSILON = "ε";
  // read from an empty Turing tape cell; writing it clears the cell
  public static final String BLANK = "_";

  public static boolean isEpsilon(final String symbol) {
    return EPSILON.equals(symbol);
  }

  /**
   * Exactly one code point, so symbols outside the BMP still count as one character.
   */
  public static boolean isSingleSymbol(final String symbol) {
    return symbol != null && !symbol.isEmpty()
        && symbol.codePointCount(0, symbol.length()) == 1;
  }

  /**
   * Splits an input string into its symbols, one per code point.
   */
  public static List<String> symbols(final String input) {
    final List<String> symbols = new ArrayList<>();
    if (input == null) {
      return symbols;
    }
    int offset = 0;
    while (offset < input.length()) {
      final int next = input.offsetByCodePoints(offset, 1);
      symbols.add(input.substring(offset, next));
      offset = next;
    }
    return symbols;
  }

  public static String parseFiniteSymbol(final MachineType type, final String condition,
      final GraphTransition transition) throws MachineValidationException {
    if (!isSingleSymbol(condition)) {
      throw new SymbolException(Code.INVALID_SYMBOL, type, condition, transition,
          "must be one character long");
    }
    if (type == MachineType.DFA && isEpsilon(condition)) {
      throw new ConditionException(Code.MALFORMED_CONDITION, type, condition, transition,
          "is an epsilon transition, which a DFA cannot have");
    }
    return condition;
  }

  public static PdaCondition parsePdaCondition(final String condition,
      final GraphTransition transition) throws MachineValidationException {
    final String[] tokens = tokenize(condition);
    if (tokens.length != 4) {
      throw new ConditionException(Code.MALFORMED_CONDITION, MachineType.PDA, condition,
          transition, "couldn't be parsed as a PDA condition");
    }
    checkSymbol(MachineType.PDA, tokens[0], transition);
    checkSymbol(MachineType.PDA, tokens[1], transition);
    checkSymbol(MachineType.PDA, tokens[3], transition);
    final StackAction action = StackAction.fromToken(tokens[2]);
    if (action == null) {
      throw new ConditionException(Code.MALFORMED_CONDITION, MachineType.PDA, condition,
          transition, "has stack action '" + tokens[2] + "', which must be either 'P' (push) or"
              + " 'p' (pop)");
    }
    return new PdaCondition(tokens[0], tokens[1], action, tokens[3]);
  }

  public static TmCondition parseTmCondition(final String condition,
      final GraphTransition transition) throws MachineValidationException {
    final String[] tokens = tokenize(condition);
    if (tokens.length != 3) {
      throw new ConditionException(Code.MALFORMED_CONDITION, MachineType.TURING_MACHINE,
          condition, transition, "couldn't be parsed as a Turing Machine condition");
    }
    checkSymbol(MachineType.TURING_MACHINE, tokens[0], transition);
    checkSymbol(MachineType.TURING_MACHINE, tokens[1], transition);
    final TapeMovement movement = TapeMovement.fromToken(tokens[2]);
    if (movement == null) {
      throw new ConditionException(Code.MALFORMED_CONDITION, MachineType.TURING_MACHINE,
          condition, transition,
          "has tape movement '" + tokens[2] + "', which must be 'N', 'R', or 'L'");
    }
    return new TmCondition(tokens[0], tokens[1], movement);
  }

  private static String[] tokenize(final String condition) {
    if (condition == null) {
      return new String[0];
    }
    // single spaces only; empty tokens are kept so "a  b" is rejected on length
    return condition.split(" ", -1);
  }

  private static void checkSymbol(final MachineType type, final String symbol,
      final GraphTransition transition) throws SymbolException {
    if (!isSingleSymbol(symbol)) {
      throw new SymbolException(Code.INVALID_SYMBOL, type, symbol, transition,
          "must be one character long");
    }
  }

  private ConditionGrammar() {}
}
