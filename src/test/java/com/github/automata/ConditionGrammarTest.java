package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import com.github.automata.AutomatonException.Code;

/**
 * Tests to maintain the sanity and correctness of the condition grammar.
 */
public class ConditionGrammarTest {

  @Test
  public void testPdaConditionParsing() throws AutomatonException {
    final GraphTransition transition = transition();
    final PdaCondition condition = ConditionGrammar.parsePdaCondition("a b P c", transition);
    assertEquals("a", condition.getSymbol());
    assertEquals("b", condition.getReadStackSymbol());
    assertEquals(StackAction.PUSH, condition.getAction());
    assertEquals("c", condition.getActionStackSymbol());
    assertEquals(new PdaCondition("a", "b", StackAction.PUSH, "c"), condition);

    assertEquals(StackAction.POP,
        ConditionGrammar.parsePdaCondition("ε Z p Z", transition).getAction());
  }

  @Test
  public void testPdaConditionBadAction() throws AutomatonException {
    try {
      ConditionGrammar.parsePdaCondition("a b X c", transition());
      fail("X is not a stack action");
    } catch (ConditionException expected) {
      assertEquals(Code.MALFORMED_CONDITION, expected.getCode());
      assertEquals(MachineType.PDA, expected.getMachineType());
      assertTrue(expected.getMessage().startsWith("Failed to validate as PDA: "));
      assertTrue(expected.getMessage().contains("'X'"));
    }
  }

  @Test
  public void testPdaConditionShape() throws AutomatonException {
    // 1. too few tokens
    try {
      ConditionGrammar.parsePdaCondition("a b P", transition());
      fail("three tokens are not a PDA condition");
    } catch (ConditionException expected) {
      assertEquals(Code.MALFORMED_CONDITION, expected.getCode());
      assertTrue(expected.getMessage().contains("couldn't be parsed as a PDA condition"));
    }

    // 2. double space yields an empty token
    try {
      ConditionGrammar.parsePdaCondition("a  P c", transition());
      fail("empty token");
    } catch (SymbolException expected) {
      assertEquals(Code.INVALID_SYMBOL, expected.getCode());
    }

    // 3. multi-character field
    try {
      ConditionGrammar.parsePdaCondition("ab b P c", transition());
      fail("ab is two characters");
    } catch (SymbolException expected) {
      assertEquals(Code.INVALID_SYMBOL, expected.getCode());
      assertTrue(expected.getMessage().contains("must be one character long"));
    }
  }

  @Test
  public void testTmConditionParsing() throws AutomatonException {
    final GraphTransition transition = transition();
    final TmCondition condition = ConditionGrammar.parseTmCondition("0 1 R", transition);
    assertEquals("0", condition.getReadSymbol());
    assertEquals("1", condition.getWriteSymbol());
    assertEquals(TapeMovement.RIGHT, condition.getMovement());
    assertEquals(TapeMovement.LEFT,
        ConditionGrammar.parseTmCondition("_ x L", transition).getMovement());
    assertEquals(TapeMovement.NONE,
        ConditionGrammar.parseTmCondition("x _ N", transition).getMovement());

    try {
      ConditionGrammar.parseTmCondition("0 1 U", transition);
      fail("U is not a movement");
    } catch (ConditionException expected) {
      assertEquals(Code.MALFORMED_CONDITION, expected.getCode());
      assertEquals(MachineType.TURING_MACHINE, expected.getMachineType());
      assertTrue(expected.getMessage().contains("'U'"));
    }

    try {
      ConditionGrammar.parseTmCondition("a b P c", transition);
      fail("a PDA condition is not a TM condition");
    } catch (ConditionException expected) {
      assertTrue(
          expected.getMessage().contains("couldn't be parsed as a Turing Machine condition"));
    }
  }

  @Test
  public void testFiniteSymbols() throws AutomatonException {
    final GraphTransition transition = transition();
    assertEquals("a", ConditionGrammar.parseFiniteSymbol(MachineType.DFA, "a", transition));
    assertEquals(ConditionGrammar.EPSILON,
        ConditionGrammar.parseFiniteSymbol(MachineType.NFA, "ε", transition));

    // 1. epsilon is exclusive to NFA
    try {
      ConditionGrammar.parseFiniteSymbol(MachineType.DFA, "ε", transition);
      fail("DFA has no epsilon transitions");
    } catch (ConditionException expected) {
      assertEquals(Code.MALFORMED_CONDITION, expected.getCode());
      assertEquals("Failed to validate as DFA: Transition condition ε between 'p' and 'q' is an"
          + " epsilon transition, which a DFA cannot have.", expected.getMessage());
    }

    // 2. empty and long symbols
    for (final String bad : Arrays.asList("", "ab")) {
      try {
        ConditionGrammar.parseFiniteSymbol(MachineType.NFA, bad, transition);
        fail(bad + " is not a single symbol");
      } catch (SymbolException expected) {
        assertEquals(Code.INVALID_SYMBOL, expected.getCode());
      }
    }
  }

  @Test
  public void testSymbolsAreCodePoints() {
    // a surrogate pair is one symbol
    final String clef = new String(Character.toChars(0x1D11E));
    assertEquals(2, clef.length());
    assertTrue(ConditionGrammar.isSingleSymbol(clef));
    assertFalse(ConditionGrammar.isSingleSymbol("ab"));
    assertFalse(ConditionGrammar.isSingleSymbol(null));
    assertEquals(Arrays.asList("a", clef, "b"), ConditionGrammar.symbols("a" + clef + "b"));
    assertTrue(ConditionGrammar.symbols("").isEmpty());
  }

  private static GraphTransition transition() throws AutomatonException {
    return new GraphTransition(new GraphNode("p", true, false), new GraphNode("q", false, true),
        null);
  }
}
