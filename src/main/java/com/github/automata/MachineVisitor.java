package com.github.automata;

/**
 * Exhaustive dispatch over the four compiled machine types.
 */
public interface MachineVisitor<R> {

  R visitDfa(Dfa dfa) throws AutomatonException;

  R visitNfa(Nfa nfa) throws AutomatonException;

  R visitPda(Pda pda) throws AutomatonException;

  R visitTuringMachine(TuringMachine turingMachine) throws AutomatonException;
}
