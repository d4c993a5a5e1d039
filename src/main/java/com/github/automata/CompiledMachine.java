package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable, executable machine produced by {@link MachineCompiler}. The set of subclasses is
 * closed ({@link Dfa}, {@link Nfa}, {@link Pda}, {@link TuringMachine}); code that needs to treat
 * them differently goes through {@link #accept(MachineVisitor)} so that every variant has to be
 * handled.
 *
 * A machine is never mutated after compilation and may be shared between threads. Recompiling a
 * graph always produces a new machine.
 */
public abstract class CompiledMachine<C> {
  private final MachineType type;
  private final List<CompiledState<C>> states;
  private final List<CompiledState<C>> finalStates;
  private final Set<String> alphabet;

  CompiledMachine(final MachineType type, final List<CompiledState<C>> states,
      final Set<String> alphabet) {
    this.type = type;
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    final List<CompiledState<C>> finals = new ArrayList<>();
    for (final CompiledState<C> state : states) {
      if (state.isFinal()) {
        finals.add(state);
      }
    }
    this.finalStates = Collections.unmodifiableList(finals);
    this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
  }

  public MachineType getType() {
    return type;
  }

  /**
   * Every state, in the order the nodes were drawn.
   */
  public List<CompiledState<C>> getStates() {
    return states;
  }

  public List<CompiledState<C>> getFinalStates() {
    return finalStates;
  }

  /**
   * The input alphabet. Input strings may only use these symbols.
   */
  public Set<String> getAlphabet() {
    return alphabet;
  }

  /**
   * Initial states in drawing order; one element for single-initial machines, possibly empty for
   * an NFA.
   */
  public abstract List<CompiledState<C>> getInitialStates();

  public abstract <R> R accept(MachineVisitor<R> visitor) throws AutomatonException;

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [states=" + states.size() + ", alphabet=" + alphabet
        + "]";
  }
}
