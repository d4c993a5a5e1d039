package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Conditions are single symbols or {@link ConditionGrammar#EPSILON}.
 */
public final class Nfa extends CompiledMachine<String> {
  private final List<CompiledState<String>> initial;

  Nfa(final List<CompiledState<String>> states, final List<CompiledState<String>> initial,
      final Set<String> alphabet) {
    super(MachineType.NFA, states, alphabet);
    this.initial = Collections.unmodifiableList(new ArrayList<>(initial));
  }

  @Override
  public List<CompiledState<String>> getInitialStates() {
    return initial;
  }

  @Override
  public <R> R accept(final MachineVisitor<R> visitor) throws AutomatonException {
    return visitor.visitNfa(this);
  }
}
