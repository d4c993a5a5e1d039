package com.github.automata;

import java.util.Collections;
import java.util.List;
import java.util.Set;

public final class Dfa extends CompiledMachine<String> {
  private final CompiledState<String> initial;

  Dfa(final List<CompiledState<String>> states, final CompiledState<String> initial,
      final Set<String> alphabet) {
    super(MachineType.DFA, states, alphabet);
    this.initial = initial;
  }

  public CompiledState<String> getInitial() {
    return initial;
  }

  @Override
  public List<CompiledState<String>> getInitialStates() {
    return Collections.singletonList(initial);
  }

  @Override
  public <R> R accept(final MachineVisitor<R> visitor) throws AutomatonException {
    return visitor.visitDfa(this);
  }
}
