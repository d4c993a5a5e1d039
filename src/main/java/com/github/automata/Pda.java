package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class Pda extends CompiledMachine<PdaCondition> {
  private final List<CompiledState<PdaCondition>> initial;
  private final Set<String> stackAlphabet;

  Pda(final List<CompiledState<PdaCondition>> states,
      final List<CompiledState<PdaCondition>> initial, final Set<String> alphabet,
      final Set<String> stackAlphabet) {
    super(MachineType.PDA, states, alphabet);
    this.initial = Collections.unmodifiableList(new ArrayList<>(initial));
    this.stackAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(stackAlphabet));
  }

  @Override
  public List<CompiledState<PdaCondition>> getInitialStates() {
    return initial;
  }

  public Set<String> getStackAlphabet() {
    return stackAlphabet;
  }

  @Override
  public <R> R accept(final MachineVisitor<R> visitor) throws AutomatonException {
    return visitor.visitPda(this);
  }
}
