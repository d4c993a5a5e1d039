package com.github.automata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic single-tape Turing machine. Its only final states are the one labeled
 * {@code accept} and the one labeled {@code reject}.
 */
public final class TuringMachine extends CompiledMachine<TmCondition> {
  private final CompiledState<TmCondition> initial;
  private final CompiledState<TmCondition> acceptState;
  private final CompiledState<TmCondition> rejectState;
  private final Set<String> tapeAlphabet;

  TuringMachine(final List<CompiledState<TmCondition>> states,
      final CompiledState<TmCondition> initial, final CompiledState<TmCondition> acceptState,
      final CompiledState<TmCondition> rejectState, final Set<String> alphabet,
      final Set<String> tapeAlphabet) {
    super(MachineType.TURING_MACHINE, states, alphabet);
    this.initial = initial;
    this.acceptState = acceptState;
    this.rejectState = rejectState;
    this.tapeAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(tapeAlphabet));
  }

  public CompiledState<TmCondition> getInitial() {
    return initial;
  }

  public CompiledState<TmCondition> getAcceptState() {
    return acceptState;
  }

  public CompiledState<TmCondition> getRejectState() {
    return rejectState;
  }

  public Set<String> getTapeAlphabet() {
    return tapeAlphabet;
  }

  @Override
  public List<CompiledState<TmCondition>> getInitialStates() {
    return Collections.singletonList(initial);
  }

  @Override
  public <R> R accept(final MachineVisitor<R> visitor) throws AutomatonException {
    return visitor.visitTuringMachine(this);
  }
}
