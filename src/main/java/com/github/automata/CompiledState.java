package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A state of a compiled machine. {@code C} is the condition type of the machine: a symbol string
 * for DFA/NFA, {@link PdaCondition} or {@link TmCondition} otherwise.
 *
 * States are wired up by {@link MachineCompiler} and frozen before the machine is handed out; a
 * state belongs to exactly one machine. Equality is identity.
 */
public final class CompiledState<C> {
  private final String label;
  private final boolean initial;
  private final boolean finalState;
  private List<CompiledTransition<C>> transitions = new ArrayList<>();
  private boolean frozen;

  CompiledState(final String label, final boolean initial, final boolean finalState) {
    this.label = label;
    this.initial = initial;
    this.finalState = finalState;
  }

  public String getLabel() {
    return label;
  }

  public boolean isInitial() {
    return initial;
  }

  public boolean isFinal() {
    return finalState;
  }

  /**
   * Outgoing transitions in the order they were drawn.
   */
  public List<CompiledTransition<C>> getTransitions() {
    return frozen ? transitions : Collections.unmodifiableList(transitions);
  }

  void addTransition(final CompiledTransition<C> transition) {
    if (frozen) {
      throw new IllegalStateException("State " + label + " is already compiled");
    }
    transitions.add(transition);
  }

  void freeze() {
    if (!frozen) {
      transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
      frozen = true;
    }
  }

  @Override
  public String toString() {
    return "CompiledState [label=" + label + ", initial=" + initial + ", final=" + finalState
        + ", transitions=" + transitions.size() + "]";
  }
}
