package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable compiled edge. {@code from} and {@code to} are back-references into the owning
 * machine.
 */
public final class CompiledTransition<C> {
  private final CompiledState<C> from;
  private final CompiledState<C> to;
  private final List<C> conditions;

  CompiledTransition(final CompiledState<C> from, final CompiledState<C> to,
      final List<C> conditions) {
    this.from = from;
    this.to = to;
    this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
  }

  public CompiledState<C> getFrom() {
    return from;
  }

  public CompiledState<C> getTo() {
    return to;
  }

  public List<C> getConditions() {
    return conditions;
  }

  @Override
  public String toString() {
    return "CompiledTransition [from=" + from.getLabel() + ", to=" + to.getLabel()
        + ", conditions=" + conditions + "]";
  }
}
