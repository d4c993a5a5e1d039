package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only snapshot of one live execution branch, for display. For a Turing machine the cursor is
 * the head position on the tape; for the other machines it indexes into the input.
 */
public final class Timeline {
  private final CompiledState<?> state;
  private final int cursor;
  private final List<String> stack;

  Timeline(final CompiledState<?> state, final int cursor, final List<String> stack) {
    this.state = state;
    this.cursor = cursor;
    this.stack = stack == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(stack));
  }

  public CompiledState<?> getState() {
    return state;
  }

  public int getCursor() {
    return cursor;
  }

  /**
   * Bottom of the stack first. Always empty unless the machine is a PDA.
   */
  public List<String> getStack() {
    return stack;
  }

  @Override
  public String toString() {
    return "Timeline [state=" + state.getLabel() + ", cursor=" + cursor + ", stack=" + stack + "]";
  }
}
