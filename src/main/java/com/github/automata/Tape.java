package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sparse, two-way infinite Turing machine tape. Cells that were never written, or were written
 * with {@link ConditionGrammar#BLANK}, are empty.
 */
final class Tape {
  // K=cell index, V=symbol; blank cells are absent
  private final Map<Integer, String> cells = new HashMap<>();
  private int head;

  Tape(final List<String> input) {
    for (int index = 0; index < input.size(); index++) {
      write(index, input.get(index));
    }
  }

  String read() {
    final String symbol = cells.get(head);
    return symbol == null ? ConditionGrammar.BLANK : symbol;
  }

  void write(final String symbol) {
    write(head, symbol);
  }

  void move(final TapeMovement movement) {
    head += movement.getOffset();
  }

  int getHead() {
    return head;
  }

  /**
   * Cells from the leftmost to the rightmost non-blank one, gaps filled with blanks.
   */
  List<String> contents() {
    if (cells.isEmpty()) {
      return Collections.emptyList();
    }
    final int low = Collections.min(cells.keySet());
    final int high = Collections.max(cells.keySet());
    final List<String> contents = new ArrayList<>(high - low + 1);
    for (int index = low; index <= high; index++) {
      final String symbol = cells.get(index);
      contents.add(symbol == null ? ConditionGrammar.BLANK : symbol);
    }
    return contents;
  }

  private void write(final int index, final String symbol) {
    if (ConditionGrammar.BLANK.equals(symbol)) {
      cells.remove(index);
    } else {
      cells.put(index, symbol);
    }
  }

  @Override
  public String toString() {
    return "Tape [head=" + head + ", contents=" + contents() + "]";
  }
}
