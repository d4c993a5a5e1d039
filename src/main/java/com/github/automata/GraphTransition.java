package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.automata.AutomatonException.Code;

/**
 * A directed, labeled edge between two nodes. Self-loops are allowed. Conditions are kept as the
 * raw strings the user typed; they are only parsed during validation and compilation, so empty or
 * malformed conditions are tolerated here.
 */
public final class GraphTransition {
  private final GraphNode from;
  private final GraphNode to;
  private final List<String> conditions = new ArrayList<>();

  public GraphTransition(final GraphNode from, final GraphNode to, final List<String> conditions)
      throws AutomatonException {
    if (from == null || to == null) {
      throw new AutomatonException(Code.INVALID_GRAPH, "Transitions may only connect nodes");
    }
    this.from = from;
    this.to = to;
    if (conditions != null) {
      this.conditions.addAll(conditions);
    }
  }

  public GraphNode getFrom() {
    return from;
  }

  public GraphNode getTo() {
    return to;
  }

  public boolean isSelfLoop() {
    return from == to;
  }

  public List<String> getConditions() {
    return Collections.unmodifiableList(conditions);
  }

  public void setConditions(final List<String> conditions) {
    this.conditions.clear();
    if (conditions != null) {
      this.conditions.addAll(conditions);
    }
  }

  @Override
  public String toString() {
    return "GraphTransition [from=" + from.getLabel() + ", to=" + to.getLabel() + ", conditions="
        + conditions + "]";
  }
}
