package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The raw, editor-facing graph: nodes and directed transitions in insertion order. Insertion order
 * matters because it decides the order in which nondeterministic branches are explored.
 *
 * Not thread-safe. The engine never mutates a graph while validating or compiling it.
 */
public final class Graph {
  private final List<GraphNode> nodes = new ArrayList<>();
  private final List<GraphTransition> transitions = new ArrayList<>();

  public GraphNode addNode(final GraphNode node) {
    if (node != null && !containsNode(node)) {
      nodes.add(node);
    }
    return node;
  }

  public GraphNode addNode(final String label, final boolean start, final boolean finalState) {
    return addNode(new GraphNode(label, start, finalState));
  }

  public GraphTransition addTransition(final GraphTransition transition)
      throws AutomatonException {
    if (!containsNode(transition.getFrom()) || !containsNode(transition.getTo())) {
      throw new AutomatonException(AutomatonException.Code.INVALID_GRAPH,
          "Transition endpoints must belong to the graph: " + transition);
    }
    transitions.add(transition);
    return transition;
  }

  public GraphTransition addTransition(final GraphNode from, final GraphNode to,
      final String... conditions) throws AutomatonException {
    final List<String> list = new ArrayList<>(conditions.length);
    Collections.addAll(list, conditions);
    return addTransition(new GraphTransition(from, to, list));
  }

  /**
   * Removes the node together with every transition touching it.
   */
  public boolean removeNode(final GraphNode node) {
    boolean removed = false;
    for (final Iterator<GraphNode> iterator = nodes.iterator(); iterator.hasNext();) {
      if (iterator.next() == node) {
        iterator.remove();
        removed = true;
      }
    }
    if (removed) {
      for (final Iterator<GraphTransition> iterator = transitions.iterator(); iterator.hasNext();) {
        final GraphTransition transition = iterator.next();
        if (transition.getFrom() == node || transition.getTo() == node) {
          iterator.remove();
        }
      }
    }
    return removed;
  }

  public boolean removeTransition(final GraphTransition transition) {
    for (final Iterator<GraphTransition> iterator = transitions.iterator(); iterator.hasNext();) {
      if (iterator.next() == transition) {
        iterator.remove();
        return true;
      }
    }
    return false;
  }

  public List<GraphNode> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<GraphTransition> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  public boolean containsNode(final GraphNode node) {
    for (final GraphNode candidate : nodes) {
      if (candidate == node) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether a transition from->to already exists.
   */
  public boolean connected(final GraphNode from, final GraphNode to) {
    for (final GraphTransition transition : transitions) {
      if (transition.getFrom() == from && transition.getTo() == to) {
        return true;
      }
    }
    return false;
  }

  /**
   * Finds the transition going the opposite way of the given one, if any.
   */
  public GraphTransition findReverse(final GraphTransition transition) {
    for (final GraphTransition candidate : transitions) {
      if (candidate.getFrom() == transition.getTo() && candidate.getTo() == transition.getFrom()) {
        return candidate;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "Graph [nodes=" + nodes + ", transitions=" + transitions + "]";
  }
}
