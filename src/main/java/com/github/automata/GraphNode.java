package com.github.automata;

/**
 * A state as drawn by the user. Nodes are compared by identity: two nodes with the same label are
 * still two different states. The editor mutates nodes freely; the engine only reads them.
 */
public final class GraphNode {
  private String label;
  private boolean start;
  private boolean finalState;

  // only consumed by the exporter
  private double x;
  private double y;

  public GraphNode(final String label, final boolean start, final boolean finalState) {
    this.label = label == null ? "" : label;
    this.start = start;
    this.finalState = finalState;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(final String label) {
    this.label = label == null ? "" : label;
  }

  public boolean isStart() {
    return start;
  }

  public void setStart(final boolean start) {
    this.start = start;
  }

  public boolean isFinal() {
    return finalState;
  }

  public void setFinal(final boolean finalState) {
    this.finalState = finalState;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public GraphNode moveTo(final double x, final double y) {
    this.x = x;
    this.y = y;
    return this;
  }

  @Override
  public String toString() {
    return "GraphNode [label=" + label + ", start=" + start + ", final=" + finalState + "]";
  }
}
