package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dehydrated form of a graph entity as handed over by the persistence layer. A record is either a
 * {@link NodeRecord} or a {@link TransitionRecord}; transitions reference nodes by id.
 */
public abstract class GraphRecord {
  private final int id;

  GraphRecord(final int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  public static final class NodeRecord extends GraphRecord {
    private final String label;
    private final double x;
    private final double y;
    private final boolean start;
    private final boolean finalState;

    public NodeRecord(final int id, final String label, final double x, final double y,
        final boolean start, final boolean finalState) {
      super(id);
      this.label = label;
      this.x = x;
      this.y = y;
      this.start = start;
      this.finalState = finalState;
    }

    public String getLabel() {
      return label;
    }

    public double getX() {
      return x;
    }

    public double getY() {
      return y;
    }

    public boolean isStart() {
      return start;
    }

    public boolean isFinal() {
      return finalState;
    }

    @Override
    public String toString() {
      return "NodeRecord [id=" + getId() + ", label=" + label + ", x=" + x + ", y=" + y
          + ", start=" + start + ", final=" + finalState + "]";
    }
  }

  public static final class TransitionRecord extends GraphRecord {
    private final int fromId;
    private final int toId;
    private final List<String> conditions;

    public TransitionRecord(final int id, final int fromId, final int toId,
        final List<String> conditions) {
      super(id);
      this.fromId = fromId;
      this.toId = toId;
      this.conditions = conditions == null ? Collections.<String>emptyList()
          : Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public int getFromId() {
      return fromId;
    }

    public int getToId() {
      return toId;
    }

    public List<String> getConditions() {
      return conditions;
    }

    @Override
    public String toString() {
      return "TransitionRecord [id=" + getId() + ", fromId=" + fromId + ", toId=" + toId
          + ", conditions=" + conditions + "]";
    }
  }
}
