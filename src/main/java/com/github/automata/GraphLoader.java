package com.github.automata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AutomatonException.Code;
import com.github.automata.GraphRecord.NodeRecord;
import com.github.automata.GraphRecord.TransitionRecord;

/**
 * Converts between a {@link Graph} and the flat record list used by the persistence layer.
 */
public final class GraphLoader {
  private static final Logger logger = LogManager.getLogger(GraphLoader.class.getSimpleName());

  /**
   * Materializes records in order. A transition may only reference node ids that appeared earlier
   * in the list.
   */
  public static Graph load(final List<? extends GraphRecord> records) throws AutomatonException {
    if (records == null) {
      throw new AutomatonException(Code.INVALID_GRAPH, "Graph records are null");
    }
    final Graph graph = new Graph();
    // K=record id, V=node or transition materialized from it
    final Map<Integer, Object> entities = new HashMap<>();
    for (final GraphRecord record : records) {
      if (record == null) {
        throw new AutomatonException(Code.INVALID_GRAPH, "Graph records contain a null record");
      }
      if (entities.containsKey(record.getId())) {
        throw new AutomatonException(Code.INVALID_GRAPH, "Duplicate record id " + record.getId());
      }
      if (record instanceof NodeRecord) {
        final NodeRecord nodeRecord = (NodeRecord) record;
        final GraphNode node = graph.addNode(
            new GraphNode(nodeRecord.getLabel(), nodeRecord.isStart(), nodeRecord.isFinal())
                .moveTo(nodeRecord.getX(), nodeRecord.getY()));
        entities.put(record.getId(), node);
      } else if (record instanceof TransitionRecord) {
        final TransitionRecord transitionRecord = (TransitionRecord) record;
        final Object from = entities.get(transitionRecord.getFromId());
        final Object to = entities.get(transitionRecord.getToId());
        if (!(from instanceof GraphNode) || !(to instanceof GraphNode)) {
          throw new AutomatonException(Code.INVALID_GRAPH,
              "Transitions may only connect from nodes to nodes: " + transitionRecord);
        }
        final GraphTransition transition = graph.addTransition(new GraphTransition(
            (GraphNode) from, (GraphNode) to, transitionRecord.getConditions()));
        entities.put(record.getId(), transition);
      } else {
        throw new AutomatonException(Code.INVALID_GRAPH,
            "Unsupported record type " + record.getClass().getSimpleName());
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Loaded graph with %d nodes and %d transitions",
          graph.getNodes().size(), graph.getTransitions().size()));
    }
    return graph;
  }

  /**
   * Produces records for every node, then every transition, with ids assigned from 0 upwards.
   */
  public static List<GraphRecord> dehydrate(final Graph graph) {
    final List<GraphRecord> records = new ArrayList<>();
    final Map<GraphNode, Integer> nodeIds = new IdentityHashMap<>();
    int id = 0;
    for (final GraphNode node : graph.getNodes()) {
      nodeIds.put(node, id);
      records.add(new NodeRecord(id, node.getLabel(), node.getX(), node.getY(), node.isStart(),
          node.isFinal()));
      id++;
    }
    for (final GraphTransition transition : graph.getTransitions()) {
      records.add(new TransitionRecord(id, nodeIds.get(transition.getFrom()),
          nodeIds.get(transition.getTo()), transition.getConditions()));
      id++;
    }
    return records;
  }

  private GraphLoader() {}
}
