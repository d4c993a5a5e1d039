package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import com.github.automata.AutomatonException.Code;

/**
 * Tests for editing the drawn graph.
 */
public class GraphTest {

  @Test
  public void testConnectedAndReverse() throws AutomatonException {
    // 1. q0 <-> q1, q1 -> q2
    final Graph graph = new Graph();
    final GraphNode q0 = graph.addNode("q0", true, false);
    final GraphNode q1 = graph.addNode("q1", false, false);
    final GraphNode q2 = graph.addNode("q2", false, true);
    final GraphTransition forward = graph.addTransition(q0, q1, "a");
    final GraphTransition backward = graph.addTransition(q1, q0, "b");
    final GraphTransition onward = graph.addTransition(q1, q2, "a");

    // 2. direction matters
    assertTrue(graph.connected(q0, q1));
    assertTrue(graph.connected(q1, q0));
    assertTrue(graph.connected(q1, q2));
    assertFalse(graph.connected(q2, q1));
    assertFalse(graph.connected(q0, q2));

    // 3. reverse lookup
    assertSame(backward, graph.findReverse(forward));
    assertSame(forward, graph.findReverse(backward));
    assertNull(graph.findReverse(onward));
  }

  @Test
  public void testRemoveNodeDropsItsTransitions() throws AutomatonException {
    final Graph graph = new Graph();
    final GraphNode q0 = graph.addNode("q0", true, false);
    final GraphNode q1 = graph.addNode("q1", false, false);
    final GraphNode q2 = graph.addNode("q2", false, true);
    graph.addTransition(q0, q1, "a");
    graph.addTransition(q1, q1, "b");
    final GraphTransition kept = graph.addTransition(q0, q2, "b");
    graph.addTransition(q1, q2, "a");

    // 1. every transition touching q1 goes with it, self loop included
    assertTrue(graph.removeNode(q1));
    assertEquals(Arrays.asList(q0, q2), graph.getNodes());
    assertEquals(Arrays.asList(kept), graph.getTransitions());
    assertFalse(graph.containsNode(q1));

    // 2. removing twice is a no-op
    assertFalse(graph.removeNode(q1));
    assertEquals(2, graph.getNodes().size());
  }

  @Test
  public void testRemoveTransition() throws AutomatonException {
    final Graph graph = SampleGraphs.singleA();
    final GraphTransition transition = graph.getTransitions().get(0);
    assertTrue(graph.removeTransition(transition));
    assertFalse(graph.removeTransition(transition));
    assertTrue(graph.getTransitions().isEmpty());
    assertFalse(graph.connected(graph.getNodes().get(0), graph.getNodes().get(1)));
  }

  @Test
  public void testForeignEndpoint() {
    final Graph graph = new Graph();
    final GraphNode q0 = graph.addNode("q0", true, false);
    final GraphNode stranger = new GraphNode("q9", false, false);
    try {
      graph.addTransition(q0, stranger, "a");
      fail("q9 is not in the graph");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_GRAPH, expected.getCode());
    }
    assertTrue(graph.getTransitions().isEmpty());
  }
}
