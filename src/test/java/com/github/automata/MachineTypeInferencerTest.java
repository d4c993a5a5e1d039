package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Map;

import org.junit.Test;

import com.github.automata.AutomatonException.Code;

/**
 * Tests for Auto type inference.
 */
public class MachineTypeInferencerTest {

  @Test
  public void testInferEachModel() throws AutomatonException {
    assertEquals(MachineType.DFA, MachineCompiler
        .compile(SampleGraphs.singleA(), MachineType.AUTO, null, null).getType());
    assertEquals(MachineType.NFA, MachineCompiler
        .compile(SampleGraphs.epsilonBranching(), MachineType.AUTO, null, null).getType());
    assertEquals(MachineType.PDA,
        MachineCompiler.compile(SampleGraphs.anbn(), MachineType.AUTO, null, null).getType());
    assertEquals(MachineType.TURING_MACHINE, MachineCompiler
        .compile(SampleGraphs.bitFlipper(), MachineType.AUTO, null, null).getType());
  }

  @Test
  public void testTuringMachineWinsOverDfa() throws AutomatonException {
    // structurally a TM, and trivially a DFA too
    final Graph graph = new Graph();
    graph.addNode("q0", true, false);
    graph.addNode("accept", false, true);
    graph.addNode("reject", false, true);
    MachineValidator.validate(graph, MachineType.DFA, null, null);

    assertEquals(MachineType.TURING_MACHINE,
        MachineTypeInferencer.infer(graph, null, null).getType());
    assertEquals(MachineType.TURING_MACHINE,
        MachineTypeInferencer.determineType(graph, MachineType.AUTO, null, null));
  }

  @Test
  public void testNoMatchingType() throws AutomatonException {
    // multi-character condition fits no grammar
    final Graph graph = new Graph();
    final GraphNode q0 = graph.addNode("q0", true, false);
    final GraphNode q1 = graph.addNode("q1", false, true);
    graph.addTransition(q0, q1, "ab");
    try {
      MachineCompiler.compile(graph, MachineType.AUTO, AlphabetSet.open(),
          ValidationOptions.DEFAULT);
      fail("nothing compiles");
    } catch (TypeInferenceException expected) {
      assertEquals(Code.NO_MATCHING_MACHINE_TYPE, expected.getCode());
      assertEquals(
          "Unable to compile as any automaton model; check your machine and try again.",
          expected.getMessage());
      final Map<MachineType, String> failures = expected.getAttemptFailures();
      assertEquals(MachineTypeInferencer.PRIORITY, new ArrayList<>(failures.keySet()));
      assertTrue(failures.get(MachineType.TURING_MACHINE).contains("q1"));
      assertTrue(failures.get(MachineType.PDA).startsWith("Failed to validate as PDA: "));
      assertTrue(failures.get(MachineType.DFA).contains("must be one character long"));
    }
  }

  @Test
  public void testDetermineConcreteType() throws AutomatonException {
    assertEquals(MachineType.NFA, MachineTypeInferencer.determineType(SampleGraphs.singleA(),
        MachineType.NFA, null, null));
    try {
      MachineTypeInferencer.determineType(SampleGraphs.epsilonBranching(), MachineType.DFA, null,
          null);
      fail("epsilon is not DFA");
    } catch (MachineValidationException expected) {
      assertEquals(Code.MALFORMED_CONDITION, expected.getCode());
    }
  }
}
