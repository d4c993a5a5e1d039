package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Tests for the JFLAP export.
 */
public class JflapExporterTest {

  @Test
  public void testExportDfa() throws AutomatonException {
    final Graph graph = SampleGraphs.singleA();
    graph.getNodes().get(1).moveTo(120.0, 80.0);
    final String expected =
        "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?><!--Created with JFLAP 7.1.-->"
            + "<structure>\n"
            + "\t<type>fa</type>\n"
            + "\t<automaton>\n"
            + "\t\t<!--The list of states.-->\n"
            + "\t\t<state id=\"0\" name=\"q0\">\n"
            + "\t\t\t<x>0.0</x>\n"
            + "\t\t\t<y>0.0</y>\n"
            + "\t\t\t<initial/>\n"
            + "\t\t</state>\n"
            + "\t\t<state id=\"1\" name=\"q1\">\n"
            + "\t\t\t<x>120.0</x>\n"
            + "\t\t\t<y>80.0</y>\n"
            + "\t\t\t<final/>\n"
            + "\t\t</state>\n"
            + "\t\t<!--The list of transitions.-->\n"
            + "\t\t<transition>\n"
            + "\t\t\t<from>0</from>\n"
            + "\t\t\t<to>1</to>\n"
            + "\t\t\t<read>a</read>\n"
            + "\t\t</transition>\n"
            + "\t</automaton>\n"
            + "</structure>";
    assertEquals(expected, JflapExporter.export(graph, MachineType.DFA));
    // deterministic
    assertEquals(expected, JflapExporter.export(graph, MachineType.DFA));
  }

  @Test
  public void testExportNfaEpsilon() throws AutomatonException {
    final String xml = JflapExporter.export(SampleGraphs.epsilonBranching(), MachineType.NFA);
    assertTrue(xml.contains("<type>fa</type>"));
    assertTrue(xml.contains("<read/>"));
    assertFalse(xml.contains("ε"));
    // one element per condition
    assertEquals(3, xml.split("<transition>", -1).length - 1);
  }

  @Test
  public void testExportPda() throws AutomatonException {
    final String xml = JflapExporter.export(SampleGraphs.anbn(), MachineType.PDA);
    assertTrue(xml.contains("<type>pda</type>"));
    // "ε ε P Z": nothing popped, Z pushed
    assertTrue(xml.contains("\t\t\t<read/>\n\t\t\t<pop/>\n\t\t\t<push>Z</push>\n"));
    // "b A p A": A popped, nothing pushed
    assertTrue(xml.contains("\t\t\t<read>b</read>\n\t\t\t<pop>A</pop>\n\t\t\t<push/>\n"));
  }

  @Test
  public void testExportPdaPushOverGate() throws AutomatonException {
    // "a X P Y" keeps X under the new Y
    final Graph graph = new Graph();
    final GraphNode q0 = graph.addNode("q0", true, false);
    graph.addTransition(q0, q0, "a X P Y");
    final String xml = JflapExporter.export(graph, MachineType.PDA);
    assertTrue(xml.contains("\t\t\t<read>a</read>\n\t\t\t<pop>X</pop>\n\t\t\t<push>YX</push>\n"));
  }

  @Test
  public void testExportTuringMachine() throws AutomatonException {
    final String xml = JflapExporter.export(SampleGraphs.bitFlipper(), MachineType.TURING_MACHINE);
    assertTrue(xml.contains("<type>turing</type>"));
    assertTrue(
        xml.contains("\t\t\t<read>0</read>\n\t\t\t<write>1</write>\n\t\t\t<move>R</move>\n"));
    // blank is empty, N is JFLAP's S
    assertTrue(xml.contains("\t\t\t<read/>\n\t\t\t<write/>\n\t\t\t<move>S</move>\n"));
    assertTrue(xml.contains("<state id=\"1\" name=\"accept\">"));
  }

  @Test
  public void testXmlEscape() {
    assertEquals("a&amp;b&lt;c&gt;&quot;d&apos;", JflapExporter.xmlEscape("a&b<c>\"d'"));
    assertEquals("&amp;lt;", JflapExporter.xmlEscape("&lt;"));
  }
}
