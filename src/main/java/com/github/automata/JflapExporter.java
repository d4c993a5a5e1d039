package com.github.automata;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a graph as a JFLAP 7.1 document. Output depends only on the graph and the type: states
 * are numbered in drawing order and there is one {@code <transition>} element per condition.
 *
 * Epsilon, and the blank on a Turing tape, are written as empty elements, which is how JFLAP
 * spells them. Stack conditions are rewritten into JFLAP's pop-then-push form:<br>
 * {@code a X P Y} pops X and pushes YX (nothing popped when X is epsilon)<br>
 * {@code a X p Y} pops Y (or X when Y is epsilon)<br>
 */
public final class JflapExporter {
  private static final String HEADER =
      "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?><!--Created with JFLAP 7.1.-->";

  /**
   * The graph must already be valid as {@code type}.
   */
  public static String export(final Graph graph, final MachineType type)
      throws AutomatonException {
    if (type == null || !type.isConcrete()) {
      throw new IllegalArgumentException("Cannot export as " + type + ", resolve a concrete type");
    }
    final Map<GraphNode, Integer> nodeIds = new IdentityHashMap<>();
    final StringBuilder xml = new StringBuilder(HEADER).append("<structure>\n");
    xml.append("\t<type>").append(type.getJflapType()).append("</type>\n");
    xml.append("\t<automaton>\n");
    xml.append("\t\t<!--The list of states.-->\n");
    final List<GraphNode> nodes = graph.getNodes();
    for (int id = 0; id < nodes.size(); id++) {
      final GraphNode node = nodes.get(id);
      nodeIds.put(node, id);
      xml.append("\t\t<state id=\"").append(id).append("\" name=\"")
          .append(xmlEscape(node.getLabel())).append("\">\n");
      xml.append("\t\t\t<x>").append(node.getX()).append("</x>\n");
      xml.append("\t\t\t<y>").append(node.getY()).append("</y>\n");
      if (node.isStart()) {
        xml.append("\t\t\t<initial/>\n");
      }
      if (node.isFinal()) {
        xml.append("\t\t\t<final/>\n");
      }
      xml.append("\t\t</state>\n");
    }
    xml.append("\t\t<!--The list of transitions.-->\n");
    for (final GraphTransition transition : graph.getTransitions()) {
      for (final String condition : transition.getConditions()) {
        xml.append("\t\t<transition>\n");
        xml.append("\t\t\t<from>").append(nodeIds.get(transition.getFrom())).append("</from>\n");
        xml.append("\t\t\t<to>").append(nodeIds.get(transition.getTo())).append("</to>\n");
        switch (type) {
          case DFA:
          case NFA:
            element(xml, "read", condition);
            break;
          case PDA:
            pdaElements(xml, ConditionGrammar.parsePdaCondition(condition, transition));
            break;
          case TURING_MACHINE:
            tmElements(xml, ConditionGrammar.parseTmCondition(condition, transition));
            break;
          default:
            throw new IllegalArgumentException("Unsupported machine type " + type);
        }
        xml.append("\t\t</transition>\n");
      }
    }
    xml.append("\t</automaton>\n");
    xml.append("</structure>");
    return xml.toString();
  }

  private static void pdaElements(final StringBuilder xml, final PdaCondition condition) {
    element(xml, "read", condition.getSymbol());
    final String readStack = condition.getReadStackSymbol();
    final String actionSymbol = condition.getActionStackSymbol();
    switch (condition.getAction()) {
      case PUSH:
        element(xml, "pop", readStack);
        element(xml, "push", concat(actionSymbol, readStack));
        break;
      case POP:
        element(xml, "pop", ConditionGrammar.isEpsilon(actionSymbol) ? readStack : actionSymbol);
        element(xml, "push", ConditionGrammar.EPSILON);
        break;
      default:
        throw new IllegalStateException("Unknown stack action " + condition.getAction());
    }
  }

  private static void tmElements(final StringBuilder xml, final TmCondition condition) {
    element(xml, "read", blankToEmpty(condition.getReadSymbol()));
    element(xml, "write", blankToEmpty(condition.getWriteSymbol()));
    // JFLAP calls "no movement" S (stay)
    element(xml, "move",
        condition.getMovement() == TapeMovement.NONE ? "S"
            : String.valueOf(condition.getMovement().getToken()));
  }

  private static String concat(final String top, final String below) {
    final StringBuilder pushed = new StringBuilder();
    if (!ConditionGrammar.isEpsilon(top)) {
      pushed.append(top);
    }
    if (!ConditionGrammar.isEpsilon(below)) {
      pushed.append(below);
    }
    return pushed.length() == 0 ? ConditionGrammar.EPSILON : pushed.toString();
  }

  private static String blankToEmpty(final String symbol) {
    return ConditionGrammar.BLANK.equals(symbol) ? ConditionGrammar.EPSILON : symbol;
  }

  private static void element(final StringBuilder xml, final String name, final String value) {
    if (ConditionGrammar.isEpsilon(value)) {
      xml.append("\t\t\t<").append(name).append("/>\n");
    } else {
      xml.append("\t\t\t<").append(name).append('>').append(xmlEscape(value)).append("</")
          .append(name).append(">\n");
    }
  }

  static String xmlEscape(final String text) {
    if (text == null) {
      return "";
    }
    // ampersand first, or the other entities get escaped twice
    return text.replace("&", "&amp;").replace("\"", "&quot;").replace("'", "&apos;")
        .replace("<", "&lt;").replace(">", "&gt;");
  }

  private JflapExporter() {}
}
