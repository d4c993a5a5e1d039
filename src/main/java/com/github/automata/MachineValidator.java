package com.github.automata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AlphabetSet.AlphabetSetBuilder;
import com.github.automata.AutomatonException.Code;

/**
 * Decides whether a graph legally represents a machine of a given type and resolves the alphabets
 * it uses.
 *
 * Checks run in this order: initial states, Turing machine terminal states, condition grammar and
 * alphabet membership, then determinism/totality. The first violation wins.
 *
 * All bookkeeping is local to a single call and the graph is only read, so the same graph can be
 * validated against several types back to back.
 */
public final class MachineValidator {
  private static final Logger logger = LogManager.getLogger(MachineValidator.class.getSimpleName());

  static final String ACCEPT_LABEL = "accept";
  static final String REJECT_LABEL = "reject";

  /**
   * Returns the resolved alphabets: supplied alphabets unchanged, omitted ones inferred from the
   * transitions. Epsilon is never part of an inferred alphabet.
   */
  public static AlphabetSet validate(final Graph graph, final MachineType type,
      final AlphabetSet alphabets, final ValidationOptions options)
      throws MachineValidationException {
    final AlphabetSet requested = alphabets == null ? AlphabetSet.open() : alphabets;
    final boolean requireAllTransitions = options != null && options.isRequireAllTransitions();
    final AlphabetSet resolved;
    switch (type) {
      case DFA:
      case NFA:
        checkInitialStates(graph, type);
        resolved = validateFiniteAutomaton(graph, type, requested,
            type == MachineType.DFA || requireAllTransitions);
        break;
      case PDA:
        checkInitialStates(graph, type);
        resolved = validatePushdownAutomaton(graph, requested, requireAllTransitions);
        break;
      case TURING_MACHINE:
        checkInitialStates(graph, type);
        checkTerminalStates(graph);
        resolved = validateTuringMachine(graph, requested, requireAllTransitions);
        break;
      default:
        throw new IllegalArgumentException(
            "Cannot validate as " + type.getDisplayName() + ", resolve a concrete type first");
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Validated graph as %s with %s", type.getDisplayName(), resolved));
    }
    return resolved;
  }

  /**
   * DFA and Turing machines need exactly one initial state, PDA at least one. NFA accepts any
   * number, an NFA without initial states simply rejects everything.
   */
  private static void checkInitialStates(final Graph graph, final MachineType type)
      throws MachineValidationException {
    GraphNode initialNode = null;
    for (final GraphNode node : graph.getNodes()) {
      if (!node.isStart()) {
        continue;
      }
      if (initialNode != null
          && (type == MachineType.DFA || type == MachineType.TURING_MACHINE)) {
        throw new MachineValidationException(Code.MULTIPLE_INITIAL_STATES, type,
            "'" + initialNode.getLabel() + "' and '" + node.getLabel()
                + "' states both marked as initial states.");
      }
      if (initialNode == null) {
        initialNode = node;
      }
    }
    if (initialNode == null && type != MachineType.NFA) {
      throw new MachineValidationException(Code.NO_INITIAL_STATE, type, "no initial state.");
    }
  }

  private static void checkTerminalStates(final Graph graph) throws MachineValidationException {
    final MachineType type = MachineType.TURING_MACHINE;
    GraphNode acceptNode = null;
    GraphNode rejectNode = null;
    for (final GraphNode node : graph.getNodes()) {
      if (!node.isFinal()) {
        continue;
      }
      if (ACCEPT_LABEL.equals(node.getLabel())) {
        if (acceptNode != null) {
          throw new MachineValidationException(Code.MULTIPLE_ACCEPT_STATES, type,
              "Multiple accept states.");
        }
        acceptNode = node;
      } else if (REJECT_LABEL.equals(node.getLabel())) {
        if (rejectNode != null) {
          throw new MachineValidationException(Code.MULTIPLE_REJECT_STATES, type,
              "Multiple reject states.");
        }
        rejectNode = node;
      } else {
        throw new MachineValidationException(Code.ILLEGAL_FINAL_STATE, type, "End state '"
            + node.getLabel() + "' must be either an `accept` or a `reject` state (check labels).");
      }
    }
    if (acceptNode == null) {
      throw new MachineValidationException(Code.MISSING_ACCEPT_STATE, type, "no accept state.");
    }
    if (rejectNode == null) {
      throw new MachineValidationException(Code.MISSING_REJECT_STATE, type, "no reject state.");
    }
  }

  private static AlphabetSet validateFiniteAutomaton(final Graph graph, final MachineType type,
      final AlphabetSet requested, final boolean deterministic)
      throws MachineValidationException {
    final Optional<Set<String>> supplied = requested.getAlphabet();
    final Set<String> alphabet = seed(supplied);
    final Map<GraphTransition, List<String>> claims = new IdentityHashMap<>();
    for (final GraphTransition transition : graph.getTransitions()) {
      final List<String> symbols = new ArrayList<>();
      for (final String condition : transition.getConditions()) {
        final String symbol = ConditionGrammar.parseFiniteSymbol(type, condition, transition);
        admit(type, alphabet, supplied.isPresent(), symbol, transition, true,
            "not found in alphabet");
        symbols.add(symbol);
      }
      claims.put(transition, symbols);
    }
    if (deterministic) {
      checkCoverage(graph, type, claims, alphabet);
    }
    return AlphabetSetBuilder.newBuilder().alphabet(alphabet).build();
  }

  private static AlphabetSet validatePushdownAutomaton(final Graph graph,
      final AlphabetSet requested, final boolean requireAllTransitions)
      throws MachineValidationException {
    final MachineType type = MachineType.PDA;
    final Optional<Set<String>> suppliedAlphabet = requested.getAlphabet();
    final Optional<Set<String>> suppliedStack = requested.getStackAlphabet();
    final Set<String> alphabet = seed(suppliedAlphabet);
    final Set<String> stackAlphabet = seed(suppliedStack);
    final Map<GraphTransition, List<String>> claims = new IdentityHashMap<>();
    for (final GraphTransition transition : graph.getTransitions()) {
      final List<String> symbols = new ArrayList<>();
      for (final String condition : transition.getConditions()) {
        final PdaCondition parsed = ConditionGrammar.parsePdaCondition(condition, transition);
        admit(type, alphabet, suppliedAlphabet.isPresent(), parsed.getSymbol(), transition, true,
            "not found in alphabet");
        admit(type, stackAlphabet, suppliedStack.isPresent(), parsed.getReadStackSymbol(),
            transition, true, "not found in stack alphabet");
        admit(type, stackAlphabet, suppliedStack.isPresent(), parsed.getActionStackSymbol(),
            transition, true, "not found in stack alphabet");
        symbols.add(parsed.getSymbol());
      }
      claims.put(transition, symbols);
    }
    if (requireAllTransitions) {
      checkCoverage(graph, type, claims, alphabet);
    }
    return AlphabetSetBuilder.newBuilder().alphabet(alphabet).stackAlphabet(stackAlphabet)
        .build();
  }

  /**
   * The input alphabet of a Turing machine is never checked against its conditions, since the
   * head also reads symbols the machine wrote itself. When omitted it is inferred from the read
   * symbols, the blank excluded.
   */
  private static AlphabetSet validateTuringMachine(final Graph graph, final AlphabetSet requested,
      final boolean requireAllTransitions) throws MachineValidationException {
    final MachineType type = MachineType.TURING_MACHINE;
    final Optional<Set<String>> suppliedAlphabet = requested.getAlphabet();
    final Optional<Set<String>> suppliedTape = requested.getTapeAlphabet();
    final Set<String> alphabet = seed(suppliedAlphabet);
    final Set<String> tapeAlphabet = seed(suppliedTape);
    final Map<GraphTransition, List<String>> claims = new IdentityHashMap<>();
    for (final GraphTransition transition : graph.getTransitions()) {
      final List<String> symbols = new ArrayList<>();
      for (final String condition : transition.getConditions()) {
        final TmCondition parsed = ConditionGrammar.parseTmCondition(condition, transition);
        if (!suppliedAlphabet.isPresent()
            && !ConditionGrammar.BLANK.equals(parsed.getReadSymbol())) {
          alphabet.add(parsed.getReadSymbol());
        }
        admit(type, tapeAlphabet, suppliedTape.isPresent(), parsed.getReadSymbol(), transition,
            false, "not found in tape alphabet");
        admit(type, tapeAlphabet, suppliedTape.isPresent(), parsed.getWriteSymbol(), transition,
            false, "not found in tape alphabet");
        symbols.add(parsed.getReadSymbol());
      }
      claims.put(transition, symbols);
    }
    if (requireAllTransitions) {
      checkCoverage(graph, type, claims, tapeAlphabet);
    }
    return AlphabetSetBuilder.newBuilder().alphabet(alphabet).tapeAlphabet(tapeAlphabet).build();
  }

  /**
   * Every node with outgoing transitions must claim each covering symbol exactly once. Nodes
   * without outgoing transitions are dead ends and are left alone.
   */
  private static void checkCoverage(final Graph graph, final MachineType type,
      final Map<GraphTransition, List<String>> claims, final Set<String> covering)
      throws MachineValidationException {
    final Map<GraphNode, List<GraphTransition>> outgoingTransitions = new LinkedHashMap<>();
    for (final GraphTransition transition : graph.getTransitions()) {
      List<GraphTransition> outgoing = outgoingTransitions.get(transition.getFrom());
      if (outgoing == null) {
        outgoing = new ArrayList<>();
        outgoingTransitions.put(transition.getFrom(), outgoing);
      }
      outgoing.add(transition);
    }
    final boolean epsilonClaimsNothing = type != MachineType.TURING_MACHINE;
    for (final Map.Entry<GraphNode, List<GraphTransition>> entry : outgoingTransitions
        .entrySet()) {
      final GraphNode node = entry.getKey();
      final Set<String> searching = new LinkedHashSet<>(covering);
      final Set<String> claimed = new HashSet<>();
      for (final GraphTransition transition : entry.getValue()) {
        for (final String symbol : claims.get(transition)) {
          if (epsilonClaimsNothing && ConditionGrammar.isEpsilon(symbol)) {
            continue;
          }
          if (!claimed.add(symbol)) {
            throw new MachineValidationException(Code.DUPLICATE_TRANSITION, type, "Node '"
                + node.getLabel() + "' has more than one outgoing transition for symbol '"
                + symbol + "'.");
          }
          searching.remove(symbol);
        }
      }
      if (!searching.isEmpty()) {
        final StringBuilder missing = new StringBuilder();
        for (final String symbol : searching) {
          if (missing.length() > 0) {
            missing.append(", ");
          }
          missing.append('\'').append(symbol).append('\'');
        }
        throw new MachineValidationException(Code.MISSING_TRANSITIONS, type, "Node '"
            + node.getLabel() + "' is missing outgoing transitions for symbols " + missing + ".");
      }
    }
  }

  private static void admit(final MachineType type, final Set<String> symbols,
      final boolean closed, final String symbol, final GraphTransition transition,
      final boolean epsilonIsSpecial, final String extra) throws ConditionException {
    if (epsilonIsSpecial && ConditionGrammar.isEpsilon(symbol)) {
      return;
    }
    if (!closed) {
      symbols.add(symbol);
    } else if (!symbols.contains(symbol)) {
      throw new ConditionException(Code.SYMBOL_NOT_IN_ALPHABET, type, symbol, transition, extra);
    }
  }

  private static Set<String> seed(final Optional<Set<String>> supplied) {
    return supplied.isPresent() ? new LinkedHashSet<>(supplied.get()) : new LinkedHashSet<>();
  }

  private MachineValidator() {}
}
