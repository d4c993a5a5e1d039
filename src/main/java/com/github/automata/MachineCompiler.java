package com.github.automata;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AutomatonException.Code;

/**
 * Turns a graph into an immutable {@link CompiledMachine}. Compilation always validates first with
 * the same parameters, so an invalid graph can never be compiled, and either a complete machine
 * is returned or nothing is.
 *
 * Two passes: the first maps every node to a state in drawing order, the second resolves every
 * transition through that mapping and appends it to its source state. Both keep the graph's
 * insertion order, which later decides the order nondeterministic branches are explored in.
 */
public final class MachineCompiler {
  private static final Logger logger = LogManager.getLogger(MachineCompiler.class.getSimpleName());

  /**
   * {@link MachineType#AUTO} is handed to {@link MachineTypeInferencer}.
   */
  public static CompiledMachine<?> compile(final Graph graph, final MachineType type,
      final AlphabetSet alphabets, final ValidationOptions options) throws AutomatonException {
    if (type == MachineType.AUTO) {
      return MachineTypeInferencer.infer(graph, alphabets, options);
    }
    final AlphabetSet resolved = MachineValidator.validate(graph, type, alphabets, options);
    final CompiledMachine<?> machine;
    switch (type) {
      case DFA:
        machine = compileDfa(graph, resolved);
        break;
      case NFA:
        machine = compileNfa(graph, resolved);
        break;
      case PDA:
        machine = compilePda(graph, resolved);
        break;
      case TURING_MACHINE:
        machine = compileTuringMachine(graph, resolved);
        break;
      default:
        throw new IllegalArgumentException("Unsupported machine type " + type);
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Compiled %s", machine));
    }
    return machine;
  }

  private static Dfa compileDfa(final Graph graph, final AlphabetSet resolved)
      throws AutomatonException {
    final Set<String> alphabet = resolved.getAlphabet().get();
    final Map<GraphNode, CompiledState<String>> stateMap = new IdentityHashMap<>();
    final List<CompiledState<String>> states = createStates(graph, stateMap);
    wire(graph, stateMap, new ConditionCompiler<String>() {
      @Override
      public String compile(final String condition, final GraphTransition transition)
          throws MachineValidationException {
        final String symbol =
            ConditionGrammar.parseFiniteSymbol(MachineType.DFA, condition, transition);
        requireMember(MachineType.DFA, alphabet, symbol, transition, "unrecognized symbol");
        return symbol;
      }
    });
    final CompiledState<String> initial = initialStates(states).get(0);
    return new Dfa(states, initial, alphabet);
  }

  private static Nfa compileNfa(final Graph graph, final AlphabetSet resolved)
      throws AutomatonException {
    final Set<String> alphabet = resolved.getAlphabet().get();
    final Map<GraphNode, CompiledState<String>> stateMap = new IdentityHashMap<>();
    final List<CompiledState<String>> states = createStates(graph, stateMap);
    wire(graph, stateMap, new ConditionCompiler<String>() {
      @Override
      public String compile(final String condition, final GraphTransition transition)
          throws MachineValidationException {
        final String symbol =
            ConditionGrammar.parseFiniteSymbol(MachineType.NFA, condition, transition);
        if (!ConditionGrammar.isEpsilon(symbol)) {
          requireMember(MachineType.NFA, alphabet, symbol, transition, "unrecognized symbol");
        }
        return symbol;
      }
    });
    return new Nfa(states, initialStates(states), alphabet);
  }

  private static Pda compilePda(final Graph graph, final AlphabetSet resolved)
      throws AutomatonException {
    final Set<String> alphabet = resolved.getAlphabet().get();
    final Set<String> stackAlphabet = resolved.getStackAlphabet().get();
    final Map<GraphNode, CompiledState<PdaCondition>> stateMap = new IdentityHashMap<>();
    final List<CompiledState<PdaCondition>> states = createStates(graph, stateMap);
    wire(graph, stateMap, new ConditionCompiler<PdaCondition>() {
      @Override
      public PdaCondition compile(final String condition, final GraphTransition transition)
          throws MachineValidationException {
        final PdaCondition parsed = ConditionGrammar.parsePdaCondition(condition, transition);
        if (!ConditionGrammar.isEpsilon(parsed.getSymbol())) {
          requireMember(MachineType.PDA, alphabet, parsed.getSymbol(), transition,
              "unrecognized symbol");
        }
        for (final String stackSymbol : new String[] {parsed.getReadStackSymbol(),
            parsed.getActionStackSymbol()}) {
          if (!ConditionGrammar.isEpsilon(stackSymbol)) {
            requireMember(MachineType.PDA, stackAlphabet, stackSymbol, transition,
                "unrecognized stack symbol");
          }
        }
        return parsed;
      }
    });
    return new Pda(states, initialStates(states), alphabet, stackAlphabet);
  }

  private static TuringMachine compileTuringMachine(final Graph graph,
      final AlphabetSet resolved) throws AutomatonException {
    final Set<String> tapeAlphabet = resolved.getTapeAlphabet().get();
    final Map<GraphNode, CompiledState<TmCondition>> stateMap = new IdentityHashMap<>();
    final List<CompiledState<TmCondition>> states = createStates(graph, stateMap);
    wire(graph, stateMap, new ConditionCompiler<TmCondition>() {
      @Override
      public TmCondition compile(final String condition, final GraphTransition transition)
          throws MachineValidationException {
        final TmCondition parsed = ConditionGrammar.parseTmCondition(condition, transition);
        requireMember(MachineType.TURING_MACHINE, tapeAlphabet, parsed.getReadSymbol(),
            transition, "unrecognized tape symbol");
        requireMember(MachineType.TURING_MACHINE, tapeAlphabet, parsed.getWriteSymbol(),
            transition, "unrecognized tape symbol");
        return parsed;
      }
    });
    CompiledState<TmCondition> acceptState = null;
    CompiledState<TmCondition> rejectState = null;
    for (final CompiledState<TmCondition> state : states) {
      if (state.isFinal() && MachineValidator.ACCEPT_LABEL.equals(state.getLabel())) {
        acceptState = state;
      } else if (state.isFinal() && MachineValidator.REJECT_LABEL.equals(state.getLabel())) {
        rejectState = state;
      }
    }
    return new TuringMachine(states, initialStates(states).get(0), acceptState, rejectState,
        resolved.getAlphabet().get(), tapeAlphabet);
  }

  private static <C> List<CompiledState<C>> createStates(final Graph graph,
      final Map<GraphNode, CompiledState<C>> stateMap) {
    final List<CompiledState<C>> states = new ArrayList<>(graph.getNodes().size());
    for (final GraphNode node : graph.getNodes()) {
      final CompiledState<C> state =
          new CompiledState<>(node.getLabel(), node.isStart(), node.isFinal());
      stateMap.put(node, state);
      states.add(state);
    }
    return states;
  }

  private static <C> void wire(final Graph graph, final Map<GraphNode, CompiledState<C>> stateMap,
      final ConditionCompiler<C> conditionCompiler) throws AutomatonException {
    for (final GraphTransition transition : graph.getTransitions()) {
      final CompiledState<C> from = stateMap.get(transition.getFrom());
      final CompiledState<C> to = stateMap.get(transition.getTo());
      if (from == null || to == null) {
        throw new AutomatonException(Code.INVALID_GRAPH,
            "Transition references a node outside the graph: " + transition);
      }
      final List<C> conditions = new ArrayList<>(transition.getConditions().size());
      for (final String condition : transition.getConditions()) {
        conditions.add(conditionCompiler.compile(condition, transition));
      }
      from.addTransition(new CompiledTransition<>(from, to, conditions));
    }
    for (final CompiledState<C> state : stateMap.values()) {
      state.freeze();
    }
  }

  private static <C> List<CompiledState<C>> initialStates(final List<CompiledState<C>> states) {
    final List<CompiledState<C>> initial = new ArrayList<>();
    for (final CompiledState<C> state : states) {
      if (state.isInitial()) {
        initial.add(state);
      }
    }
    return initial;
  }

  private static void requireMember(final MachineType type, final Set<String> alphabet,
      final String symbol, final GraphTransition transition, final String extra)
      throws SymbolException {
    if (!alphabet.contains(symbol)) {
      throw new SymbolException(Code.UNRECOGNIZED_SYMBOL, type, symbol, transition, extra);
    }
  }

  private interface ConditionCompiler<C> {
    C compile(String condition, GraphTransition transition) throws MachineValidationException;
  }

  private MachineCompiler() {}
}
