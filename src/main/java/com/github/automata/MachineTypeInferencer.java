package com.github.automata;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves {@link MachineType#AUTO}. Types are tried in a fixed order, Turing machine, PDA, DFA
 * then NFA, and the first one that validates wins. Turing machines and PDAs go first because their
 * requirements (accept/reject labels, condition grammars) rarely hold by accident, whereas almost
 * any Turing machine drawing with single-character conditions would also pass as a DFA.
 */
public final class MachineTypeInferencer {
  private static final Logger logger =
      LogManager.getLogger(MachineTypeInferencer.class.getSimpleName());

  public static final List<MachineType> PRIORITY = Collections.unmodifiableList(Arrays.asList(
      MachineType.TURING_MACHINE, MachineType.PDA, MachineType.DFA, MachineType.NFA));

  /**
   * Compiles the graph as the first type in {@link #PRIORITY} that accepts it. Each attempt is a
   * fresh validate+compile.
   */
  public static CompiledMachine<?> infer(final Graph graph, final AlphabetSet alphabets,
      final ValidationOptions options) throws AutomatonException {
    final Map<MachineType, String> attemptFailures = new LinkedHashMap<>();
    for (final MachineType candidate : PRIORITY) {
      try {
        final CompiledMachine<?> machine =
            MachineCompiler.compile(graph, candidate, alphabets, options);
        logger.info(String.format("Inferred machine type %s", candidate.getDisplayName()));
        return machine;
      } catch (MachineValidationException rejection) {
        recordFailure(attemptFailures, candidate, rejection);
      }
    }
    logger.warn(String.format("Graph matches no machine type, attempts: %s", attemptFailures));
    throw new TypeInferenceException(attemptFailures);
  }

  /**
   * Same ordering as {@link #infer} but only validates. {@code requested} may be concrete, in which
   * case it is validated and returned as is.
   */
  public static MachineType determineType(final Graph graph, final MachineType requested,
      final AlphabetSet alphabets, final ValidationOptions options) throws AutomatonException {
    if (requested.isConcrete()) {
      MachineValidator.validate(graph, requested, alphabets, options);
      return requested;
    }
    final Map<MachineType, String> attemptFailures = new LinkedHashMap<>();
    for (final MachineType candidate : PRIORITY) {
      try {
        MachineValidator.validate(graph, candidate, alphabets, options);
        return candidate;
      } catch (MachineValidationException rejection) {
        recordFailure(attemptFailures, candidate, rejection);
      }
    }
    throw new TypeInferenceException(attemptFailures);
  }

  private static void recordFailure(final Map<MachineType, String> attemptFailures,
      final MachineType candidate, final MachineValidationException rejection) {
    attemptFailures.put(candidate, rejection.getMessage());
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Graph is not a %s: %s", candidate.getDisplayName(),
          rejection.getMessage()));
    }
  }

  private MachineTypeInferencer() {}
}
