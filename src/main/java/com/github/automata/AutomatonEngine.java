package com.github.automata;

import java.util.List;
import java.util.Optional;

/**
 * An automaton workbench: one drawn {@link Graph}, the machine most recently compiled from it, and
 * a simulator to run that machine.
 *
 * Notes for users:<br>
 * 1. the engine is thread-safe. Compiling and driving the step-by-step simulation are exclusive;
 * eval, batch evaluation, validation and export share the engine and may run concurrently<br>
 *
 * 2. the graph is NOT guarded by the engine. Edit it from one thread and compile afterwards; a
 * compiled machine never sees later edits<br>
 *
 * 3. it is designed to not be singleton within a process, so, if there's a desire to have many
 * engines, just create as many as needed<br>
 *
 * 4. a failed compilation leaves the previous machine and any running simulation in place; a
 * successful one replaces the machine and ends the simulation<br>
 */
public interface AutomatonEngine {

  ///// Machine API /////
  /**
   * Validate and compile the graph as {@code type}, {@link MachineType#AUTO} trying every model in
   * turn. On success the new machine becomes the active one.
   */
  CompiledMachine<?> compile(final MachineType type, final AlphabetSet alphabets,
      final ValidationOptions options) throws AutomatonException;

  /**
   * Validate without compiling. Returns the resolved alphabets.
   */
  AlphabetSet validate(final MachineType type, final AlphabetSet alphabets,
      final ValidationOptions options) throws AutomatonException;

  Optional<CompiledMachine<?>> getActiveMachine() throws AutomatonException;

  /**
   * Export the graph as a JFLAP document, {@link MachineType#AUTO} picking the type the same way
   * compile would.
   */
  String exportJflap(final MachineType type, final AlphabetSet alphabets,
      final ValidationOptions options) throws AutomatonException;


  ///// Simulation API /////
  /**
   * Start a step-by-step simulation of the active machine.
   */
  void simulate(final String input) throws AutomatonException;

  StepResult advance() throws AutomatonException;

  List<Timeline> getTimelines() throws AutomatonException;

  SimulatorState getSimulatorState() throws AutomatonException;

  /**
   * Back to the state right after compilation.
   */
  void resetSimulation() throws AutomatonException;

  /**
   * Stop simulating and unload the active machine.
   */
  void endSimulation() throws AutomatonException;

  /**
   * Run the input to completion. Independent of any step-by-step simulation.
   */
  EvalResult eval(final String input) throws AutomatonException;

  /**
   * Run every test case against the active machine; see {@link TestSuiteEvaluator}.
   */
  List<TestCaseResult> evaluate(final List<TestCase> testCases) throws AutomatonException;


  ///// Engine Functions /////
  Graph getGraph();

  /**
   * Reports the id of this engine instance.
   */
  String getId();

  EngineConfiguration getConfiguration();

  EngineStatistics getStatistics();

  boolean alive();

  /**
   * Stop the evaluation pool and drop the machine. Any further call fails.
   */
  boolean shutdown() throws AutomatonException;

  /**
   * A simple builder to let users use fluent APIs to build engines.
   */
  public final static class AutomatonEngineBuilder {
    private EngineConfiguration config;
    private Graph graph;

    public static AutomatonEngineBuilder newBuilder() {
      return new AutomatonEngineBuilder();
    }

    public AutomatonEngineBuilder config(final EngineConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Start from an existing graph instead of an empty one.
     */
    public AutomatonEngineBuilder graph(final Graph graph) {
      this.graph = graph;
      return this;
    }

    public AutomatonEngine build() throws AutomatonException {
      return new AutomatonEngineImpl(config, graph);
    }

    private AutomatonEngineBuilder() {}
  }

}
