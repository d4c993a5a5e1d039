package com.github.automata;

import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AutomatonException.Code;

/**
 * Runs a compiled machine, either one step at a time ({@link #simulate(String)} then
 * {@link #advance()}) or to completion ({@link #eval(String)}).
 *
 * Notes for users:<br>
 * 1. a simulator is NOT thread-safe; {@link AutomatonEngine} serializes access to the one it
 * owns<br>
 * 2. eval never touches the step-by-step simulation, so both can be used side by side<br>
 * 3. the loaded machine is immutable, so any number of simulators may share it<br>
 * 4. once a step returns a terminal result the simulation is discarded and the simulator is back
 * to {@link SimulatorState#LOADED}<br>
 */
public final class Simulator {
  private static final Logger logger = LogManager.getLogger(Simulator.class.getSimpleName());

  private final long maxEvaluationSteps;

  private CompiledMachine<?> machine;
  private Execution execution;
  private String input;

  public Simulator() {
    this(EngineConfiguration.DEFAULT_MAX_EVALUATION_STEPS);
  }

  public Simulator(final long maxEvaluationSteps) {
    this.maxEvaluationSteps = maxEvaluationSteps <= 0L
        ? EngineConfiguration.DEFAULT_MAX_EVALUATION_STEPS : maxEvaluationSteps;
  }

  /**
   * Load a machine, ending whatever was running against the previous one.
   */
  public void load(final CompiledMachine<?> machine) {
    if (machine == null) {
      throw new IllegalArgumentException("machine cannot be null");
    }
    this.machine = machine;
    this.execution = null;
    this.input = null;
  }

  /**
   * Start a step-by-step simulation of the input. An already running simulation is replaced.
   */
  public void simulate(final String input) throws AutomatonException {
    final List<String> symbols = checkInput(input);
    execution = Execution.start(machine, symbols, maxEvaluationSteps);
    this.input = input;
  }

  /**
   * Advance every live timeline by one step. A step that runs the simulation past its budget
   * discards it, the same way a terminal step does.
   */
  public StepResult advance() throws AutomatonException {
    if (execution == null) {
      throw new AutomatonException(Code.NO_ACTIVE_SIMULATION);
    }
    final StepResult result;
    try {
      result = execution.step();
    } catch (AutomatonException failure) {
      execution = null;
      input = null;
      throw failure;
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Stepped '%s' to %s with timelines %s", input, result,
          execution.timelines()));
    }
    if (result.isTerminal()) {
      execution = null;
      input = null;
    }
    return result;
  }

  /**
   * Run the input to completion in a fresh execution. Fails with
   * {@link Code#EVALUATION_LIMIT_EXCEEDED} once it has entered more configurations than the
   * budget allows and with {@link Code#INTERRUPTED} when the calling thread is interrupted.
   */
  public EvalResult eval(final String input) throws AutomatonException {
    return run(machine, input, maxEvaluationSteps);
  }

  /**
   * Back to {@link SimulatorState#LOADED}, keeping the machine.
   */
  public void resetSimulation() {
    execution = null;
    input = null;
  }

  /**
   * Back to {@link SimulatorState#IDLE}, dropping the machine.
   */
  public void endSimulation() {
    execution = null;
    input = null;
    machine = null;
  }

  /**
   * Live timelines of the running simulation, empty when nothing is running.
   */
  public List<Timeline> getTimelines() {
    return execution == null ? Collections.<Timeline>emptyList()
        : Collections.unmodifiableList(execution.timelines());
  }

  /**
   * The tape of the running Turing machine simulation, null for any other machine or when nothing
   * is running.
   */
  public List<String> getTape() {
    return execution == null ? null : execution.tape();
  }

  public SimulatorState getState() {
    if (machine == null) {
      return SimulatorState.IDLE;
    }
    return execution == null ? SimulatorState.LOADED : SimulatorState.SIMULATING;
  }

  public CompiledMachine<?> getMachine() {
    return machine;
  }

  /**
   * Input of the running simulation.
   */
  public String getInput() {
    return input;
  }

  static EvalResult run(final CompiledMachine<?> machine, final String input,
      final long maxSteps) throws AutomatonException {
    return run(machine, input, maxSteps, 0L);
  }

  /**
   * Same as {@link #run(CompiledMachine, String, long)}, additionally failing with
   * {@link Code#EVALUATION_TIMEOUT} past {@code timeoutMillis} of running time.
   */
  static EvalResult run(final CompiledMachine<?> machine, final String input,
      final long maxSteps, final long timeoutMillis) throws AutomatonException {
    final List<String> symbols = checkInput(machine, input);
    final Execution evaluation = Execution.start(machine, symbols, maxSteps);
    evaluation.expireAfter(timeoutMillis);
    long steps = 0L;
    StepResult result = StepResult.CONTINUE;
    try {
      while (!result.isTerminal()) {
        result = evaluation.step();
        steps++;
      }
    } catch (AutomatonException failure) {
      throw new AutomatonException(failure.getCode(),
          "Evaluation of '" + input + "' failed: " + failure.getMessage(), failure);
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Evaluated '%s' to %s in %d steps over %d configurations", input,
          result, steps, evaluation.getWork()));
    }
    return new EvalResult(result, evaluation.tape(), evaluation.stack());
  }

  private List<String> checkInput(final String input) throws AutomatonException {
    return checkInput(machine, input);
  }

  private static List<String> checkInput(final CompiledMachine<?> machine, final String input)
      throws AutomatonException {
    if (machine == null) {
      throw new AutomatonException(Code.NO_ACTIVE_MACHINE);
    }
    final List<String> symbols = ConditionGrammar.symbols(input);
    for (final String symbol : symbols) {
      if (!machine.getAlphabet().contains(symbol)) {
        throw new AutomatonException(Code.INVALID_INPUT_SYMBOL, "Input character '" + symbol
            + "' is not in the alphabet " + machine.getAlphabet());
      }
    }
    return symbols;
  }
}
