package com.github.automata;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AutomatonException.Code;

/**
 * Default {@link AutomatonEngine}.
 *
 * Notes:<br>
 * 1. the active machine and the simulator are only replaced or stepped under the write lock;
 * everything that merely reads the active machine takes the read lock<br>
 * 2. all lock acquisition is bounded by lockAcquisitionMillis, after which the call fails with
 * {@link Code#OPERATION_LOCK_ACQUISITION_FAILURE} and may be retried<br>
 * 3. compiled machines are immutable, so evaluations only need the lock long enough to pick up
 * the machine; the evaluation itself runs outside of it<br>
 */
public final class AutomatonEngineImpl implements AutomatonEngine {
  private static final Logger logger =
      LogManager.getLogger(AutomatonEngineImpl.class.getSimpleName());

  private final String engineId = UUID.randomUUID().toString();

  private final AtomicBoolean engineAlive = new AtomicBoolean();

  private final EngineConfiguration config;
  private final Graph graph;
  private final Simulator simulator;
  private final TestSuiteEvaluator evaluator;
  private final EngineStatistics engineStats;

  // guarded by engineSuperLock
  private CompiledMachine<?> activeMachine;

  // global engine level locks
  private final ReentrantReadWriteLock engineSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock engineWriteLock = engineSuperLock.writeLock();
  private final ReadLock engineReadLock = engineSuperLock.readLock();

  AutomatonEngineImpl(final EngineConfiguration config, final Graph graph)
      throws AutomatonException {
    this.config = config == null ? EngineConfiguration.defaults() : config;
    this.graph = graph == null ? new Graph() : graph;
    this.simulator = new Simulator(this.config.getMaxEvaluationSteps());
    this.evaluator = new TestSuiteEvaluator(this.config);
    this.engineStats = new EngineStatistics(engineId);
    engineAlive.set(true);
    logInfo(engineId, "Fired up engine with " + this.config);
  }

  @Override
  public CompiledMachine<?> compile(final MachineType type, final AlphabetSet alphabets,
      final ValidationOptions options) throws AutomatonException {
    if (type == null) {
      throw new IllegalArgumentException("type cannot be null");
    }
    engineAlive();
    return locked(engineWriteLock, "compile", new LockedOperation<CompiledMachine<?>>() {
      @Override
      public CompiledMachine<?> run() throws AutomatonException {
        engineStats.totalCompilations.incrementAndGet();
        final CompiledMachine<?> machine;
        try {
          machine = MachineCompiler.compile(graph, type, alphabets, options);
        } catch (AutomatonException failure) {
          engineStats.failedCompilations.incrementAndGet();
          logInfo(engineId, "Failed to compile as " + type.getDisplayName() + ": "
              + failure.getMessage());
          throw failure;
        }
        if (simulator.getState() == SimulatorState.SIMULATING) {
          logInfo(engineId, "Ending simulation of '" + simulator.getInput()
              + "' in favor of the new machine");
        }
        activeMachine = machine;
        simulator.load(machine);
        logInfo(engineId, "Compiled " + machine);
        return machine;
      }
    });
  }

  @Override
  public AlphabetSet validate(final MachineType type, final AlphabetSet alphabets,
      final ValidationOptions options) throws AutomatonException {
    if (type == null) {
      throw new IllegalArgumentException("type cannot be null");
    }
    engineAlive();
    return locked(engineReadLock, "validate", new LockedOperation<AlphabetSet>() {
      @Override
      public AlphabetSet run() throws AutomatonException {
        final MachineType concrete = type.isConcrete() ? type
            : MachineTypeInferencer.determineType(graph, type, alphabets, options);
        return MachineValidator.validate(graph, concrete, alphabets, options);
      }
    });
  }

  @Override
  public Optional<CompiledMachine<?>> getActiveMachine() throws AutomatonException {
    engineAlive();
    return locked(engineReadLock, "read active machine",
        new LockedOperation<Optional<CompiledMachine<?>>>() {
          @Override
          public Optional<CompiledMachine<?>> run() {
            return Optional.<CompiledMachine<?>>ofNullable(activeMachine);
          }
        });
  }

  @Override
  public String exportJflap(final MachineType type, final AlphabetSet alphabets,
      final ValidationOptions options) throws AutomatonException {
    if (type == null) {
      throw new IllegalArgumentException("type cannot be null");
    }
    engineAlive();
    return locked(engineReadLock, "export", new LockedOperation<String>() {
      @Override
      public String run() throws AutomatonException {
        final MachineType concrete =
            MachineTypeInferencer.determineType(graph, type, alphabets, options);
        logDebug(engineId, "Exporting graph as " + concrete.getDisplayName());
        return JflapExporter.export(graph, concrete);
      }
    });
  }

  @Override
  public void simulate(final String input) throws AutomatonException {
    engineAlive();
    locked(engineWriteLock, "start simulation", new LockedOperation<Void>() {
      @Override
      public Void run() throws AutomatonException {
        simulator.simulate(input);
        logInfo(engineId, "Started simulation of '" + input + "'");
        return null;
      }
    });
  }

  @Override
  public StepResult advance() throws AutomatonException {
    engineAlive();
    return locked(engineWriteLock, "advance simulation", new LockedOperation<StepResult>() {
      @Override
      public StepResult run() throws AutomatonException {
        final String input = simulator.getInput();
        final StepResult result = simulator.advance();
        if (result.isTerminal()) {
          logInfo(engineId, "Simulation of '" + input + "' finished " + result);
        }
        return result;
      }
    });
  }

  @Override
  public List<Timeline> getTimelines() throws AutomatonException {
    engineAlive();
    return locked(engineReadLock, "read timelines", new LockedOperation<List<Timeline>>() {
      @Override
      public List<Timeline> run() {
        return simulator.getTimelines();
      }
    });
  }

  @Override
  public SimulatorState getSimulatorState() throws AutomatonException {
    engineAlive();
    return locked(engineReadLock, "read simulator state", new LockedOperation<SimulatorState>() {
      @Override
      public SimulatorState run() {
        return simulator.getState();
      }
    });
  }

  @Override
  public void resetSimulation() throws AutomatonException {
    engineAlive();
    locked(engineWriteLock, "reset simulation", new LockedOperation<Void>() {
      @Override
      public Void run() {
        simulator.resetSimulation();
        logDebug(engineId, "Reset simulation");
        return null;
      }
    });
  }

  @Override
  public void endSimulation() throws AutomatonException {
    engineAlive();
    locked(engineWriteLock, "end simulation", new LockedOperation<Void>() {
      @Override
      public Void run() {
        simulator.endSimulation();
        activeMachine = null;
        logInfo(engineId, "Ended simulation and unloaded machine");
        return null;
      }
    });
  }

  @Override
  public EvalResult eval(final String input) throws AutomatonException {
    engineAlive();
    final CompiledMachine<?> machine = currentMachine();
    final EvalResult result;
    try {
      result = Simulator.run(machine, input, config.getMaxEvaluationSteps());
    } catch (AutomatonException failure) {
      if (failure.getCode() != Code.NO_ACTIVE_MACHINE) {
        engineStats.totalEvaluations.incrementAndGet();
        engineStats.failedEvaluations.incrementAndGet();
      }
      throw failure;
    }
    engineStats.recordEvaluation(result);
    logDebug(engineId, "Evaluated '" + input + "' to " + result.getVerdict());
    return result;
  }

  @Override
  public List<TestCaseResult> evaluate(final List<TestCase> testCases)
      throws AutomatonException {
    engineAlive();
    final CompiledMachine<?> machine = currentMachine();
    final List<TestCaseResult> results = evaluator.evaluate(machine, testCases);
    int matched = 0;
    for (final TestCaseResult result : results) {
      engineStats.recordEvaluation(result);
      if (result.isMatch()) {
        matched++;
      }
    }
    logInfo(engineId,
        String.format("Test suite run stats::cases:%d, matched:%d", results.size(), matched));
    return results;
  }

  @Override
  public Graph getGraph() {
    return graph;
  }

  @Override
  public String getId() {
    return engineId;
  }

  @Override
  public EngineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public EngineStatistics getStatistics() {
    return engineStats;
  }

  @Override
  public boolean alive() {
    return engineAlive.get();
  }

  @Override
  public boolean shutdown() throws AutomatonException {
    if (!alive()) {
      logInfo(engineId, "Cannot shut down an engine that is not alive");
      return false;
    }
    return locked(engineWriteLock, "shut down engine", new LockedOperation<Boolean>() {
      @Override
      public Boolean run() {
        if (!engineAlive.compareAndSet(true, false)) {
          return false;
        }
        evaluator.shutdown();
        simulator.endSimulation();
        activeMachine = null;
        logInfo(engineId, "Shut down engine with " + engineStats);
        return true;
      }
    });
  }

  private CompiledMachine<?> currentMachine() throws AutomatonException {
    return locked(engineReadLock, "read active machine",
        new LockedOperation<CompiledMachine<?>>() {
          @Override
          public CompiledMachine<?> run() {
            return activeMachine;
          }
        });
  }

  private void engineAlive() throws AutomatonException {
    if (!alive()) {
      throw new AutomatonException(Code.ENGINE_NOT_ALIVE,
          "Engine id:" + engineId + " is not alive");
    }
  }

  private <T> T locked(final Lock lock, final String operation,
      final LockedOperation<T> lockedOperation) throws AutomatonException {
    try {
      if (lock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          return lockedOperation.run();
        } finally {
          lock.unlock();
        }
      } else {
        throw new AutomatonException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new AutomatonException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  private interface LockedOperation<T> {
    T run() throws AutomatonException;
  }

  private static void logInfo(final String engineId, final String message) {
    logger.info(new StringBuilder().append("[e:").append(engineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String engineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[e:").append(engineId).append("] ")
          .append(message).toString());
    }
  }

}
