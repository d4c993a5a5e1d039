package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.automata.AlphabetSet.AlphabetSetBuilder;
import com.github.automata.AutomatonEngine.AutomatonEngineBuilder;
import com.github.automata.AutomatonException.Code;
import com.github.automata.EngineConfiguration.EngineConfigurationBuilder;

/**
 * End to end tests of the AutomatonEngine.
 */
public class AutomatonEngineTest {
  private static final Logger logger =
      LogManager.getLogger(AutomatonEngineTest.class.getSimpleName());

  @Test
  public void testEngineFlow() throws AutomatonException {
    // 1. draw the graph through the engine
    final AutomatonEngine engine = AutomatonEngineBuilder.newBuilder().build();
    assertTrue(engine.alive());
    final Graph graph = engine.getGraph();
    final GraphNode q0 = graph.addNode("q0", true, false);
    final GraphNode q1 = graph.addNode("q1", false, true);
    graph.addTransition(q0, q1, "a");
    assertEquals(SimulatorState.IDLE, engine.getSimulatorState());
    assertFalse(engine.getActiveMachine().isPresent());

    // 2. compile
    final CompiledMachine<?> machine =
        engine.compile(MachineType.AUTO, AlphabetSet.open(), ValidationOptions.DEFAULT);
    assertEquals(MachineType.DFA, machine.getType());
    assertSame(machine, engine.getActiveMachine().get());
    assertEquals(SimulatorState.LOADED, engine.getSimulatorState());

    // 3. step through "a"
    engine.simulate("a");
    assertEquals(SimulatorState.SIMULATING, engine.getSimulatorState());
    assertEquals("q0", engine.getTimelines().get(0).getState().getLabel());
    assertEquals(StepResult.CONTINUE, engine.advance());
    assertEquals("q1", engine.getTimelines().get(0).getState().getLabel());
    assertEquals(StepResult.ACCEPTED, engine.advance());
    assertEquals(SimulatorState.LOADED, engine.getSimulatorState());

    // 4. eval
    assertTrue(engine.eval("a").getResult());
    assertFalse(engine.eval("").getResult());

    // 5. stats
    final EngineStatistics stats = engine.getStatistics();
    assertEquals(engine.getId(), stats.getEngineId());
    assertEquals(1L, stats.getTotalCompilations());
    assertEquals(2L, stats.getTotalEvaluations());
    assertEquals(1L, stats.getAcceptedEvaluations());
    assertEquals(1L, stats.getRejectedEvaluations());
    logger.info(stats.toString());

    // 6. end and shut down
    engine.endSimulation();
    assertEquals(SimulatorState.IDLE, engine.getSimulatorState());
    assertFalse(engine.getActiveMachine().isPresent());
    assertTrue(engine.shutdown());
    assertFalse(engine.alive());
    assertFalse(engine.shutdown());
    try {
      engine.eval("a");
      fail("engine is shut down");
    } catch (AutomatonException expected) {
      assertEquals(Code.ENGINE_NOT_ALIVE, expected.getCode());
    }
  }

  @Test
  public void testNoActiveMachine() throws AutomatonException {
    final AutomatonEngine engine =
        AutomatonEngineBuilder.newBuilder().graph(SampleGraphs.singleA()).build();
    try {
      engine.eval("a");
      fail("nothing compiled");
    } catch (AutomatonException expected) {
      assertEquals(Code.NO_ACTIVE_MACHINE, expected.getCode());
      assertEquals("No compiled machine.", expected.getMessage());
    }
    try {
      engine.simulate("a");
      fail("nothing compiled");
    } catch (AutomatonException expected) {
      assertEquals(Code.NO_ACTIVE_MACHINE, expected.getCode());
    }
    try {
      engine.advance();
      fail("nothing running");
    } catch (AutomatonException expected) {
      assertEquals(Code.NO_ACTIVE_SIMULATION, expected.getCode());
    }
    assertEquals(0L, engine.getStatistics().getTotalEvaluations());
    engine.shutdown();
  }

  @Test
  public void testFailedCompilationKeepsMachine() throws AutomatonException {
    final AutomatonEngine engine =
        AutomatonEngineBuilder.newBuilder().graph(SampleGraphs.epsilonBranching()).build();
    final CompiledMachine<?> nfa = engine.compile(MachineType.NFA, null, null);
    engine.simulate("aa");

    // 1. a DFA is impossible with an epsilon transition
    try {
      engine.compile(MachineType.DFA, null, null);
      fail("epsilon in a DFA");
    } catch (MachineValidationException expected) {
      assertEquals(Code.MALFORMED_CONDITION, expected.getCode());
    }
    assertSame(nfa, engine.getActiveMachine().get());
    assertEquals(SimulatorState.SIMULATING, engine.getSimulatorState());
    assertEquals(2L, engine.getStatistics().getTotalCompilations());
    assertEquals(1L, engine.getStatistics().getFailedCompilations());

    // 2. a successful recompilation ends the simulation
    final CompiledMachine<?> again = engine.compile(MachineType.AUTO, null, null);
    assertNotEquals(nfa, again);
    assertEquals(SimulatorState.LOADED, engine.getSimulatorState());
    engine.shutdown();
  }

  @Test
  public void testValidateAndExport() throws AutomatonException {
    final AutomatonEngine engine =
        AutomatonEngineBuilder.newBuilder().graph(SampleGraphs.anbn()).build();

    // 1. validation resolves alphabets without compiling
    final AlphabetSet resolved = engine.validate(MachineType.AUTO, null, null);
    assertEquals(new java.util.HashSet<>(Arrays.asList("Z", "A")),
        resolved.getStackAlphabet().get());
    assertFalse(engine.getActiveMachine().isPresent());

    // 2. closed alphabets are honored
    try {
      engine.validate(MachineType.PDA, AlphabetSetBuilder.newBuilder().alphabet("a").build(),
          null);
      fail("b is not in {a}");
    } catch (ConditionException expected) {
      assertEquals(Code.SYMBOL_NOT_IN_ALPHABET, expected.getCode());
    }

    // 3. export picks the type the way compile would
    final String xml = engine.exportJflap(MachineType.AUTO, null, null);
    assertTrue(xml.contains("<type>pda</type>"));
    try {
      engine.exportJflap(MachineType.DFA, null, null);
      fail("not a DFA");
    } catch (MachineValidationException expected) {
      assertEquals(MachineType.DFA, expected.getMachineType());
    }
    engine.shutdown();
  }

  @Test
  public void testEvaluateTestCases() throws AutomatonException {
    final AutomatonEngine engine =
        AutomatonEngineBuilder.newBuilder().graph(SampleGraphs.bitFlipper()).build();
    engine.compile(MachineType.AUTO, null, null);
    final List<TestCaseResult> results = engine.evaluate(Arrays.asList(new TestCase("0", true),
        new TestCase("2", false), new TestCase("x", false), new TestCase("1", false)));
    assertTrue(results.get(0).isMatch());
    assertEquals(Arrays.asList("1"), results.get(0).getTape().get());
    assertTrue(results.get(1).isMatch());
    assertFalse(results.get(2).isMatch());
    assertFalse(results.get(3).isMatch());

    final EngineStatistics stats = engine.getStatistics();
    assertEquals(4L, stats.getTotalEvaluations());
    assertEquals(2L, stats.getAcceptedEvaluations());
    assertEquals(1L, stats.getRejectedEvaluations());
    assertEquals(1L, stats.getFailedEvaluations());
    engine.shutdown();
  }

  @Test
  public void testConcurrentEvaluationAndRecompilation() throws Exception {
    // 1. engine with a roomy lock timeout
    final EngineConfiguration config = EngineConfigurationBuilder.newBuilder()
        .lockAcquisitionMillis(5000L).evaluationTimeoutMillis(10000L).build();
    final AutomatonEngine engine =
        AutomatonEngineBuilder.newBuilder().config(config).graph(SampleGraphs.endsWithB()).build();
    engine.compile(MachineType.DFA, null, null);

    // 2. evaluators race a recompiling thread
    final AtomicInteger evalSuccess = new AtomicInteger();
    final AtomicInteger evalFailure = new AtomicInteger();
    final AtomicInteger compileSuccess = new AtomicInteger();
    final int evalsPerWorker = 200;
    final Runnable evalWorker = new Runnable() {
      @Override
      public void run() {
        for (int iter = 0; iter < evalsPerWorker; iter++) {
          try {
            final boolean expected = iter % 2 == 1;
            final String input = expected ? "aab" : "aba";
            if (engine.eval(input).getResult() == expected) {
              evalSuccess.incrementAndGet();
            } else {
              evalFailure.incrementAndGet();
            }
          } catch (AutomatonException problem) {
            logger.error("engine:" + engine.getId() + " encountered an issue", problem);
            evalFailure.incrementAndGet();
          }
        }
      }
    };
    final Runnable compileWorker = new Runnable() {
      @Override
      public void run() {
        for (int iter = 0; iter < 20; iter++) {
          try {
            engine.compile(iter % 2 == 0 ? MachineType.NFA : MachineType.DFA, null, null);
            compileSuccess.incrementAndGet();
          } catch (AutomatonException problem) {
            logger.error("engine:" + engine.getId() + " encountered an issue", problem);
          }
        }
      }
    };

    int workerCount = 5;
    final List<Thread> workers = new ArrayList<>(workerCount + 1);
    for (int iter = 0; iter < workerCount; iter++) {
      workers.add(new Thread(evalWorker, "test-eval-worker-" + iter));
    }
    workers.add(new Thread(compileWorker, "test-compile-worker"));
    for (final Thread worker : workers) {
      worker.start();
    }
    for (final Thread worker : workers) {
      worker.join();
    }

    // 3. every eval saw a complete machine
    assertEquals(workerCount * evalsPerWorker, evalSuccess.get());
    assertEquals(0, evalFailure.get());
    assertEquals(20, compileSuccess.get());
    assertEquals(21L, engine.getStatistics().getTotalCompilations());
    assertEquals((long) workerCount * evalsPerWorker,
        engine.getStatistics().getTotalEvaluations());

    assertTrue(engine.shutdown());
    assertFalse(engine.alive());
  }

  @Test
  public void testInvalidConfiguration() {
    try {
      EngineConfigurationBuilder.newBuilder().evaluationParallelism(1000).build();
      fail("too many threads");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_ENGINE_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testConfigurationDefaults() throws AutomatonException {
    final EngineConfiguration config = EngineConfigurationBuilder.newBuilder()
        .maxEvaluationSteps(-1L).evaluationTimeoutMillis(0L).build();
    assertEquals(100000L, config.getMaxEvaluationSteps());
    assertEquals(10000L, config.getEvaluationTimeoutMillis());
    assertEquals(1, config.getEvaluationParallelism());
    assertEquals(100L, config.getLockAcquisitionMillis());

    final AutomatonEngine engine = AutomatonEngineBuilder.newBuilder().build();
    assertEquals(100000L, engine.getConfiguration().getMaxEvaluationSteps());
  }
}
