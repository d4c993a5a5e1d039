package com.github.automata;

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.automata.AutomatonException.Code;

/**
 * Mutable run of one machine over one input. Every simulation and every evaluation gets its own
 * execution; the compiled machine underneath is shared and never touched.
 *
 * Once {@link #step()} returns a terminal result, further calls keep returning it.
 *
 * Every configuration the execution enters is charged against its work budget, so a single step
 * that forks a great many timelines fails with {@link Code#EVALUATION_LIMIT_EXCEEDED} instead of
 * running on. The calling thread's interrupt flag and the optional deadline are checked on every
 * charge.
 */
abstract class Execution {
  private final long maxWork;
  private long work;
  private long timeoutMillis;
  private long deadlineNanos;
  private StepResult terminal;

  Execution(final long maxWork) {
    this.maxWork = maxWork;
  }

  /**
   * One synchronous step over every live timeline.
   */
  final StepResult step() throws AutomatonException {
    if (terminal != null) {
      return terminal;
    }
    final StepResult result = doStep();
    if (result.isTerminal()) {
      terminal = result;
    }
    return result;
  }

  /**
   * Fail with {@link Code#EVALUATION_TIMEOUT} once the execution has run for longer than
   * {@code timeoutMillis} from now. Non-positive values mean no deadline.
   */
  final void expireAfter(final long timeoutMillis) {
    this.timeoutMillis = timeoutMillis;
    if (timeoutMillis > 0L) {
      deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    }
  }

  /**
   * Configurations entered so far.
   */
  final long getWork() {
    return work;
  }

  final void charge() throws AutomatonException {
    if (Thread.currentThread().isInterrupted()) {
      throw new AutomatonException(Code.INTERRUPTED, "Execution was interrupted after " + work
          + " configurations");
    }
    if (timeoutMillis > 0L && System.nanoTime() - deadlineNanos > 0L) {
      throw new AutomatonException(Code.EVALUATION_TIMEOUT,
          "Execution did not finish within " + timeoutMillis + " millis");
    }
    if (++work > maxWork) {
      throw new AutomatonException(Code.EVALUATION_LIMIT_EXCEEDED,
          "Execution did not halt within " + maxWork + " configurations");
    }
  }

  abstract StepResult doStep() throws AutomatonException;

  abstract List<Timeline> timelines();

  /**
   * Tape contents for Turing machines, null otherwise.
   */
  List<String> tape() {
    return null;
  }

  /**
   * Stack of the accepting timeline for PDAs, null otherwise.
   */
  List<String> stack() {
    return null;
  }

  static Execution start(final CompiledMachine<?> machine, final List<String> input,
      final long maxWork) throws AutomatonException {
    return machine.accept(new MachineVisitor<Execution>() {
      @Override
      public Execution visitDfa(final Dfa dfa) throws AutomatonException {
        return new FiniteAutomatonExecution(dfa.getInitialStates(), input, maxWork);
      }

      @Override
      public Execution visitNfa(final Nfa nfa) throws AutomatonException {
        return new FiniteAutomatonExecution(nfa.getInitialStates(), input, maxWork);
      }

      @Override
      public Execution visitPda(final Pda pda) throws AutomatonException {
        return new PushdownExecution(pda.getInitialStates(), input, maxWork);
      }

      @Override
      public Execution visitTuringMachine(final TuringMachine turingMachine)
          throws AutomatonException {
        return new TuringExecution(turingMachine, input, maxWork);
      }
    });
  }
}
