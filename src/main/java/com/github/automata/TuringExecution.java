package com.github.automata;

import java.util.Collections;
import java.util.List;

/**
 * Turing machine execution. The machine is deterministic, so there is a single configuration and
 * never a fork: the first condition (in drawing order) that reads the symbol under the head fires.
 */
final class TuringExecution extends Execution {
  private final TuringMachine machine;
  private final Tape tape;
  private CompiledState<TmCondition> state;

  TuringExecution(final TuringMachine machine, final List<String> input, final long maxWork) {
    super(maxWork);
    this.machine = machine;
    this.tape = new Tape(input);
    this.state = machine.getInitial();
  }

  @Override
  StepResult doStep() throws AutomatonException {
    final StepResult halted = halted();
    if (halted != null) {
      return halted;
    }
    final String read = tape.read();
    for (final CompiledTransition<TmCondition> transition : state.getTransitions()) {
      for (final TmCondition condition : transition.getConditions()) {
        if (condition.getReadSymbol().equals(read)) {
          charge();
          tape.write(condition.getWriteSymbol());
          tape.move(condition.getMovement());
          state = transition.getTo();
          final StepResult afterMove = halted();
          return afterMove == null ? StepResult.CONTINUE : afterMove;
        }
      }
    }
    return StepResult.CRASHED;
  }

  private StepResult halted() {
    if (state == machine.getAcceptState()) {
      return StepResult.ACCEPTED;
    }
    if (state == machine.getRejectState()) {
      return StepResult.REJECTED;
    }
    return null;
  }

  @Override
  List<Timeline> timelines() {
    return Collections.singletonList(new Timeline(state, tape.getHead(), null));
  }

  @Override
  List<String> tape() {
    return tape.contents();
  }
}
