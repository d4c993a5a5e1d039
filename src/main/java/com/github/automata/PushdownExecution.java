package com.github.automata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PDA execution. Every timeline owns its stack, and every enabled condition forks a timeline the
 * same way an NFA does. Acceptance is by final state once all input is consumed.
 *
 * A condition is enabled when its input symbol is epsilon or the next input character, and its
 * read-stack symbol is epsilon or the current top. {@link StackAction#PUSH} pushes the action
 * symbol on top; {@link StackAction#POP} removes the top, which must equal the action symbol
 * unless that is epsilon.
 *
 * Configurations (state, cursor, stack) are entered at most once, which ends epsilon cycles that
 * leave the stack unchanged. Cycles that keep growing the stack never revisit a configuration and
 * are stopped by the work budget, charged per entered configuration.
 */
final class PushdownExecution extends Execution {
  private final List<String> input;
  private List<Branch> branches = new ArrayList<>();
  private Branch accepted;
  // K=state, V=cursor|stack keys already visited in that state
  private final Map<CompiledState<PdaCondition>, Set<String>> visited = new IdentityHashMap<>();

  PushdownExecution(final List<CompiledState<PdaCondition>> initialStates,
      final List<String> input, final long maxWork) throws AutomatonException {
    super(maxWork);
    this.input = input;
    for (final CompiledState<PdaCondition> state : initialStates) {
      enter(branches, state, 0, new ArrayList<String>());
    }
  }

  @Override
  StepResult doStep() throws AutomatonException {
    final List<Branch> kept = new ArrayList<>(branches.size());
    final List<Branch> forks = new ArrayList<>();
    for (final Branch branch : branches) {
      final boolean exhausted = branch.cursor >= input.size();
      if (exhausted && branch.state.isFinal()) {
        accepted = branch;
        branches = new ArrayList<>();
        branches.add(branch);
        return StepResult.ACCEPTED;
      }
      final List<Branch> successors = new ArrayList<>();
      for (final CompiledTransition<PdaCondition> transition : branch.state.getTransitions()) {
        for (final PdaCondition condition : transition.getConditions()) {
          fire(successors, branch, transition.getTo(), condition, exhausted);
        }
      }
      if (!successors.isEmpty()) {
        kept.add(successors.get(0));
        forks.addAll(successors.subList(1, successors.size()));
      }
    }
    kept.addAll(forks);
    branches = kept;
    return branches.isEmpty() ? StepResult.REJECTED : StepResult.CONTINUE;
  }

  private void fire(final List<Branch> successors, final Branch branch,
      final CompiledState<PdaCondition> to, final PdaCondition condition,
      final boolean exhausted) throws AutomatonException {
    final int nextCursor;
    if (ConditionGrammar.isEpsilon(condition.getSymbol())) {
      nextCursor = branch.cursor;
    } else if (!exhausted && condition.getSymbol().equals(input.get(branch.cursor))) {
      nextCursor = branch.cursor + 1;
    } else {
      return;
    }
    final String top = branch.stack.isEmpty() ? null : branch.stack.get(branch.stack.size() - 1);
    if (!ConditionGrammar.isEpsilon(condition.getReadStackSymbol())
        && !condition.getReadStackSymbol().equals(top)) {
      return;
    }
    final List<String> stack = new ArrayList<>(branch.stack);
    final String actionSymbol = condition.getActionStackSymbol();
    switch (condition.getAction()) {
      case PUSH:
        if (!ConditionGrammar.isEpsilon(actionSymbol)) {
          stack.add(actionSymbol);
        }
        break;
      case POP:
        if (stack.isEmpty()) {
          return;
        }
        final String popped = stack.remove(stack.size() - 1);
        if (!ConditionGrammar.isEpsilon(actionSymbol) && !actionSymbol.equals(popped)) {
          return;
        }
        break;
      default:
        throw new IllegalStateException("Unknown stack action " + condition.getAction());
    }
    enter(successors, to, nextCursor, stack);
  }

  @Override
  List<Timeline> timelines() {
    final List<Timeline> timelines = new ArrayList<>(branches.size());
    for (final Branch branch : branches) {
      timelines.add(new Timeline(branch.state, branch.cursor, branch.stack));
    }
    return timelines;
  }

  @Override
  List<String> stack() {
    return accepted == null ? new ArrayList<String>() : accepted.stack;
  }

  private void enter(final List<Branch> target, final CompiledState<PdaCondition> state,
      final int cursor, final List<String> stack) throws AutomatonException {
    Set<String> keys = visited.get(state);
    if (keys == null) {
      keys = new HashSet<>();
      visited.put(state, keys);
    }
    // stack symbols are single code points, so plain concatenation is unambiguous
    final StringBuilder key = new StringBuilder().append(cursor).append('|');
    for (final String symbol : stack) {
      key.append(symbol);
    }
    if (keys.add(key.toString())) {
      charge();
      target.add(new Branch(state, cursor, stack));
    }
  }

  private static final class Branch {
    private final CompiledState<PdaCondition> state;
    private final int cursor;
    // bottom first
    private final List<String> stack;

    private Branch(final CompiledState<PdaCondition> state, final int cursor,
        final List<String> stack) {
      this.state = state;
      this.cursor = cursor;
      this.stack = stack;
    }
  }
}
