package com.github.automata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DFA/NFA execution. Each timeline is a (state, cursor) pair; nondeterminism is modeled by keeping
 * several timelines side by side instead of backtracking.
 *
 * A (state, cursor) pair is only ever entered once per execution. Two timelines in the same
 * configuration have the same future, so dropping the later one changes no verdict, and it keeps
 * epsilon cycles from spinning forever.
 */
final class FiniteAutomatonExecution extends Execution {
  private final List<String> input;
  private List<Branch> branches = new ArrayList<>();
  // K=state, V=cursors already visited in that state
  private final Map<CompiledState<String>, Set<Integer>> visited = new IdentityHashMap<>();

  FiniteAutomatonExecution(final List<CompiledState<String>> initialStates,
      final List<String> input, final long maxWork) throws AutomatonException {
    super(maxWork);
    this.input = input;
    for (final CompiledState<String> state : initialStates) {
      enter(branches, state, 0);
    }
  }

  @Override
  StepResult doStep() throws AutomatonException {
    final List<Branch> kept = new ArrayList<>(branches.size());
    final List<Branch> forks = new ArrayList<>();
    for (final Branch branch : branches) {
      final boolean exhausted = branch.cursor >= input.size();
      if (exhausted && branch.state.isFinal()) {
        branches = new ArrayList<>();
        branches.add(branch);
        return StepResult.ACCEPTED;
      }
      final List<Branch> successors = new ArrayList<>();
      for (final CompiledTransition<String> transition : branch.state.getTransitions()) {
        final List<String> conditions = transition.getConditions();
        if (conditions.contains(ConditionGrammar.EPSILON)) {
          enter(successors, transition.getTo(), branch.cursor);
        }
        if (!exhausted && conditions.contains(input.get(branch.cursor))) {
          enter(successors, transition.getTo(), branch.cursor + 1);
        }
      }
      // the first successor keeps this timeline's slot, the others are appended
      if (!successors.isEmpty()) {
        kept.add(successors.get(0));
        forks.addAll(successors.subList(1, successors.size()));
      }
    }
    kept.addAll(forks);
    branches = kept;
    return branches.isEmpty() ? StepResult.REJECTED : StepResult.CONTINUE;
  }

  @Override
  List<Timeline> timelines() {
    final List<Timeline> timelines = new ArrayList<>(branches.size());
    for (final Branch branch : branches) {
      timelines.add(new Timeline(branch.state, branch.cursor, null));
    }
    return timelines;
  }

  private void enter(final List<Branch> target, final CompiledState<String> state,
      final int cursor) throws AutomatonException {
    Set<Integer> cursors = visited.get(state);
    if (cursors == null) {
      cursors = new HashSet<>();
      visited.put(state, cursors);
    }
    if (cursors.add(cursor)) {
      charge();
      target.add(new Branch(state, cursor));
    }
  }

  private static final class Branch {
    private final CompiledState<String> state;
    private final int cursor;

    private Branch(final CompiledState<String> state, final int cursor) {
      this.state = state;
      this.cursor = cursor;
    }
  }
}
