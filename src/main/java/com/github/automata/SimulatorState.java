package com.github.automata;

/**
 * Lifecycle of a {@link Simulator}.
 */
public enum SimulatorState {
  // no machine loaded
  IDLE,
  // machine loaded, nothing running
  LOADED,
  // a step-by-step simulation is running
  SIMULATING;
}
