package com.github.automata;

/**
 * The automaton models a graph can be interpreted as. {@link #AUTO} is only valid in a request and
 * is never the type of a compiled machine.
 */
public enum MachineType {
  DFA("DFA", "fa"),
  NFA("NFA", "fa"),
  PDA("PDA", "pda"),
  TURING_MACHINE("Turing Machine", "turing"),
  // try every concrete type, see MachineTypeInferencer
  AUTO("Auto", null);

  private final String displayName;
  private final String jflapType;

  private MachineType(final String displayName, final String jflapType) {
    this.displayName = displayName;
    this.jflapType = jflapType;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getJflapType() {
    return jflapType;
  }

  public boolean isConcrete() {
    return this != AUTO;
  }
}
