package com.github.automata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when automatic type detection could not interpret a graph as any machine type. The
 * message stays generic; {@link #getAttemptFailures()} reports why each attempted type failed, in
 * the order the types were tried.
 */
public final class TypeInferenceException extends AutomatonException {
  private static final long serialVersionUID = 1L;
  private final Map<MachineType, String> attemptFailures;

  public TypeInferenceException(final Map<MachineType, String> attemptFailures) {
    super(Code.NO_MATCHING_MACHINE_TYPE);
    this.attemptFailures = Collections.unmodifiableMap(new LinkedHashMap<>(attemptFailures));
  }

  public Map<MachineType, String> getAttemptFailures() {
    return attemptFailures;
  }
}
