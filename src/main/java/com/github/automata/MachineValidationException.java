package com.github.automata;

/**
 * Raised when a graph cannot be interpreted as the requested machine type. The message always
 * reads {@code Failed to validate as <type>: <detail>}.
 */
public class MachineValidationException extends AutomatonException {
  private static final long serialVersionUID = 1L;
  private final MachineType machineType;

  public MachineValidationException(final Code code, final MachineType machineType,
      final String message) {
    super(code, "Failed to validate as " + machineType.getDisplayName() + ": " + message);
    this.machineType = machineType;
  }

  public MachineType getMachineType() {
    return machineType;
  }
}
