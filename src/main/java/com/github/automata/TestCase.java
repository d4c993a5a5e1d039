package com.github.automata;

/**
 * An input string and whether the machine is expected to accept it.
 */
public final class TestCase {
  private final String input;
  private final boolean expected;

  public TestCase(final String input, final boolean expected) {
    this.input = input == null ? "" : input;
    this.expected = expected;
  }

  public String getInput() {
    return input;
  }

  public boolean isExpected() {
    return expected;
  }

  @Override
  public String toString() {
    return "TestCase [input=" + input + ", expected=" + expected + "]";
  }
}
