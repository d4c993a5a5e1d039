package com.github.automata;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The alphabets of a machine. An alphabet that is present is closed: every symbol a transition uses
 * must be a member. An absent alphabet is open and gets inferred from the transitions. Use the
 * {@code AlphabetSetBuilder} to build one.
 */
public final class AlphabetSet {
  private static final AlphabetSet OPEN = new AlphabetSet(null, null, null);

  private final Set<String> alphabet;
  private final Set<String> stackAlphabet;
  private final Set<String> tapeAlphabet;

  public static AlphabetSet open() {
    return OPEN;
  }

  public Optional<Set<String>> getAlphabet() {
    return Optional.ofNullable(alphabet);
  }

  public Optional<Set<String>> getStackAlphabet() {
    return Optional.ofNullable(stackAlphabet);
  }

  public Optional<Set<String>> getTapeAlphabet() {
    return Optional.ofNullable(tapeAlphabet);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AlphabetSet)) {
      return false;
    }
    final AlphabetSet other = (AlphabetSet) o;
    return Objects.equals(alphabet, other.alphabet)
        && Objects.equals(stackAlphabet, other.stackAlphabet)
        && Objects.equals(tapeAlphabet, other.tapeAlphabet);
  }

  @Override
  public int hashCode() {
    return Objects.hash(alphabet, stackAlphabet, tapeAlphabet);
  }

  @Override
  public String toString() {
    return "AlphabetSet [alphabet=" + alphabet + ", stackAlphabet=" + stackAlphabet
        + ", tapeAlphabet=" + tapeAlphabet + "]";
  }

  public final static class AlphabetSetBuilder {
    private Set<String> alphabet;
    private Set<String> stackAlphabet;
    private Set<String> tapeAlphabet;

    public static AlphabetSetBuilder newBuilder() {
      return new AlphabetSetBuilder();
    }

    public AlphabetSetBuilder alphabet(final Set<String> alphabet) {
      this.alphabet = alphabet;
      return this;
    }

    public AlphabetSetBuilder alphabet(final String... symbols) {
      return alphabet(asSet(symbols));
    }

    public AlphabetSetBuilder stackAlphabet(final Set<String> stackAlphabet) {
      this.stackAlphabet = stackAlphabet;
      return this;
    }

    public AlphabetSetBuilder stackAlphabet(final String... symbols) {
      return stackAlphabet(asSet(symbols));
    }

    public AlphabetSetBuilder tapeAlphabet(final Set<String> tapeAlphabet) {
      this.tapeAlphabet = tapeAlphabet;
      return this;
    }

    public AlphabetSetBuilder tapeAlphabet(final String... symbols) {
      return tapeAlphabet(asSet(symbols));
    }

    public AlphabetSet build() {
      return new AlphabetSet(alphabet, stackAlphabet, tapeAlphabet);
    }

    private static Set<String> asSet(final String... symbols) {
      final Set<String> set = new LinkedHashSet<>();
      Collections.addAll(set, symbols);
      return set;
    }

    private AlphabetSetBuilder() {}
  }

  private static Set<String> freeze(final Set<String> symbols) {
    return symbols == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(symbols));
  }

  private AlphabetSet(final Set<String> alphabet, final Set<String> stackAlphabet,
      final Set<String> tapeAlphabet) {
    this.alphabet = freeze(alphabet);
    this.stackAlphabet = freeze(stackAlphabet);
    this.tapeAlphabet = freeze(tapeAlphabet);
  }
}
