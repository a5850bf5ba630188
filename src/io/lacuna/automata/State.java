package io.lacuna.automata;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * An automaton state, identified by the sorted set of indices of the states it was built from. A state made
 * by {@link Nfa#newState()} has a single index; combining states takes the union of their indices, so the same
 * set of states always combines into an equal state no matter in which order it was discovered.
 */
public final class State implements Comparable<State> {

  /**
   * The state with no indices, standing for "no state".
   */
  public static final State INVALID = new State(new int[0]);

  private final int[] indices;
  private final int hash;

  private State(int[] indices) {
    this.indices = indices;
    this.hash = Arrays.hashCode(indices);
  }

  public static State of(int... indices) {
    return new State(IntStream.of(indices).sorted().distinct().toArray());
  }

  public static State combine(Iterable<State> states) {
    IntStream.Builder builder = IntStream.builder();
    for (State s : states) {
      for (int i : s.indices) {
        builder.add(i);
      }
    }
    return new State(builder.build().sorted().distinct().toArray());
  }

  public static State combine(State... states) {
    return combine(Arrays.asList(states));
  }

  public int[] indices() {
    return indices.clone();
  }

  public boolean isValid() {
    return indices.length > 0;
  }

  // the largest index, or -1 for the invalid state
  int maxIndex() {
    return indices.length == 0 ? -1 : indices[indices.length - 1];
  }

  /**
   * @return true if every index of this state is also an index of {@code other}
   */
  public boolean isSubstateOf(State other) {
    int j = 0;
    for (int i : indices) {
      while (j < other.indices.length && other.indices[j] < i) {
        j++;
      }
      if (j == other.indices.length || other.indices[j] != i) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int compareTo(State other) {
    int n = Math.min(indices.length, other.indices.length);
    for (int i = 0; i < n; i++) {
      int cmp = Integer.compare(indices[i], other.indices[i]);
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(indices.length, other.indices.length);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof State)) {
      return false;
    }
    State other = (State) obj;
    return hash == other.hash && Arrays.equals(indices, other.indices);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    if (indices.length == 0) {
      return "INVALID";
    }
    StringBuilder sb = new StringBuilder("q");
    for (int i = 0; i < indices.length; i++) {
      if (i > 0) {
        sb.append('_');
      }
      sb.append(indices[i]);
    }
    return sb.toString();
  }
}
