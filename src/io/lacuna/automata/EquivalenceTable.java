package io.lacuna.automata;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.bifurcan.Lists;

/**
 * The pairs of states known to be distinguishable, with an implicit trap state standing for every missing
 * transition. Marks only ever go from "equivalent" to "different".
 */
class EquivalenceTable {

  private final IList<State> states;
  private final LinearMap<State, Integer> indices = new LinearMap<>();

  // lower triangle, different[i][j] for j < i
  private final boolean[][] different;
  private final boolean[] differentFromTrap;

  EquivalenceTable(Iterable<State> states) {
    this.states = Lists.sort(LinearList.from(states));
    int size = (int) this.states.size();
    for (int i = 0; i < size; i++) {
      indices.put(this.states.nth(i), i);
    }

    this.different = new boolean[size][];
    for (int i = 0; i < size; i++) {
      different[i] = new boolean[i];
    }
    this.differentFromTrap = new boolean[size];
  }

  private int index(State state) {
    return indices.get(state)
            .orElseThrow(() -> new IllegalArgumentException(state + " is not part of the table"));
  }

  IList<State> states() {
    return states;
  }

  boolean areDifferent(State a, State b) {
    int i = index(a);
    int j = index(b);
    if (i == j) {
      return false;
    }
    return i > j ? different[i][j] : different[j][i];
  }

  boolean isDifferentFromTrap(State state) {
    return differentFromTrap[index(state)];
  }

  /**
   * @return true if the pair was not already marked
   */
  boolean markDifferent(State a, State b) {
    int i = index(a);
    int j = index(b);
    if (i == j) {
      throw new IllegalArgumentException("a state cannot be different from itself: " + a);
    }
    boolean[] row = i > j ? different[i] : different[j];
    int col = Math.min(i, j);
    if (row[col]) {
      return false;
    }
    row[col] = true;
    return true;
  }

  boolean markDifferentFromTrap(State state) {
    int i = index(state);
    if (differentFromTrap[i]) {
      return false;
    }
    differentFromTrap[i] = true;
    return true;
  }

  /**
   * Groups the states into classes of mutually equivalent states, in ascending order of their smallest
   * member. Only meaningful once the table has been filled, when equivalence is transitive.
   */
  IList<ISet<State>> classes() {
    LinearList<ISet<State>> classes = new LinearList<>();
    LinearList<State> representatives = new LinearList<>();

    for (State s : states) {
      long cls = -1;
      for (long i = 0; i < representatives.size(); i++) {
        if (!areDifferent(representatives.nth(i), s)) {
          cls = i;
          break;
        }
      }

      if (cls < 0) {
        representatives.addLast(s);
        classes.addLast(LinearSet.of(s));
      } else {
        classes.nth(cls).add(s);
      }
    }
    return classes;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < differentFromTrap.length; i++) {
      sb.append(states.nth(i)).append(differentFromTrap[i] ? " !trap" : "");
      for (int j = 0; j < i; j++) {
        if (!different[i][j]) {
          sb.append(" =").append(states.nth(j));
        }
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
