package io.lacuna.automata;

import io.lacuna.bifurcan.ISet;

/**
 * Collapses a set of states (a subset during determinization, an equivalence class during minimization)
 * into the single state that represents it in the resulting automaton.
 */
@FunctionalInterface
public interface StateCombiner {

  State combine(ISet<State> states);

  /**
   * @return a combiner producing the state holding the union of all indices
   */
  static StateCombiner union() {
    return State::combine;
  }

  /**
   * @return a combiner picking the smallest state of the set, only suitable for minimization where the
   * combined sets are disjoint
   */
  static StateCombiner smallest() {
    return states -> {
      State min = null;
      for (State s : states) {
        if (min == null || s.compareTo(min) < 0) {
          min = s;
        }
      }
      return min == null ? State.INVALID : min;
    };
  }
}
