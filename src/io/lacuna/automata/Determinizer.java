package io.lacuna.automata;

import io.lacuna.automata.intervals.IntervalMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.bifurcan.Lists;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subset construction: turns an {@link Nfa} into a {@link Dfa} accepting the same language, where each state
 * of the result stands for the set of automaton states the input could be in.
 */
public final class Determinizer {

  private static final Logger logger = Logger.getLogger("io.lacuna.automata");
  private static final Level level = Level.FINE;

  private Determinizer() {
  }

  public static <S> Dfa<S> determinize(Nfa<S> nfa) {
    return determinize(nfa, StateCombiner.union());
  }

  /**
   * @param combiner produces the state standing for each reachable subset, and must give distinct states for
   *                 distinct subsets
   * @throws IllegalStateException if {@code combiner} maps two different subsets to the same state
   */
  public static <S> Dfa<S> determinize(Nfa<S> nfa, StateCombiner combiner) {
    Dfa<S> dfa = new Dfa<>(nfa.comparator());

    ISet<State> initial = nfa.epsilonClosure(nfa.initialStates());
    if (initial.size() == 0) {
      return dfa;
    }

    if (logger.isLoggable(level)) {
      logger.log(level, "determinizing: " + nfa);
    }

    Subsets subsets = new Subsets(combiner);
    LinearList<ISet<State>> stack = new LinearList<>();

    dfa.setInitialState(subsets.state(initial));
    stack.addLast(initial);

    while (stack.size() > 0) {
      ISet<State> subset = stack.popLast();
      State src = subsets.state(subset);

      if (nfa.acceptingStates().containsAny(subset)) {
        dfa.addAcceptingState(src);
      }

      IntervalMap<S, ISet<State>> destinations = new IntervalMap<>(nfa.comparator(), (a, b) -> LinearSet.from(a).union(b));
      for (State s : subset) {
        Optional<IntervalMap<S, ISet<State>>> map = nfa.storedTransitions(s);
        if (map.isPresent()) {
          for (IntervalMap.Entry<S, ISet<State>> e : map.get()) {
            destinations.add(e.interval(), e.value());
          }
        }
      }

      for (IntervalMap.Entry<S, ISet<State>> e : destinations) {
        ISet<State> dst = nfa.epsilonClosure(e.value());
        if (!subsets.contains(dst)) {
          stack.addLast(dst);
        }
        dfa.addTransition(src, e.interval(), subsets.state(dst));
      }
    }

    if (logger.isLoggable(level)) {
      logger.log(level, "determinized: " + dfa);
    }
    return dfa;
  }

  // canonical subset -> combined state, refusing collisions
  private static final class Subsets {
    private final StateCombiner combiner;
    private final LinearMap<ISet<State>, State> states = new LinearMap<>();
    private final LinearMap<State, ISet<State>> subsets = new LinearMap<>();

    Subsets(StateCombiner combiner) {
      this.combiner = combiner;
    }

    boolean contains(ISet<State> subset) {
      return states.get(subset).isPresent();
    }

    State state(ISet<State> subset) {
      Optional<State> cached = states.get(subset);
      if (cached.isPresent()) {
        return cached.get();
      }

      State state = combiner.combine(subset);
      Optional<ISet<State>> owner = subsets.get(state);
      if (owner.isPresent()) {
        throw new IllegalStateException(
                "subsets " + Lists.sort(LinearList.from(owner.get())) + " and " + Lists.sort(LinearList.from(subset))
                        + " both combine into " + state);
      }
      states.put(subset, state);
      subsets.put(state, subset);
      return state;
    }
  }
}
