package io.lacuna.automata;

import io.lacuna.automata.intervals.IntervalMap;
import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.bifurcan.Lists;

import java.util.Collections;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Table-filling minimization: builds the smallest {@link Dfa} accepting the same language by merging the
 * reachable states that no input can tell apart. Unreachable states are dropped.
 */
public final class Minimizer {

  private static final Logger logger = Logger.getLogger("io.lacuna.automata");
  private static final Level level = Level.FINE;

  private Minimizer() {
  }

  public static <S> Dfa<S> minimize(Dfa<S> dfa) {
    return minimize(dfa, StateCombiner.union());
  }

  public static <S> Dfa<S> minimize(Dfa<S> dfa, StateCombiner combiner) {
    return minimize(dfa, combiner, Collections.emptyList());
  }

  /**
   * @param combiner      produces the state standing for each class of equivalent states
   * @param differentiate states that must not be merged with any other state, even if equivalent
   * @throws IllegalStateException if {@code combiner} maps two different classes to the same state
   */
  public static <S> Dfa<S> minimize(Dfa<S> dfa, StateCombiner combiner, Iterable<State> differentiate) {
    Dfa<S> result = new Dfa<>(dfa.comparator());
    if (!dfa.initialState().isValid()) {
      return result;
    }

    if (logger.isLoggable(level)) {
      logger.log(level, "minimizing: " + dfa);
    }

    EquivalenceTable table = new EquivalenceTable(dfa.reachableStates());
    initialize(table, dfa, differentiate);
    fill(table, dfa);

    if (logger.isLoggable(level)) {
      logger.log(level, "equivalence table:\n" + table);
    }

    // the state each class combines into
    LinearMap<State, State> combined = new LinearMap<>();
    LinearMap<State, ISet<State>> owners = new LinearMap<>();
    IList<ISet<State>> classes = table.classes();
    for (ISet<State> cls : classes) {
      State state = combiner.combine(cls);
      Optional<ISet<State>> owner = owners.get(state);
      if (owner.isPresent()) {
        throw new IllegalStateException(
                "classes " + Lists.sort(LinearList.from(owner.get())) + " and " + Lists.sort(LinearList.from(cls))
                        + " both combine into " + state);
      }
      owners.put(state, cls);
      cls.forEach(s -> combined.put(s, state));
    }

    result.setInitialState(combined.get(dfa.initialState()).get());
    for (ISet<State> cls : classes) {
      for (State s : cls) {
        State src = combined.get(s).get();
        if (dfa.isAccepting(s)) {
          result.addAcceptingState(src);
        }
        for (IntervalMap.Entry<S, State> e : transitions(dfa, s)) {
          result.addTransition(src, e.interval(), combined.get(e.value()).get());
        }
      }
    }

    if (logger.isLoggable(level)) {
      logger.log(level, "minimized: " + result);
    }
    return result;
  }

  private static <S> void initialize(EquivalenceTable table, Dfa<S> dfa, Iterable<State> differentiate) {
    IList<State> states = table.states();
    ISet<State> reachable = LinearSet.from(states);

    for (int i = 0; i < states.size(); i++) {
      State a = states.nth(i);
      if (dfa.isAccepting(a)) {
        table.markDifferentFromTrap(a);
      }
      for (int j = 0; j < i; j++) {
        State b = states.nth(j);
        if (dfa.isAccepting(a) != dfa.isAccepting(b)) {
          table.markDifferent(a, b);
        }
      }
    }

    for (State d : differentiate) {
      if (!reachable.contains(d)) {
        continue;
      }
      table.markDifferentFromTrap(d);
      for (State s : states) {
        if (!s.equals(d)) {
          table.markDifferent(d, s);
        }
      }
    }
  }

  private static <S> void fill(EquivalenceTable table, Dfa<S> dfa) {
    IList<State> states = table.states();

    boolean changed = true;
    int rounds = 0;
    while (changed) {
      changed = false;
      rounds++;

      for (State s : states) {
        if (!table.isDifferentFromTrap(s) && leadsAwayFromTrap(table, dfa, s)) {
          changed |= table.markDifferentFromTrap(s);
        }
      }

      for (int i = 0; i < states.size(); i++) {
        for (int j = 0; j < i; j++) {
          State a = states.nth(i);
          State b = states.nth(j);
          if (!table.areDifferent(a, b) && distinguishable(table, dfa, a, b)) {
            changed |= table.markDifferent(a, b);
          }
        }
      }
    }

    if (logger.isLoggable(level)) {
      logger.log(level, "equivalence table filled after " + rounds + " rounds");
    }
  }

  // the trap has no transitions, so `state` differs from it if any transition does
  private static <S> boolean leadsAwayFromTrap(EquivalenceTable table, Dfa<S> dfa, State state) {
    for (IntervalMap.Entry<S, State> e : transitions(dfa, state)) {
      if (table.isDifferentFromTrap(e.value())) {
        return true;
      }
    }
    return false;
  }

  // overlays both transition maps, a fragment only one of them covers is compared against the trap
  private static <S> boolean distinguishable(EquivalenceTable table, Dfa<S> dfa, State a, State b) {
    IntervalMap<S, State[]> overlay = new IntervalMap<>(dfa.comparator(), Minimizer::concat);
    for (IntervalMap.Entry<S, State> e : transitions(dfa, a)) {
      overlay.add(e.interval(), new State[] {e.value()});
    }
    for (IntervalMap.Entry<S, State> e : transitions(dfa, b)) {
      overlay.add(e.interval(), new State[] {e.value()});
    }

    for (State[] dsts : overlay.values()) {
      if (dsts.length == 1
              ? table.isDifferentFromTrap(dsts[0])
              : table.areDifferent(dsts[0], dsts[1])) {
        return true;
      }
    }
    return false;
  }

  private static State[] concat(State[] a, State[] b) {
    State[] result = new State[a.length + b.length];
    System.arraycopy(a, 0, result, 0, a.length);
    System.arraycopy(b, 0, result, a.length, b.length);
    return result;
  }

  private static <S> Iterable<IntervalMap.Entry<S, State>> transitions(Dfa<S> dfa, State state) {
    return dfa.storedTransitions(state)
            .<Iterable<IntervalMap.Entry<S, State>>>map(m -> m)
            .orElse(Collections.emptyList());
  }
}
