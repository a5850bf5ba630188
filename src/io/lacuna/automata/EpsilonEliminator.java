package io.lacuna.automata;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.Lists;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes the epsilon transitions of an {@link Nfa} in place, without changing the language it accepts.
 */
public final class EpsilonEliminator {

  private static final Logger logger = Logger.getLogger("io.lacuna.automata");
  private static final Level level = Level.FINE;

  private EpsilonEliminator() {
  }

  /**
   * Every state takes over the symbol transitions of the states in its epsilon closure, inherits their
   * acceptance, and passes on its initial status to them. The epsilon transitions are dropped afterwards.
   *
   * @return false if the automaton had no epsilon transitions, in which case it is left untouched
   */
  public static <S> boolean eliminateEpsilonTransitions(Nfa<S> nfa) {
    if (nfa.epsilonTransitionCount() == 0) {
      return false;
    }

    if (logger.isLoggable(level)) {
      logger.log(level, "eliminating epsilon transitions: " + nfa);
    }

    for (State s : Lists.sort(LinearList.from(nfa.states()))) {
      ISet<State> closure = nfa.epsilonClosure(s);
      for (State t : closure) {
        if (t.equals(s)) {
          continue;
        }

        nfa.copyTransitions(s, t);
        if (nfa.isInitial(s)) {
          nfa.addInitialState(t);
        }
        if (nfa.isAccepting(t)) {
          nfa.addAcceptingState(s);
        }
      }
    }
    nfa.clearEpsilonTransitions();

    if (logger.isLoggable(level)) {
      logger.log(level, "epsilon-free: " + nfa);
    }
    return true;
  }
}
