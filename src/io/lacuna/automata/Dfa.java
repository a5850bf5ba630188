package io.lacuna.automata;

import io.lacuna.automata.intervals.Interval;
import io.lacuna.automata.intervals.IntervalComparator;
import io.lacuna.automata.intervals.IntervalMap;
import io.lacuna.automata.intervals.IntervalSet;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Optional;

/**
 * A deterministic automaton over intervals of symbols: a state and a symbol lead to at most one state.
 * Missing transitions reject.
 *
 * @param <S> the symbols that trigger transitions between states
 */
public class Dfa<S> {

  private final IntervalComparator<S> comparator;

  private State initialState = State.INVALID;
  private final LinearSet<State> states = new LinearSet<>();
  private final LinearSet<State> acceptingStates = new LinearSet<>();
  private final LinearMap<State, IntervalMap<S, State>> transitions = new LinearMap<>();

  private int nextIndex = 0;

  public Dfa(IntervalComparator<S> comparator) {
    this.comparator = comparator;
  }

  public IntervalComparator<S> comparator() {
    return comparator;
  }

  /// states

  public State newState() {
    State s = State.of(nextIndex);
    register(s);
    return s;
  }

  private void register(State state) {
    if (!state.isValid()) {
      throw new IllegalArgumentException("the invalid state cannot be part of an automaton");
    }
    states.add(state);
    nextIndex = Math.max(nextIndex, state.maxIndex() + 1);
  }

  /**
   * @return the initial state, or {@link State#INVALID} if none was set
   */
  public State initialState() {
    return initialState;
  }

  public Dfa<S> setInitialState(State state) {
    register(state);
    initialState = state;
    return this;
  }

  public Dfa<S> addAcceptingState(State state) {
    register(state);
    acceptingStates.add(state);
    return this;
  }

  public boolean removeAcceptingState(State state) {
    boolean present = acceptingStates.contains(state);
    acceptingStates.remove(state);
    return present;
  }

  public boolean isAccepting(State state) {
    return acceptingStates.contains(state);
  }

  /**
   * Removes {@code state} from the automaton, along with every transition from or to it. Removing the initial
   * state leaves the automaton without one.
   *
   * @return true if the state was part of the automaton
   */
  public boolean removeState(State state) {
    if (!states.contains(state)) {
      return false;
    }

    states.remove(state);
    acceptingStates.remove(state);
    if (initialState.equals(state)) {
      initialState = State.INVALID;
    }

    transitions.remove(state);
    transitions.forEach(e -> e.value().removeIf(state::equals));
    return true;
  }

  public ISet<State> states() {
    return LinearSet.from(states);
  }

  public ISet<State> acceptingStates() {
    return LinearSet.from(acceptingStates);
  }

  public ISet<State> reachableStates() {
    LinearSet<State> visited = new LinearSet<>();
    if (!initialState.isValid()) {
      return visited;
    }

    LinearList<State> queue = LinearList.of(initialState);
    visited.add(initialState);
    while (queue.size() > 0) {
      State s = queue.popFirst();
      Optional<IntervalMap<S, State>> map = transitions.get(s);
      if (map.isPresent()) {
        for (State t : map.get().values()) {
          if (!visited.contains(t)) {
            visited.add(t);
            queue.addLast(t);
          }
        }
      }
    }
    return visited;
  }

  /**
   * @return true if any state was removed
   */
  public boolean removeUnreachable() {
    ISet<State> reachable = reachableStates();
    boolean removed = false;
    for (State s : states()) {
      if (!reachable.contains(s)) {
        removed |= removeState(s);
      }
    }
    return removed;
  }

  /// transitions

  public Dfa<S> addTransition(State from, S symbol, State to) {
    return addTransition(from, Interval.singleton(symbol), to);
  }

  /**
   * Adding a transition that is already present is a no-op.
   *
   * @throws IllegalStateException if part of {@code on} already leads from {@code from} to another state
   */
  public Dfa<S> addTransition(State from, Interval<S> on, State to) {
    register(from);
    register(to);
    transitions.getOrCreate(from, () -> new IntervalMap<>(comparator)).add(on, to, (existing, added) -> {
      if (!existing.equals(added)) {
        throw new IllegalStateException(
                "state " + from + " already transitions to " + existing + " on part of " + on + ", cannot add " + added);
      }
      return existing;
    });
    return this;
  }

  public Optional<State> transition(State from, S symbol) {
    return transitions.get(from).flatMap(map -> map.get(symbol));
  }

  /**
   * @return a copy of the transitions leaving {@code from}
   */
  public IntervalMap<S, State> transitionsFrom(State from) {
    return transitions.get(from)
            .map(map -> map.copy(s -> s))
            .orElseGet(() -> new IntervalMap<>(comparator));
  }

  // the stored map, or nothing if the state has no transitions
  Optional<IntervalMap<S, State>> storedTransitions(State from) {
    return transitions.get(from);
  }

  public int transitionCount() {
    int count = 0;
    for (State s : transitions.keys()) {
      count += transitions.get(s).get().size();
    }
    return count;
  }

  public IntervalSet<S> alphabet() {
    IntervalSet<S> alphabet = new IntervalSet<>(comparator);
    transitions.forEach(e -> alphabet.addAll(e.value().intervals()));
    return alphabet;
  }

  /// completion

  /**
   * @return true if every state has a transition for every symbol of {@code alphabet}
   */
  public boolean isComplete(IntervalSet<S> alphabet) {
    for (State s : states) {
      IntervalSet<S> covered = new IntervalSet<>(comparator);
      transitions.get(s).ifPresent(map -> covered.addAll(map.intervals()));
      for (Interval<S> iv : alphabet) {
        if (!covered.contains(iv)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Adds a transition to {@code trap} for every symbol of {@code alphabet} a state has no transition for.
   * The trap state transitions to itself on the whole alphabet.
   *
   * @return true if any transition was added
   */
  public boolean complete(IntervalSet<S> alphabet, State trap) {
    register(trap);

    boolean changed = false;
    for (State s : states()) {
      IntervalSet<S> missing = new IntervalSet<>(comparator).addAll(alphabet);
      transitions.get(s).ifPresent(map -> map.intervals().forEach(missing::remove));
      for (Interval<S> iv : missing) {
        addTransition(s, iv, trap);
        changed = true;
      }
    }
    return changed;
  }

  /// operations

  public boolean accepts(Iterable<S> input) {
    State current = initialState;
    if (!current.isValid()) {
      return false;
    }
    for (S symbol : input) {
      Optional<State> next = transition(current, symbol);
      if (!next.isPresent()) {
        return false;
      }
      current = next.get();
    }
    return acceptingStates.contains(current);
  }

  public Dfa<S> minimize() {
    return Minimizer.minimize(this);
  }

  public Dfa<S> minimize(StateCombiner combiner) {
    return Minimizer.minimize(this, combiner);
  }

  public Dfa<S> minimize(StateCombiner combiner, Iterable<State> differentiate) {
    return Minimizer.minimize(this, combiner, differentiate);
  }

  public Dfa<S> copy() {
    Dfa<S> dfa = new Dfa<>(comparator);
    states.forEach(dfa::register);
    dfa.initialState = initialState;
    acceptingStates.forEach(dfa.acceptingStates::add);
    transitions.forEach(e -> dfa.transitions.put(e.key(), transitionsFrom(e.key())));
    dfa.nextIndex = nextIndex;
    return dfa;
  }

  public String toDot() {
    return DotWriter.write(this);
  }

  @Override
  public String toString() {
    return "dfa[states=" + states.size() + ", transitions=" + transitionCount() + "]";
  }
}
