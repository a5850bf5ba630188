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
 * A nondeterministic automaton over intervals of symbols, with epsilon transitions. A state and a symbol may
 * lead to any number of states.
 * <p>
 * States are never declared on their own: every state referenced as initial, accepting, or as either end of a
 * transition is a member of the automaton, and {@link #removeState(State)} removes every such reference.
 *
 * @param <S> the symbols that trigger transitions between states
 */
public class Nfa<S> {

  private final IntervalComparator<S> comparator;

  private final LinearSet<State> states = new LinearSet<>();
  private final LinearSet<State> initialStates = new LinearSet<>();
  private final LinearSet<State> acceptingStates = new LinearSet<>();
  private final LinearMap<State, IntervalMap<S, ISet<State>>> transitions = new LinearMap<>();
  private final LinearMap<State, LinearSet<State>> epsilonTransitions = new LinearMap<>();

  private int nextIndex = 0;

  public Nfa(IntervalComparator<S> comparator) {
    this.comparator = comparator;
  }

  public IntervalComparator<S> comparator() {
    return comparator;
  }

  /// states

  /**
   * @return a new state, with an index greater than that of any state known to this automaton
   */
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

  public Nfa<S> addInitialState(State state) {
    register(state);
    initialStates.add(state);
    return this;
  }

  public boolean removeInitialState(State state) {
    boolean present = initialStates.contains(state);
    initialStates.remove(state);
    return present;
  }

  public Nfa<S> addAcceptingState(State state) {
    register(state);
    acceptingStates.add(state);
    return this;
  }

  public boolean removeAcceptingState(State state) {
    boolean present = acceptingStates.contains(state);
    acceptingStates.remove(state);
    return present;
  }

  public boolean isInitial(State state) {
    return initialStates.contains(state);
  }

  public boolean isAccepting(State state) {
    return acceptingStates.contains(state);
  }

  /**
   * Removes {@code state} from the automaton, along with every transition from or to it.
   *
   * @return true if the state was part of the automaton
   */
  public boolean removeState(State state) {
    if (!states.contains(state)) {
      return false;
    }

    states.remove(state);
    initialStates.remove(state);
    acceptingStates.remove(state);

    transitions.remove(state);
    transitions.forEach(e -> {
      IntervalMap<S, ISet<State>> map = e.value();
      map.replaceAll(dsts -> dsts.contains(state) ? LinearSet.from(dsts).remove(state) : dsts);
      map.removeIf(dsts -> dsts.size() == 0);
    });

    epsilonTransitions.remove(state);
    epsilonTransitions.forEach(e -> e.value().remove(state));

    return true;
  }

  public ISet<State> states() {
    return LinearSet.from(states);
  }

  public ISet<State> initialStates() {
    return LinearSet.from(initialStates);
  }

  public ISet<State> acceptingStates() {
    return LinearSet.from(acceptingStates);
  }

  /**
   * @return every state reachable from an initial state, through symbol or epsilon transitions
   */
  public ISet<State> reachableStates() {
    LinearSet<State> visited = new LinearSet<>();
    LinearList<State> queue = new LinearList<>();
    for (State s : initialStates) {
      if (!visited.contains(s)) {
        visited.add(s);
        queue.addLast(s);
      }
    }

    while (queue.size() > 0) {
      State s = queue.popFirst();

      LinearSet<State> neighbors = new LinearSet<>();
      transitions.get(s).ifPresent(map -> map.values().forEach(dsts -> dsts.forEach(neighbors::add)));
      epsilonTransitions.get(s).ifPresent(dsts -> dsts.forEach(neighbors::add));

      for (State n : neighbors) {
        if (!visited.contains(n)) {
          visited.add(n);
          queue.addLast(n);
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

  public Nfa<S> addTransition(State from, S symbol, State to) {
    return addTransition(from, Interval.singleton(symbol), to);
  }

  public Nfa<S> addTransition(State from, Interval<S> on, State to) {
    register(from);
    register(to);
    transitionMap(from).add(on, LinearSet.of(to));
    return this;
  }

  public Nfa<S> addEpsilonTransition(State from, State to) {
    register(from);
    register(to);
    epsilonTransitions.getOrCreate(from, LinearSet::new).add(to);
    return this;
  }

  private IntervalMap<S, ISet<State>> transitionMap(State from) {
    return transitions.getOrCreate(from, () -> new IntervalMap<>(comparator, (a, b) -> LinearSet.from(a).union(b)));
  }

  /**
   * @return a copy of the symbol transitions leaving {@code from}
   */
  public IntervalMap<S, ISet<State>> transitionsFrom(State from) {
    return transitions.get(from)
            .map(map -> map.copy(dsts -> (ISet<State>) LinearSet.from(dsts)))
            .orElseGet(() -> new IntervalMap<>(comparator, (a, b) -> LinearSet.from(a).union(b)));
  }

  public ISet<State> epsilonTransitionsFrom(State from) {
    return epsilonTransitions.get(from)
            .map(dsts -> (ISet<State>) LinearSet.from(dsts))
            .orElseGet(LinearSet::new);
  }

  // the stored map, or nothing if the state has no symbol transitions
  Optional<IntervalMap<S, ISet<State>>> storedTransitions(State from) {
    return transitions.get(from);
  }

  // adds every symbol transition of `source` to `target`
  void copyTransitions(State target, State source) {
    Optional<IntervalMap<S, ISet<State>>> sourceMap = transitions.get(source);
    if (!sourceMap.isPresent() || sourceMap.get().isEmpty()) {
      return;
    }
    IntervalMap<S, ISet<State>> targetMap = transitionMap(target);
    for (IntervalMap.Entry<S, ISet<State>> e : sourceMap.get().entries()) {
      targetMap.add(e.interval(), LinearSet.from(e.value()));
    }
  }

  void clearEpsilonTransitions() {
    for (State s : LinearSet.from(epsilonTransitions.keys())) {
      epsilonTransitions.remove(s);
    }
  }

  /**
   * @return the states reachable from the epsilon closure of {@code from} by consuming {@code symbol},
   * including everything reachable from those through epsilon transitions
   */
  public ISet<State> transitions(State from, S symbol) {
    return step(epsilonClosure(from), symbol);
  }

  // `current` is expected to be epsilon-closed
  private ISet<State> step(ISet<State> current, S symbol) {
    LinearSet<State> next = new LinearSet<>();
    for (State s : current) {
      transitions.get(s)
              .flatMap(map -> map.get(symbol))
              .ifPresent(dsts -> epsilonClosure(dsts).forEach(next::add));
    }
    return next;
  }

  public int transitionCount() {
    int count = 0;
    for (State s : transitions.keys()) {
      for (ISet<State> dsts : transitions.get(s).get().values()) {
        count += (int) dsts.size();
      }
    }
    return count;
  }

  public int epsilonTransitionCount() {
    int count = 0;
    for (State s : epsilonTransitions.keys()) {
      count += (int) epsilonTransitions.get(s).get().size();
    }
    return count;
  }

  /**
   * @return every symbol that triggers some transition
   */
  public IntervalSet<S> alphabet() {
    IntervalSet<S> alphabet = new IntervalSet<>(comparator);
    transitions.forEach(e -> alphabet.addAll(e.value().intervals()));
    return alphabet;
  }

  /// epsilon closure

  /**
   * @return {@code state} and every state reachable from it through epsilon transitions alone
   */
  public ISet<State> epsilonClosure(State state) {
    return epsilonClosure(LinearSet.of(state));
  }

  public ISet<State> epsilonClosure(Iterable<State> states) {
    LinearSet<State> closure = new LinearSet<>();
    LinearList<State> stack = new LinearList<>();
    for (State s : states) {
      if (!closure.contains(s)) {
        closure.add(s);
        stack.addLast(s);
      }
    }

    while (stack.size() > 0) {
      State s = stack.popLast();
      Optional<LinearSet<State>> dsts = epsilonTransitions.get(s);
      if (dsts.isPresent()) {
        for (State t : dsts.get()) {
          if (!closure.contains(t)) {
            closure.add(t);
            stack.addLast(t);
          }
        }
      }
    }
    return closure;
  }

  /// operations

  /**
   * @return true if the automaton ends up in an accepting state after consuming all of {@code input}
   */
  public boolean accepts(Iterable<S> input) {
    ISet<State> current = epsilonClosure(initialStates);
    for (S symbol : input) {
      current = step(current, symbol);
      if (current.size() == 0) {
        return false;
      }
    }
    return acceptingStates.containsAny(current);
  }

  public boolean eliminateEpsilonTransitions() {
    return EpsilonEliminator.eliminateEpsilonTransitions(this);
  }

  public Dfa<S> determinize() {
    return Determinizer.determinize(this);
  }

  public Dfa<S> determinize(StateCombiner combiner) {
    return Determinizer.determinize(this, combiner);
  }

  public Nfa<S> copy() {
    Nfa<S> nfa = new Nfa<>(comparator);
    states.forEach(nfa::register);
    initialStates.forEach(nfa.initialStates::add);
    acceptingStates.forEach(nfa.acceptingStates::add);
    transitions.forEach(e -> nfa.transitions.put(e.key(), transitionsFrom(e.key())));
    epsilonTransitions.forEach(e -> nfa.epsilonTransitions.put(e.key(), LinearSet.from(e.value())));
    nfa.nextIndex = nextIndex;
    return nfa;
  }

  public String toDot() {
    return DotWriter.write(this);
  }

  @Override
  public String toString() {
    return "nfa[states=" + states.size() + ", transitions=" + transitionCount()
            + ", epsilon=" + epsilonTransitionCount() + "]";
  }
}
