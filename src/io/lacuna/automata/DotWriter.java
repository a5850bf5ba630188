package io.lacuna.automata;

import io.lacuna.automata.intervals.IntervalMap;
import io.lacuna.bifurcan.IEntry;
import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.Lists;
import io.lacuna.bifurcan.SortedMap;

/**
 * Renders automata as Graphviz dot source. Output is stable: states and edges are emitted in state order.
 */
class DotWriter {

  private DotWriter() {
  }

  static <S> String write(Nfa<S> nfa) {
    StringBuilder sb = new StringBuilder("digraph NFA {\n  rankdir = LR;\n");
    IList<State> states = Lists.sort(LinearList.from(nfa.states()));
    vertices(sb, states, nfa.acceptingStates());
    start(sb, Lists.sort(LinearList.from(nfa.initialStates())));

    for (State from : states) {
      SortedMap<State, LinearList<String>> labels = new SortedMap<State, LinearList<String>>().linear();
      for (IntervalMap.Entry<S, ISet<State>> e : nfa.transitionsFrom(from)) {
        for (State to : e.value()) {
          labels.getOrCreate(to, LinearList::new).addLast(e.interval().toString());
        }
      }
      for (State to : nfa.epsilonTransitionsFrom(from)) {
        labels.getOrCreate(to, LinearList::new).addLast("ε");
      }
      edges(sb, from, labels);
    }

    return sb.append("}\n").toString();
  }

  static <S> String write(Dfa<S> dfa) {
    StringBuilder sb = new StringBuilder("digraph DFA {\n  rankdir = LR;\n");
    IList<State> states = Lists.sort(LinearList.from(dfa.states()));
    vertices(sb, states, dfa.acceptingStates());
    if (dfa.initialState().isValid()) {
      start(sb, LinearList.of(dfa.initialState()));
    }

    for (State from : states) {
      SortedMap<State, LinearList<String>> labels = new SortedMap<State, LinearList<String>>().linear();
      for (IntervalMap.Entry<S, State> e : dfa.transitionsFrom(from)) {
        labels.getOrCreate(e.value(), LinearList::new).addLast(e.interval().toString());
      }
      edges(sb, from, labels);
    }

    return sb.append("}\n").toString();
  }

  private static void vertices(StringBuilder sb, IList<State> states, ISet<State> accepting) {
    for (State s : states) {
      sb.append("  ").append(id(s.toString()))
              .append(" [shape = ").append(accepting.contains(s) ? "doublecircle" : "circle").append("];\n");
    }
  }

  private static void start(StringBuilder sb, IList<State> initial) {
    for (int i = 0; i < initial.size(); i++) {
      String start = id("_start" + i);
      sb.append("  ").append(start).append(" [shape = none, label = \"\"];\n");
      sb.append("  ").append(start).append(" -> ").append(id(initial.nth(i).toString())).append(";\n");
    }
  }

  private static void edges(StringBuilder sb, State from, SortedMap<State, LinearList<String>> labels) {
    for (IEntry<State, LinearList<String>> e : labels) {
      sb.append("  ").append(id(from.toString()))
              .append(" -> ").append(id(e.key().toString()))
              .append(" [label = ").append(id(String.join(" U ", e.value()))).append("];\n");
    }
  }

  static String id(String str) {
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
