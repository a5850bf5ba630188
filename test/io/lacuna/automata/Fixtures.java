package io.lacuna.automata;

import io.lacuna.automata.intervals.IntervalComparator;

import java.util.ArrayList;
import java.util.List;

/**
 * Small automata shared by the test cases.
 */
final class Fixtures {

  private Fixtures() {
  }

  static List<Character> chars(String input) {
    List<Character> result = new ArrayList<>();
    for (char c : input.toCharArray()) {
      result.add(c);
    }
    return result;
  }

  /**
   * Accepts binary strings containing {@code 101} or {@code 11}. States A, B, C, D are q0 to q3.
   */
  static Nfa<Character> has101Or11() {
    Nfa<Character> nfa = new Nfa<>(IntervalComparator.characters());
    State a = nfa.newState();
    State b = nfa.newState();
    State c = nfa.newState();
    State d = nfa.newState();

    nfa.addInitialState(a);
    nfa.addAcceptingState(d);

    nfa.addTransition(a, '0', a);
    nfa.addTransition(a, '1', a);
    nfa.addTransition(a, '1', b);
    nfa.addTransition(b, '0', c);
    nfa.addEpsilonTransition(b, c);
    nfa.addTransition(c, '1', d);
    nfa.addTransition(d, '0', d);
    nfa.addTransition(d, '1', d);
    return nfa;
  }

  /**
   * Accepts strings over {@code a, b} whose last two symbols differ.
   */
  static Dfa<Character> lastTwoDifferent() {
    Dfa<Character> dfa = new Dfa<>(IntervalComparator.characters());
    State s = dfa.newState();
    State a = dfa.newState();
    State aa = dfa.newState();
    State b = dfa.newState();
    State bb = dfa.newState();
    State ab = dfa.newState();
    State ba = dfa.newState();

    dfa.setInitialState(s);
    dfa.addAcceptingState(ab);
    dfa.addAcceptingState(ba);

    dfa.addTransition(s, 'a', a);
    dfa.addTransition(s, 'b', b);
    dfa.addTransition(a, 'a', aa);
    dfa.addTransition(a, 'b', ab);
    dfa.addTransition(aa, 'a', aa);
    dfa.addTransition(aa, 'b', ab);
    dfa.addTransition(b, 'a', ba);
    dfa.addTransition(b, 'b', bb);
    dfa.addTransition(bb, 'a', ba);
    dfa.addTransition(bb, 'b', bb);
    dfa.addTransition(ab, 'a', ba);
    dfa.addTransition(ab, 'b', bb);
    dfa.addTransition(ba, 'a', aa);
    dfa.addTransition(ba, 'b', ab);
    return dfa;
  }

  static final String[] BINARY_ACCEPTED = {
          "11", "101", "1010", "1011", "10100", "10101", "101000", "101001",
          "00011", "000101", "000010000101", "00001000011"
  };

  static final String[] BINARY_REJECTED = {
          "", "0", "1", "00", "10", "100", "00100", "00100100000", "0010010000010000"
  };
}
