package io.lacuna.automata;

import io.lacuna.automata.intervals.IntervalComparator;
import io.lacuna.bifurcan.LinearSet;
import junit.framework.TestCase;

import java.util.Arrays;

import static io.lacuna.automata.Fixtures.chars;

public class MinimizerTestCase extends TestCase {

  public void testHas101Or11() {
    Dfa<Character> dfa = Fixtures.has101Or11().determinize();
    Dfa<Character> min = dfa.minimize();

    State abcd = State.of(0, 1, 2, 3);
    assertEquals(LinearSet.of(State.of(0), State.of(0, 1, 2), State.of(0, 2), abcd), min.states());
    assertEquals(8, min.transitionCount());
    assertEquals(LinearSet.of(abcd), min.acceptingStates());
    assertEquals(abcd, min.transition(abcd, '0').get());
    assertEquals(abcd, min.transition(abcd, '1').get());

    for (String s : Fixtures.BINARY_ACCEPTED) {
      assertTrue(s, min.accepts(chars(s)));
    }
    for (String s : Fixtures.BINARY_REJECTED) {
      assertFalse(s, min.accepts(chars(s)));
    }
  }

  public void testLastTwoDifferent() {
    Dfa<Character> min = Fixtures.lastTwoDifferent().minimize();

    assertEquals(
            LinearSet.of(State.of(0), State.of(1, 2), State.of(3, 4), State.of(5), State.of(6)),
            min.states());
    assertEquals(10, min.transitionCount());
    assertEquals(State.of(0), min.initialState());
    assertEquals(LinearSet.of(State.of(5), State.of(6)), min.acceptingStates());

    for (String s : Arrays.asList("ab", "ba", "bba", "aba", "abab")) {
      assertTrue(s, min.accepts(chars(s)));
    }
    for (String s : Arrays.asList("", "a", "b", "aa", "bb", "abaa")) {
      assertFalse(s, min.accepts(chars(s)));
    }
  }

  public void testIdempotent() {
    Dfa<Character> once = Fixtures.lastTwoDifferent().minimize();
    Dfa<Character> twice = once.minimize();

    assertEquals(once.states(), twice.states());
    assertEquals(once.transitionCount(), twice.transitionCount());
    for (State s : once.states()) {
      assertEquals(once.transitionsFrom(s), twice.transitionsFrom(s));
    }
  }

  public void testMinimizeIncomplete() {
    Dfa<Character> dfa = new Dfa<>(IntervalComparator.characters());
    State a = dfa.newState();
    State b = dfa.newState();
    State c = dfa.newState();
    State d = dfa.newState();
    dfa.setInitialState(a);
    dfa.addAcceptingState(d);
    dfa.addTransition(a, '0', b);
    dfa.addTransition(a, '1', c);
    dfa.addTransition(b, '0', c);
    dfa.addTransition(c, '0', b);
    dfa.addTransition(c, '1', d);

    Dfa<Character> min = dfa.minimize();
    assertEquals(LinearSet.of(a, b, c, d), min.states());
    assertEquals(5, min.transitionCount());
  }

  public void testMinimizeIncompleteIssue() {
    Dfa<Character> dfa = new Dfa<>(IntervalComparator.characters());
    State q0 = dfa.newState();
    State q1 = dfa.newState();
    State q2 = dfa.newState();
    State q3 = dfa.newState();
    State q4 = dfa.newState();
    dfa.setInitialState(q0);
    dfa.addAcceptingState(q3);
    dfa.addAcceptingState(q4);
    dfa.addTransition(q0, '0', q1);
    dfa.addTransition(q1, 'x', q2);
    dfa.addTransition(q2, '0', q3);
    dfa.addTransition(q3, '0', q4);
    dfa.addTransition(q4, '0', q4);

    Dfa<Character> min = dfa.minimize();
    State q34 = State.of(3, 4);
    assertEquals(LinearSet.of(q0, q1, q2, q34), min.states());
    assertEquals(4, min.transitionCount());
    assertEquals(q34, min.transition(q34, '0').get());
    assertTrue(min.accepts(chars("0x0")));
    assertTrue(min.accepts(chars("0x000")));
    assertFalse(min.accepts(chars("0x")));
  }

  public void testUnreachableStatesDropped() {
    Dfa<Character> dfa = Fixtures.lastTwoDifferent();
    State island = dfa.newState();
    dfa.addTransition(island, 'a', State.of(5));
    dfa.addAcceptingState(island);

    Dfa<Character> min = dfa.minimize();
    assertEquals(5, min.states().size());
    assertFalse(min.states().contains(island));
  }

  public void testDifferentiate() {
    Dfa<Character> dfa = Fixtures.lastTwoDifferent();
    Dfa<Character> min = dfa.minimize(StateCombiner.union(), LinearSet.of(State.of(2)));

    assertEquals(6, min.states().size());
    assertTrue(min.states().contains(State.of(1)));
    assertTrue(min.states().contains(State.of(2)));
    assertTrue(min.states().contains(State.of(3, 4)));
  }

  public void testSmallestCombiner() {
    Dfa<Character> min = Fixtures.lastTwoDifferent().minimize(StateCombiner.smallest());

    assertEquals(
            LinearSet.of(State.of(0), State.of(1), State.of(3), State.of(5), State.of(6)),
            min.states());
    assertEquals(State.of(1), min.transition(State.of(0), 'a').get());
    assertEquals(State.of(1), min.transition(State.of(1), 'a').get());
  }

  public void testCollidingCombiner() {
    try {
      Fixtures.lastTwoDifferent().minimize(states -> State.of(99));
      fail("distinct classes combining into one state must be refused");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testDeadStateKept() {
    Dfa<Character> dfa = new Dfa<>(IntervalComparator.characters());
    State q0 = dfa.newState();
    State dead = dfa.newState();
    State ok = dfa.newState();
    dfa.setInitialState(q0);
    dfa.addAcceptingState(ok);
    dfa.addTransition(q0, 'a', dead);
    dfa.addTransition(q0, 'b', ok);

    Dfa<Character> min = dfa.minimize();
    assertEquals(3, min.states().size());
    assertTrue(min.accepts(chars("b")));
    assertFalse(min.accepts(chars("a")));
  }

  public void testEmpty() {
    Dfa<Character> min = new Dfa<Character>(IntervalComparator.characters()).minimize();
    assertEquals(State.INVALID, min.initialState());
    assertEquals(0, min.states().size());
  }
}
