package io.lacuna.automata.intervals;

import junit.framework.TestCase;

import java.util.Arrays;

public class IntervalSetTestCase extends TestCase {

  public void testMergesOverlappingAndTouching() {
    IntervalSet<Integer> set = new IntervalSet<>(IntervalComparator.integers());
    set.add(Interval.closed(0, 4));
    set.add(Interval.closed(3, 8));
    set.add(Interval.closed(9, 10));
    set.add(Interval.closed(20, 30));

    assertEquals(Arrays.asList(Interval.closed(0, 10), Interval.closed(20, 30)), set.intervals());
    assertEquals(2, set.size());
  }

  public void testSingletonsFuseIntoRange() {
    IntervalSet<Character> set = new IntervalSet<>(IntervalComparator.characters());
    for (char c = 'a'; c <= 'f'; c++) {
      set.add(c);
    }
    set.add('x');

    assertEquals(Arrays.asList(Interval.closed('a', 'f'), Interval.singleton('x')), set.intervals());
  }

  public void testContains() {
    IntervalSet<Integer> set = new IntervalSet<>(IntervalComparator.integers());
    set.add(Interval.closed(0, 10));
    set.add(Interval.closed(20, 30));

    assertTrue(set.contains(5));
    assertFalse(set.contains(15));
    assertTrue(set.contains(Interval.closed(2, 8)));
    assertFalse(set.contains(Interval.closed(8, 22)));
    assertTrue(set.contains(Interval.closedOpen(5, 5)));
  }

  public void testRemove() {
    IntervalSet<Integer> set = new IntervalSet<>(IntervalComparator.integers());
    set.add(Interval.closed(0, 10));

    assertTrue(set.remove(Interval.closed(3, 4)));
    assertEquals(Arrays.asList(Interval.closed(0, 2), Interval.closed(5, 10)), set.intervals());
    assertFalse(set.remove(Interval.closed(3, 4)));
  }

  public void testComplement() {
    IntervalSet<Integer> set = new IntervalSet<>(IntervalComparator.integers());
    set.add(Interval.closed(0, 10));
    set.add(Interval.closed(20, 30));

    assertEquals(
            Arrays.asList(Interval.atMost(-1), Interval.closed(11, 19), Interval.atLeast(31)),
            set.complement().intervals());
    assertEquals(set, set.complement().complement());
  }

  public void testComplementOfEverything() {
    IntervalSet<Integer> set = new IntervalSet<>(IntervalComparator.integers());
    assertEquals(Arrays.asList(Interval.<Integer>all()), set.complement().intervals());

    set.add(Interval.<Integer>all());
    assertTrue(set.complement().isEmpty());
  }

  public void testEquality() {
    IntervalSet<Integer> a = new IntervalSet<>(IntervalComparator.integers());
    a.add(Interval.closed(0, 4)).add(Interval.closed(5, 9));

    IntervalSet<Integer> b = new IntervalSet<>(IntervalComparator.integers());
    b.add(Interval.closed(0, 9));

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }
}
