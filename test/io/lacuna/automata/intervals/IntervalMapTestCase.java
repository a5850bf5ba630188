package io.lacuna.automata.intervals;

import junit.framework.TestCase;

import java.util.Arrays;
import java.util.Collections;
import java.util.NoSuchElementException;

public class IntervalMapTestCase extends TestCase {

  private IntervalMap<Integer, String> concatenating() {
    return new IntervalMap<>(IntervalComparator.integers(), (a, b) -> a + b);
  }

  public void testSplitOverlapping() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 9), "X");
    map.add(Interval.closed(5, 15), "Y");

    assertEquals(Arrays.asList(Interval.closed(0, 4), Interval.closed(5, 9), Interval.closed(10, 15)), map.intervals());
    assertEquals(Arrays.asList("X", "XY", "Y"), map.values());
  }

  public void testSplitWithoutDomain() {
    IntervalMap<Integer, String> map = new IntervalMap<>(IntervalComparator.<Integer>natural(), (a, b) -> a + b);
    map.add(Interval.closed(0, 9), "X");
    map.add(Interval.closed(5, 15), "Y");

    assertEquals(
            Arrays.asList(Interval.closedOpen(0, 5), Interval.closed(5, 9), Interval.openClosed(9, 15)),
            map.intervals());
    assertEquals(Arrays.asList("X", "XY", "Y"), map.values());
  }

  public void testAddInside() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 20), "A");
    map.add(Interval.closed(5, 10), "B");

    assertEquals(Arrays.asList(Interval.closed(0, 4), Interval.closed(5, 10), Interval.closed(11, 20)), map.intervals());
    assertEquals(Arrays.asList("A", "AB", "A"), map.values());
  }

  public void testAddSpanningSeveral() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 2), "A");
    map.add(Interval.closed(5, 7), "B");
    map.add(Interval.closed(1, 6), "C");

    assertEquals(
            Arrays.asList(
                    Interval.closed(0, 0), Interval.closed(1, 2), Interval.closed(3, 4),
                    Interval.closed(5, 6), Interval.closed(7, 7)),
            map.intervals());
    assertEquals(Arrays.asList("A", "AC", "C", "BC", "B"), map.values());
  }

  public void testCoveringUnbounded() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(3, 5), "A");
    map.add(Interval.<Integer>all(), "B");

    assertEquals(Arrays.asList(Interval.atMost(2), Interval.closed(3, 5), Interval.atLeast(6)), map.intervals());
    assertEquals(Arrays.asList("B", "AB", "B"), map.values());
  }

  public void testEmptyIntervalIgnored() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closedOpen(3, 3), "A");
    assertTrue(map.isEmpty());
  }

  public void testDefaultCombinerRejectsOverlap() {
    IntervalMap<Integer, String> map = new IntervalMap<>(IntervalComparator.integers());
    map.add(Interval.closed(0, 4), "A");
    map.add(Interval.closed(5, 9), "B");
    try {
      map.add(4, "C");
      fail("overlap should not be combinable");
    } catch (IllegalStateException e) {
      // expected
    }
    assertEquals(Arrays.asList(Interval.closed(0, 4), Interval.closed(5, 9)), map.intervals());
    assertEquals(Arrays.asList("A", "B"), map.values());
  }

  public void testFailedCombineLeavesMapUnchanged() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 4), "A");
    map.add(Interval.closed(6, 9), "B");
    try {
      // "A" combines, "B" does not
      map.add(Interval.closed(2, 12), "C", (a, b) -> {
        if (a.equals("B")) {
          throw new IllegalStateException();
        }
        return a + b;
      });
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
    assertEquals(Arrays.asList(Interval.closed(0, 4), Interval.closed(6, 9)), map.intervals());
    assertEquals(Arrays.asList("A", "B"), map.values());
    assertFalse(map.containsKey(5));
    assertFalse(map.containsKey(12));
  }

  public void testLookup() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 4), "A");
    map.add(Interval.closed(10, 14), "B");

    assertEquals("A", map.get(0).get());
    assertEquals("A", map.get(4).get());
    assertFalse(map.get(5).isPresent());
    assertFalse(map.get(-1).isPresent());
    assertEquals("B", map.get(12).get());
    assertFalse(map.get(15).isPresent());
    assertEquals("none", map.get(7, "none"));
    assertTrue(map.containsKey(10));

    try {
      map.valueAt(9);
      fail();
    } catch (NoSuchElementException e) {
      // expected
    }
  }

  public void testValuesIntersecting() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 4), "A");
    map.add(Interval.closed(10, 14), "B");
    map.add(Interval.closed(20, 24), "C");

    assertEquals(Arrays.asList("A", "B"), map.valuesIntersecting(Interval.closed(3, 10)));
    assertEquals(Collections.emptyList(), map.valuesIntersecting(Interval.closed(5, 9)));
    assertEquals(Arrays.asList("A", "B", "C"), map.valuesIntersecting(Interval.<Integer>all()));
  }

  public void testRemove() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 9), "A");
    map.add(Interval.closed(20, 29), "B");

    assertTrue(map.remove(Interval.closed(5, 24)));
    assertEquals(Arrays.asList(Interval.closed(0, 4), Interval.closed(25, 29)), map.intervals());
    assertEquals(Arrays.asList("A", "B"), map.values());

    assertFalse(map.remove(Interval.closed(10, 20)));
  }

  public void testRemoveMiddle() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 9), "A");
    map.remove(Interval.singleton(5));

    assertEquals(Arrays.asList(Interval.closed(0, 4), Interval.closed(6, 9)), map.intervals());
  }

  public void testMergeTouching() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 4), "A");
    map.add(Interval.closed(5, 9), "A");
    map.add(Interval.closed(10, 14), "B");
    map.add(Interval.closed(16, 20), "B");
    map.mergeTouching();

    assertEquals(Arrays.asList(Interval.closed(0, 9), Interval.closed(10, 14), Interval.closed(16, 20)), map.intervals());
  }

  public void testReplaceAndRemoveIf() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 4), "A");
    map.add(Interval.closed(10, 14), "B");

    map.replaceAll(String::toLowerCase);
    assertEquals(Arrays.asList("a", "b"), map.values());

    assertTrue(map.removeIf("a"::equals));
    assertEquals(Arrays.asList(Interval.closed(10, 14)), map.intervals());
    assertFalse(map.removeIf("a"::equals));
  }

  public void testCopyIsIndependent() {
    IntervalMap<Integer, String> map = concatenating();
    map.add(Interval.closed(0, 4), "A");

    IntervalMap<Integer, String> copy = map.copy(v -> v);
    copy.add(Interval.closed(0, 9), "B");

    assertEquals(1, map.size());
    assertEquals("A", map.valueAt(2));
    assertEquals("AB", copy.valueAt(2));
    assertFalse(map.equals(copy));
  }
}
