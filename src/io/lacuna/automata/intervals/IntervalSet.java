package io.lacuna.automata.intervals;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * A set of values stored as the smallest number of disjoint, non-touching intervals.
 *
 * @param <T> the type of the values
 */
public class IntervalSet<T> implements Iterable<Interval<T>> {

  private final IntervalMap<T, Boolean> map;

  public IntervalSet(IntervalComparator<T> comparator) {
    this.map = new IntervalMap<>(comparator, (a, b) -> Boolean.TRUE);
  }

  public IntervalComparator<T> comparator() {
    return map.comparator();
  }

  public IntervalSet<T> add(T value) {
    return add(Interval.singleton(value));
  }

  public IntervalSet<T> add(Interval<T> interval) {
    map.add(interval, Boolean.TRUE);
    map.mergeTouching();
    return this;
  }

  public IntervalSet<T> addAll(Iterable<Interval<T>> intervals) {
    intervals.forEach(iv -> map.add(iv, Boolean.TRUE));
    map.mergeTouching();
    return this;
  }

  /**
   * @return true if any value was removed
   */
  public boolean remove(Interval<T> interval) {
    return map.remove(interval);
  }

  public boolean contains(T value) {
    return map.containsKey(value);
  }

  /**
   * @return true if every value of {@code interval} is in the set
   */
  public boolean contains(Interval<T> interval) {
    Optional<Interval<T>> normalized = comparator().normalize(interval);
    if (!normalized.isPresent()) {
      return true;
    }
    for (Interval<T> iv : map.intervals()) {
      if (comparator().contains(iv, normalized.get())) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the set of every value not in this set
   */
  public IntervalSet<T> complement() {
    IntervalComparator<T> comparator = comparator();
    IntervalSet<T> result = new IntervalSet<>(comparator);

    Bound<T> lower = Bound.unbounded();
    for (Interval<T> iv : map.intervals()) {
      if (!iv.lower().isUnbounded()) {
        comparator.between(lower, iv.lower().touching()).ifPresent(gap -> result.map.add(gap, Boolean.TRUE));
      }
      if (iv.upper().isUnbounded()) {
        return result;
      }
      lower = iv.upper().touching();
    }
    comparator.between(lower, Bound.unbounded()).ifPresent(gap -> result.map.add(gap, Boolean.TRUE));
    return result;
  }

  public List<Interval<T>> intervals() {
    return map.intervals();
  }

  public int size() {
    return map.size();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  @Override
  public Iterator<Interval<T>> iterator() {
    return intervals().iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof IntervalSet)) {
      return false;
    }
    return intervals().equals(((IntervalSet<?>) obj).intervals());
  }

  @Override
  public int hashCode() {
    return intervals().hashCode();
  }

  @Override
  public String toString() {
    return intervals().toString();
  }
}
