package io.lacuna.automata.intervals;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.SortedMap;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * An ordered map from non-overlapping intervals to values.
 * <p>
 * Adding an interval that overlaps stored entries splits both sides at their boundaries: the overlapping
 * fragments get {@code combiner(existing, added)}, the rest keep the value they had. Entries are always
 * stored normalized (see {@link IntervalComparator#normalize(Interval)}), and lookups are a binary search over
 * lower bounds.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
public class IntervalMap<K, V> implements Iterable<IntervalMap.Entry<K, V>> {

  public static final class Entry<K, V> {
    private final Interval<K> interval;
    private final V value;

    Entry(Interval<K> interval, V value) {
      this.interval = interval;
      this.value = value;
    }

    public Interval<K> interval() {
      return interval;
    }

    public V value() {
      return value;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Entry)) {
        return false;
      }
      Entry<?, ?> other = (Entry<?, ?>) obj;
      return interval.equals(other.interval) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return 31 * interval.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
      return interval + "=" + value;
    }
  }

  private final IntervalComparator<K> comparator;
  private final BinaryOperator<V> combiner;
  private SortedMap<Bound<K>, Entry<K, V>> entries;

  /**
   * Creates a map that refuses to combine values, adding an overlapping interval throws an
   * {@link IllegalStateException}.
   */
  public IntervalMap(IntervalComparator<K> comparator) {
    this(comparator, (a, b) -> {
      throw new IllegalStateException("overlapping intervals with values " + a + " and " + b);
    });
  }

  public IntervalMap(IntervalComparator<K> comparator, BinaryOperator<V> combiner) {
    this.comparator = Objects.requireNonNull(comparator);
    this.combiner = Objects.requireNonNull(combiner);
    this.entries = empty();
  }

  private SortedMap<Bound<K>, Entry<K, V>> empty() {
    return new SortedMap<Bound<K>, Entry<K, V>>(comparator::compareLower).linear();
  }

  public IntervalComparator<K> comparator() {
    return comparator;
  }

  public IntervalMap<K, V> add(K key, V value) {
    return add(Interval.singleton(key), value, combiner);
  }

  public IntervalMap<K, V> add(Interval<K> interval, V value) {
    return add(interval, value, combiner);
  }

  /**
   * Maps every key of {@code interval} to {@code value}, or to {@code combiner(existing, value)} where a
   * value is already present. Empty intervals are ignored. If {@code combiner} throws, the map is left as it
   * was.
   */
  public IntervalMap<K, V> add(Interval<K> interval, V value, BinaryOperator<V> combiner) {
    Objects.requireNonNull(value);
    Optional<Interval<K>> normalized = comparator.normalize(interval);
    if (!normalized.isPresent()) {
      return this;
    }

    Interval<K> iv = normalized.get();
    IList<Entry<K, V>> overlapping = overlapping(iv);
    if (overlapping.size() == 0) {
      entries.put(iv.lower(), new Entry<>(iv, value));
      return this;
    }

    LinearList<Entry<K, V>> fragments = new LinearList<>();

    // lower bound of the part of `iv` that no entry has covered yet
    Bound<K> cursor = iv.lower();
    for (Entry<K, V> e : overlapping) {
      Interval<K> existing = e.interval;

      if (comparator.compareLower(existing.lower(), iv.lower()) < 0) {
        fragment(fragments, existing.lower(), iv.lower().touching(), e.value);
      }
      if (comparator.compareLower(cursor, existing.lower()) < 0) {
        fragment(fragments, cursor, existing.lower().touching(), value);
      }

      Bound<K> lower = comparator.compareLower(existing.lower(), iv.lower()) < 0 ? iv.lower() : existing.lower();
      Bound<K> upper = comparator.compareUpper(existing.upper(), iv.upper()) < 0 ? existing.upper() : iv.upper();
      fragment(fragments, lower, upper, combiner.apply(e.value, value));

      if (comparator.compareUpper(existing.upper(), iv.upper()) > 0) {
        fragment(fragments, iv.upper().touching(), existing.upper(), e.value);
      }

      cursor = existing.upper().isUnbounded() ? null : existing.upper().touching();
    }

    if (cursor != null) {
      fragment(fragments, cursor, iv.upper(), value);
    }

    overlapping.forEach(e -> entries.remove(e.interval.lower()));
    fragments.forEach(e -> entries.put(e.interval.lower(), e));
    return this;
  }

  private void fragment(LinearList<Entry<K, V>> fragments, Bound<K> lower, Bound<K> upper, V value) {
    comparator.between(lower, upper).ifPresent(iv -> fragments.addLast(new Entry<>(iv, value)));
  }

  // entries overlapping the normalized interval, in ascending order
  private IList<Entry<K, V>> overlapping(Interval<K> iv) {
    LinearList<Entry<K, V>> result = new LinearList<>();
    OptionalLong floor = entries.inclusiveFloorIndex(iv.lower());
    for (long i = floor.isPresent() ? floor.getAsLong() : 0; i < entries.size(); i++) {
      Entry<K, V> e = entries.nth(i).value();
      if (comparator.compareUpperToLower(iv.upper(), e.interval.lower()) <= 0) {
        break;
      }
      if (comparator.cutsOverlap(e.interval, iv)) {
        result.addLast(e);
      }
    }
    return result;
  }

  /// lookup

  public Optional<V> get(K key) {
    OptionalLong floor = entries.inclusiveFloorIndex(Bound.inclusive(key));
    if (!floor.isPresent()) {
      return Optional.empty();
    }
    Entry<K, V> e = entries.nth(floor.getAsLong()).value();
    return comparator.contains(e.interval, key) ? Optional.of(e.value) : Optional.empty();
  }

  public V get(K key, V defaultValue) {
    return get(key).orElse(defaultValue);
  }

  /**
   * @throws NoSuchElementException if no interval contains {@code key}
   */
  public V valueAt(K key) {
    return get(key).orElseThrow(() -> new NoSuchElementException("no interval contains " + key));
  }

  public boolean containsKey(K key) {
    return get(key).isPresent();
  }

  /**
   * @return the values of every entry overlapping {@code interval}, in ascending order
   */
  public List<V> valuesIntersecting(Interval<K> interval) {
    Optional<Interval<K>> normalized = comparator.normalize(interval);
    if (!normalized.isPresent()) {
      return Collections.emptyList();
    }
    LinearList<V> result = new LinearList<>();
    overlapping(normalized.get()).forEach(e -> result.addLast(e.value));
    return result.toList();
  }

  /// removal

  /**
   * Removes every key of {@code interval} from the map, keeping the parts of partially covered entries that
   * lie outside of it.
   *
   * @return true if anything was removed
   */
  public boolean remove(Interval<K> interval) {
    Optional<Interval<K>> normalized = comparator.normalize(interval);
    if (!normalized.isPresent()) {
      return false;
    }

    Interval<K> iv = normalized.get();
    IList<Entry<K, V>> overlapping = overlapping(iv);
    LinearList<Entry<K, V>> remainders = new LinearList<>();
    for (Entry<K, V> e : overlapping) {
      if (comparator.compareLower(e.interval.lower(), iv.lower()) < 0) {
        fragment(remainders, e.interval.lower(), iv.lower().touching(), e.value);
      }
      if (comparator.compareUpper(e.interval.upper(), iv.upper()) > 0) {
        fragment(remainders, iv.upper().touching(), e.interval.upper(), e.value);
      }
    }

    overlapping.forEach(e -> entries.remove(e.interval.lower()));
    remainders.forEach(e -> entries.put(e.interval.lower(), e));
    return overlapping.size() > 0;
  }

  public void replaceAll(UnaryOperator<V> f) {
    for (Entry<K, V> e : entries()) {
      entries.put(e.interval.lower(), new Entry<>(e.interval, Objects.requireNonNull(f.apply(e.value))));
    }
  }

  /**
   * @return true if any entry was removed
   */
  public boolean removeIf(Predicate<V> predicate) {
    boolean removed = false;
    for (Entry<K, V> e : entries()) {
      if (predicate.test(e.value)) {
        entries.remove(e.interval.lower());
        removed = true;
      }
    }
    return removed;
  }

  public void clear() {
    entries = empty();
  }

  /**
   * Fuses neighbouring entries that hold equal values and have no gap between them.
   */
  public void mergeTouching() {
    SortedMap<Bound<K>, Entry<K, V>> merged = empty();
    Entry<K, V> last = null;
    for (Entry<K, V> e : entries.values()) {
      if (last != null
              && last.value.equals(e.value)
              && comparator.adjacent(last.interval.upper(), e.interval.lower())) {
        last = new Entry<>(Interval.between(last.interval.lower(), e.interval.upper()), last.value);
      } else {
        last = e;
      }
      merged.put(last.interval.lower(), last);
    }
    entries = merged;
  }

  /// views

  public int size() {
    return (int) entries.size();
  }

  public boolean isEmpty() {
    return entries.size() == 0;
  }

  public List<Interval<K>> intervals() {
    LinearList<Interval<K>> result = new LinearList<>();
    entries.values().forEach(e -> result.addLast(e.interval));
    return result.toList();
  }

  public List<V> values() {
    LinearList<V> result = new LinearList<>();
    entries.values().forEach(e -> result.addLast(e.value));
    return result.toList();
  }

  public List<Entry<K, V>> entries() {
    return LinearList.from(entries.values()).toList();
  }

  @Override
  public Iterator<Entry<K, V>> iterator() {
    return entries().iterator();
  }

  /**
   * @return a map with the same intervals and comparator, holding {@code copier(v)} for every value
   */
  public IntervalMap<K, V> copy(UnaryOperator<V> copier) {
    IntervalMap<K, V> map = new IntervalMap<>(comparator, combiner);
    entries.values().forEach(e -> map.entries.put(e.interval.lower(), new Entry<>(e.interval, copier.apply(e.value))));
    return map;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof IntervalMap)) {
      return false;
    }
    return entries().equals(((IntervalMap<?, ?>) obj).entries());
  }

  @Override
  public int hashCode() {
    return entries().hashCode();
  }

  @Override
  public String toString() {
    return entries().toString();
  }
}
