package io.lacuna.automata.intervals;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Orders bounds and relates intervals to each other under a value ordering and, optionally, a
 * {@link DiscreteDomain}.
 * <p>
 * Bounds are compared as cut points: a lower {@code [v} and an upper {@code v)} both sit just below {@code v},
 * a lower {@code (v} and an upper {@code v]} both sit just above it, and unbounded ends sit at
 * minus and plus infinity. An interval is non-empty iff its lower cut is strictly below its upper cut.
 * <p>
 * When a domain is present every interval is normalized to inclusive finite bounds before being related, so
 * {@code [0; 5)} and {@code [0; 4]} are the same interval, and {@code [0; 4]} touches {@code [5; 9]}.
 *
 * @param <T> the type of the values
 */
public final class IntervalComparator<T> {

  private final Comparator<? super T> comparator;
  private final DiscreteDomain<T> domain;

  public IntervalComparator(Comparator<? super T> comparator) {
    this(comparator, null);
  }

  public IntervalComparator(Comparator<? super T> comparator, DiscreteDomain<T> domain) {
    this.comparator = Objects.requireNonNull(comparator);
    this.domain = domain;
  }

  public static <T extends Comparable<? super T>> IntervalComparator<T> natural() {
    return new IntervalComparator<>(Comparator.<T>naturalOrder());
  }

  public static IntervalComparator<Integer> integers() {
    return new IntervalComparator<>(Comparator.<Integer>naturalOrder(), DiscreteDomain.integers());
  }

  public static IntervalComparator<Character> characters() {
    return new IntervalComparator<>(Comparator.<Character>naturalOrder(), DiscreteDomain.characters());
  }

  public Comparator<? super T> valueComparator() {
    return comparator;
  }

  public Optional<DiscreteDomain<T>> domain() {
    return Optional.ofNullable(domain);
  }

  /// bounds

  public int compareLower(Bound<T> a, Bound<T> b) {
    return compareCuts(a, false, b, false);
  }

  public int compareUpper(Bound<T> a, Bound<T> b) {
    return compareCuts(a, true, b, true);
  }

  /**
   * @return a negative number if the cut of {@code upper} is below the cut of {@code lower}, zero if they are
   * the same cut, a positive number otherwise
   */
  public int compareUpperToLower(Bound<T> upper, Bound<T> lower) {
    return compareCuts(upper, true, lower, false);
  }

  private int compareCuts(Bound<T> a, boolean aUpper, Bound<T> b, boolean bUpper) {
    if (a.isUnbounded() || b.isUnbounded()) {
      return Integer.compare(infinity(a, aUpper), infinity(b, bUpper));
    }

    int cmp = comparator.compare(a.value(), b.value());
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(offset(a, aUpper), offset(b, bUpper));
  }

  private static int infinity(Bound<?> bound, boolean upper) {
    if (!bound.isUnbounded()) {
      return 0;
    }
    return upper ? 1 : -1;
  }

  private static int offset(Bound<?> bound, boolean upper) {
    if (upper) {
      return bound.isInclusive() ? 1 : 0;
    }
    return bound.isInclusive() ? 0 : 1;
  }

  /// intervals

  /**
   * @return the canonical form of {@code interval}, or nothing if it contains no values
   */
  public Optional<Interval<T>> normalize(Interval<T> interval) {
    return between(interval.lower(), interval.upper());
  }

  /**
   * @return the normalized interval spanning from {@code lower} to {@code upper}, or nothing if it would be
   * empty
   */
  public Optional<Interval<T>> between(Bound<T> lower, Bound<T> upper) {
    if (domain != null) {
      if (lower.isExclusive()) {
        Optional<T> next = domain.next(lower.value());
        if (!next.isPresent()) {
          return Optional.empty();
        }
        lower = Bound.inclusive(next.get());
      }
      if (upper.isExclusive()) {
        Optional<T> previous = domain.previous(upper.value());
        if (!previous.isPresent()) {
          return Optional.empty();
        }
        upper = Bound.inclusive(previous.get());
      }
    }

    if (compareCuts(lower, false, upper, true) >= 0) {
      return Optional.empty();
    }
    return Optional.of(Interval.between(lower, upper));
  }

  public boolean isEmpty(Interval<T> interval) {
    return !normalize(interval).isPresent();
  }

  public boolean contains(Interval<T> interval, T value) {
    Bound<T> lower = interval.lower();
    Bound<T> upper = interval.upper();

    if (!lower.isUnbounded()) {
      int cmp = comparator.compare(lower.value(), value);
      if (lower.isInclusive() ? cmp > 0 : cmp >= 0) {
        return false;
      }
    }
    if (!upper.isUnbounded()) {
      int cmp = comparator.compare(value, upper.value());
      if (upper.isInclusive() ? cmp > 0 : cmp >= 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return true if every value of {@code inner} is in {@code outer}
   */
  public boolean contains(Interval<T> outer, Interval<T> inner) {
    Optional<Interval<T>> in = normalize(inner);
    if (!in.isPresent()) {
      return true;
    }
    Optional<Interval<T>> out = normalize(outer);
    return out.isPresent()
            && compareLower(out.get().lower(), in.get().lower()) <= 0
            && compareUpper(out.get().upper(), in.get().upper()) >= 0;
  }

  public boolean overlaps(Interval<T> a, Interval<T> b) {
    Optional<Interval<T>> x = normalize(a);
    Optional<Interval<T>> y = normalize(b);
    return x.isPresent() && y.isPresent() && cutsOverlap(x.get(), y.get());
  }

  // assumes both intervals are normalized
  boolean cutsOverlap(Interval<T> a, Interval<T> b) {
    return compareCuts(a.lower(), false, b.upper(), true) < 0
            && compareCuts(b.lower(), false, a.upper(), true) < 0;
  }

  public boolean isDisjoint(Interval<T> a, Interval<T> b) {
    return !overlaps(a, b);
  }

  /**
   * @return true if both intervals are non-empty and every value of {@code a} is smaller than every value of
   * {@code b}
   */
  public boolean isBefore(Interval<T> a, Interval<T> b) {
    Optional<Interval<T>> x = normalize(a);
    Optional<Interval<T>> y = normalize(b);
    return x.isPresent() && y.isPresent() && compareUpperToLower(x.get().upper(), y.get().lower()) <= 0;
  }

  /**
   * @return true if the intervals do not overlap and there is no value between them
   */
  public boolean isTouching(Interval<T> a, Interval<T> b) {
    Optional<Interval<T>> x = normalize(a);
    Optional<Interval<T>> y = normalize(b);
    if (!x.isPresent() || !y.isPresent()) {
      return false;
    }
    return adjacent(x.get().upper(), y.get().lower()) || adjacent(y.get().upper(), x.get().lower());
  }

  // assumes normalized bounds
  boolean adjacent(Bound<T> upper, Bound<T> lower) {
    if (upper.isUnbounded() || lower.isUnbounded()) {
      return false;
    }
    if (compareUpperToLower(upper, lower) == 0) {
      return true;
    }
    if (domain != null && upper.isInclusive() && lower.isInclusive()) {
      Optional<T> next = domain.next(upper.value());
      return next.isPresent() && comparator.compare(next.get(), lower.value()) == 0;
    }
    return false;
  }

  public Optional<Interval<T>> intersection(Interval<T> a, Interval<T> b) {
    if (!overlaps(a, b)) {
      return Optional.empty();
    }
    Bound<T> lower = compareLower(a.lower(), b.lower()) < 0 ? b.lower() : a.lower();
    Bound<T> upper = compareUpper(a.upper(), b.upper()) < 0 ? a.upper() : b.upper();
    return between(lower, upper);
  }
}
