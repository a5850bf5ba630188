package io.lacuna.automata.intervals;

import java.util.Comparator;
import java.util.Objects;

/**
 * A contiguous range of values between a lower and an upper {@link Bound}. Intervals are plain values, every
 * operation that needs an ordering lives in {@link IntervalComparator}.
 *
 * @param <T> the type of the values in the interval
 */
public final class Interval<T> {

  private final Bound<T> lower;
  private final Bound<T> upper;

  private Interval(Bound<T> lower, Bound<T> upper) {
    this.lower = lower;
    this.upper = upper;
  }

  /**
   * @throws IllegalArgumentException if both bounds are finite and {@code lower} is greater than {@code upper}
   */
  public static <T> Interval<T> of(Bound<T> lower, Bound<T> upper, Comparator<? super T> comparator) {
    Objects.requireNonNull(lower);
    Objects.requireNonNull(upper);
    if (!lower.isUnbounded() && !upper.isUnbounded() && comparator.compare(lower.value(), upper.value()) > 0) {
      throw new IllegalArgumentException("lower bound " + lower + " is greater than upper bound " + upper);
    }
    return new Interval<>(lower, upper);
  }

  public static <T extends Comparable<? super T>> Interval<T> of(Bound<T> lower, Bound<T> upper) {
    return of(lower, upper, Comparator.naturalOrder());
  }

  public static <T extends Comparable<? super T>> Interval<T> closed(T lower, T upper) {
    return of(Bound.inclusive(lower), Bound.inclusive(upper));
  }

  public static <T extends Comparable<? super T>> Interval<T> open(T lower, T upper) {
    return of(Bound.exclusive(lower), Bound.exclusive(upper));
  }

  public static <T extends Comparable<? super T>> Interval<T> closedOpen(T lower, T upper) {
    return of(Bound.inclusive(lower), Bound.exclusive(upper));
  }

  public static <T extends Comparable<? super T>> Interval<T> openClosed(T lower, T upper) {
    return of(Bound.exclusive(lower), Bound.inclusive(upper));
  }

  // callers are responsible for the ordering of the bounds
  static <T> Interval<T> between(Bound<T> lower, Bound<T> upper) {
    return new Interval<>(lower, upper);
  }

  public static <T> Interval<T> singleton(T value) {
    return new Interval<>(Bound.inclusive(value), Bound.inclusive(value));
  }

  public static <T> Interval<T> atLeast(T value) {
    return new Interval<>(Bound.inclusive(value), Bound.unbounded());
  }

  public static <T> Interval<T> atMost(T value) {
    return new Interval<>(Bound.unbounded(), Bound.inclusive(value));
  }

  public static <T> Interval<T> all() {
    return new Interval<>(Bound.unbounded(), Bound.unbounded());
  }

  public Bound<T> lower() {
    return lower;
  }

  public Bound<T> upper() {
    return upper;
  }

  /**
   * @return true if both bounds are inclusive and hold the same value
   */
  public boolean isSingleton() {
    return lower.isInclusive() && upper.isInclusive() && Objects.equals(lower.value(), upper.value());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Interval)) {
      return false;
    }
    Interval<?> other = (Interval<?>) obj;
    return lower.equals(other.lower) && upper.equals(other.upper);
  }

  @Override
  public int hashCode() {
    return 31 * lower.hashCode() + upper.hashCode();
  }

  @Override
  public String toString() {
    if (isSingleton()) {
      return String.valueOf(lower.value());
    }

    StringBuilder sb = new StringBuilder();
    switch (lower.type()) {
      case INCLUSIVE:
        sb.append('[').append(lower.value());
        break;
      case EXCLUSIVE:
        sb.append('(').append(lower.value());
        break;
      default:
        sb.append("(-inf");
    }
    sb.append("; ");
    switch (upper.type()) {
      case INCLUSIVE:
        sb.append(upper.value()).append(']');
        break;
      case EXCLUSIVE:
        sb.append(upper.value()).append(')');
        break;
      default:
        sb.append("+inf)");
    }
    return sb.toString();
  }
}
