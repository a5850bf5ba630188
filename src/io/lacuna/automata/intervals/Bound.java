package io.lacuna.automata.intervals;

import java.util.Objects;

/**
 * One endpoint of an {@link Interval}. Whether it is a lower or an upper bound is decided by the
 * position it occupies in the interval, not by the bound itself.
 *
 * @param <T> the type of the bounded values
 */
public final class Bound<T> {

  public enum Type {
    INCLUSIVE,
    EXCLUSIVE,
    UNBOUNDED
  }

  private final Type type;
  private final T value;

  private Bound(Type type, T value) {
    this.type = type;
    this.value = value;
  }

  public static <T> Bound<T> inclusive(T value) {
    return new Bound<>(Type.INCLUSIVE, Objects.requireNonNull(value));
  }

  public static <T> Bound<T> exclusive(T value) {
    return new Bound<>(Type.EXCLUSIVE, Objects.requireNonNull(value));
  }

  public static <T> Bound<T> unbounded() {
    return new Bound<>(Type.UNBOUNDED, null);
  }

  public Type type() {
    return type;
  }

  public T value() {
    if (type == Type.UNBOUNDED) {
      throw new IllegalStateException("an unbounded bound has no value");
    }
    return value;
  }

  public boolean isUnbounded() {
    return type == Type.UNBOUNDED;
  }

  public boolean isInclusive() {
    return type == Type.INCLUSIVE;
  }

  public boolean isExclusive() {
    return type == Type.EXCLUSIVE;
  }

  /**
   * @return the bound on the other side of the same value, so that an interval ending with this bound and
   * an interval starting with the returned one are adjacent without a gap or an overlap
   */
  public Bound<T> touching() {
    switch (type) {
      case INCLUSIVE:
        return exclusive(value);
      case EXCLUSIVE:
        return inclusive(value);
      default:
        throw new IllegalStateException("an unbounded bound touches nothing");
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Bound)) {
      return false;
    }
    Bound<?> other = (Bound<?>) obj;
    return type == other.type && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    switch (type) {
      case INCLUSIVE:
        return "inclusive(" + value + ")";
      case EXCLUSIVE:
        return "exclusive(" + value + ")";
      default:
        return "unbounded";
    }
  }
}
