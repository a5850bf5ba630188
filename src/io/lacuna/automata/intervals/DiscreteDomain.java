package io.lacuna.automata.intervals;

import java.util.Optional;

/**
 * A value domain where every value has a well defined neighbour on each side, so that {@code (4; 10)} and
 * {@code [5; 9]} denote the same set of values.
 *
 * @param <T> the type of the values
 */
public interface DiscreteDomain<T> {

  /**
   * @return the smallest value greater than {@code value}, or nothing if {@code value} is the maximum
   */
  Optional<T> next(T value);

  /**
   * @return the greatest value smaller than {@code value}, or nothing if {@code value} is the minimum
   */
  Optional<T> previous(T value);

  static DiscreteDomain<Integer> integers() {
    return new DiscreteDomain<Integer>() {
      @Override
      public Optional<Integer> next(Integer value) {
        return value == Integer.MAX_VALUE ? Optional.empty() : Optional.of(value + 1);
      }

      @Override
      public Optional<Integer> previous(Integer value) {
        return value == Integer.MIN_VALUE ? Optional.empty() : Optional.of(value - 1);
      }
    };
  }

  static DiscreteDomain<Long> longs() {
    return new DiscreteDomain<Long>() {
      @Override
      public Optional<Long> next(Long value) {
        return value == Long.MAX_VALUE ? Optional.empty() : Optional.of(value + 1);
      }

      @Override
      public Optional<Long> previous(Long value) {
        return value == Long.MIN_VALUE ? Optional.empty() : Optional.of(value - 1);
      }
    };
  }

  static DiscreteDomain<Character> characters() {
    return new DiscreteDomain<Character>() {
      @Override
      public Optional<Character> next(Character value) {
        return value == Character.MAX_VALUE ? Optional.empty() : Optional.of((char) (value + 1));
      }

      @Override
      public Optional<Character> previous(Character value) {
        return value == Character.MIN_VALUE ? Optional.empty() : Optional.of((char) (value - 1));
      }
    };
  }
}
