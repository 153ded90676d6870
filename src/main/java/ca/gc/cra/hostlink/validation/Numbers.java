package ca.gc.cra.hostlink.validation;

import java.time.Duration;

/**
 * Numeric range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures a value lies within an inclusive range.
   *
   * @param name field label used in the error message
   * @param value value to check
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures a duration lies within an inclusive range.
   *
   * @param name field label used in the error message
   * @param value duration to check; must not be {@code null}
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException when {@code null} or out of range
   */
  public static Duration requireRange(String name, Duration value, Duration min, Duration max) {
    if (value == null) {
      throw new IllegalArgumentException(label(name) + " must be set");
    }
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw new IllegalArgumentException(label(name) + " must be between " + min.toMillis() + " ms and "
          + max.toMillis() + " ms (was " + value.toMillis() + " ms)");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
