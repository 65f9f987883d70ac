package ca.gc.cra.beacon.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by BEACON CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects nonsensical batch sizes, poll intervals, and retention windows before the
 * feed pipeline schedules any timers.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since BEACON 0.1
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., ids, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long and validates its range in one step.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed and validated value
   * @throws IllegalArgumentException if {@code raw} is not numeric or out of range
   */
  public static long parseRange(String name, String raw, long min, long max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + trimmed + ")", ex);
    }
    return requireRange(name, value, min, max);
  }

  /**
   * Clamps {@code value} into {@code [min, max]}.
   *
   * @param value candidate value
   * @param min lower bound
   * @param max upper bound; must be {@code >= min}
   * @return clamped value
   */
  public static int clamp(int value, int min, int max) {
    if (min > max) {
      throw new IllegalArgumentException("min must be <= max");
    }
    return Math.max(min, Math.min(max, value));
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
