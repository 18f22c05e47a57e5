package io.sketchbridge.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by SketchBridge configuration and CLI parsing.
 * <p><strong>Why:</strong> Rejects out-of-range probe intervals, timeouts, worker counts, and ports before the
 * connection manager allocates threads or opens sockets.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation fails.</p>
 *
 * @since 0.1.0
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
   * @param value candidate value expressed in the caller's units (e.g., ms, threads)
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
   * Parses a decimal integer and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a number or lies outside {@code [min, max]}
   */
  public static long parseInRange(String name, String raw, long min, long max) {
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
   * Ensures a floating-point value is neither NaN nor infinite.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if the value is not finite
   */
  public static double requireFinite(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be finite (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a finite decimal such as a millimetre offset or an angle in degrees.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a finite number
   */
  public static double parseFinite(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return requireFinite(name, Double.parseDouble(trimmed));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + trimmed + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
