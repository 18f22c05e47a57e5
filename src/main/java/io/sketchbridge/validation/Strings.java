package io.sketchbridge.validation;

import java.util.Objects;

/**
 * Text guards for values read from YAML and {@code key=value} arguments: hosts, plane ids, sketch names
 * and telemetry attributes.
 *
 * @since 0.1.0
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects it when nothing is left or it carries control characters.
   *
   * @param name option name used in the error message
   * @param value raw text
   * @return trimmed text
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the text is blank or contains a control character
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, name);
    if (containsControl(value)) {
      throw new IllegalArgumentException(name + " contains a control character");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " is blank");
    }
    return trimmed;
  }

  /**
   * As {@link #requireNonBlank} and additionally limits the text to {@code maxLength} printable ASCII
   * characters, which is what OTLP resource attributes and backend plane ids accept.
   *
   * @param name option name used in the error message
   * @param value raw text
   * @param maxLength longest accepted value
   * @return trimmed text
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(name + " is longer than " + maxLength + " characters");
    }
    if (!trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
      throw new IllegalArgumentException(name + " must be printable ASCII");
    }
    return trimmed;
  }

  /**
   * Maps absent or blank option values to {@code null}.
   *
   * @param value raw option value
   * @return trimmed value, or {@code null}
   */
  public static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean containsControl(CharSequence value) {
    return value.chars().anyMatch(c -> Character.isISOControl((char) c));
  }
}
