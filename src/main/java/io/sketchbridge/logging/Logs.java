package io.sketchbridge.logging;

import java.util.Map;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Formatting helpers that keep backend-supplied values short and on one line in logs.
 * <p><strong>Why:</strong> Status maps come from remote CAD applications and may carry long document paths or
 * embedded newlines.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  /** Default per-value character budget. */
  public static final int DEFAULT_MAX_CHARS = 120;

  private Logs() {
    // Utility
  }

  /**
   * Shortens a value to {@code maxChars} characters and replaces control characters with spaces.
   *
   * @param value value to render; {@code null} renders as {@code <null>}
   * @param maxChars maximum retained characters; must be positive
   * @return printable single-line text, suffixed with {@code ...(n chars)} when shortened
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(Object value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    String text = value.toString();
    StringBuilder out = new StringBuilder(Math.min(text.length(), maxChars) + 16);
    int limit = Math.min(text.length(), maxChars);
    for (int i = 0; i < limit; i++) {
      char c = text.charAt(i);
      out.append(Character.isISOControl(c) ? ' ' : c);
    }
    if (text.length() > maxChars) {
      out.append("...(").append(text.length()).append(" chars)");
    }
    return out.toString();
  }

  /**
   * Renders a status map as {@code {key=value, ...}} with every value truncated.
   *
   * @param status status map; may be empty
   * @return single-line rendering
   */
  public static String summarize(Map<String, ?> status) {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    for (Map.Entry<String, ?> entry : status.entrySet()) {
      joiner.add(entry.getKey() + '=' + truncate(entry.getValue(), DEFAULT_MAX_CHARS));
    }
    return joiner.toString();
  }
}
