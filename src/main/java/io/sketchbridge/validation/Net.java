package io.sketchbridge.validation;

import java.util.regex.Pattern;

/**
 * Host checks for backend RPC endpoints.
 *
 * <p>Only syntax is checked; nothing here resolves names. A host is accepted when it is a DNS-style name
 * ({@code cad01}, {@code fusion.lab.local}), an IPv4 dotted quad, or an IPv6 literal written without brackets.</p>
 *
 * @since 0.1.0
 */
public final class Net {

  private static final Pattern HOST_NAME =
      Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*");
  private static final Pattern DOTTED_QUAD = Pattern.compile("\\d{1,3}(?:\\.\\d{1,3}){3}");
  private static final Pattern IPV6_LITERAL = Pattern.compile("[0-9A-Fa-f:.]+(?:%[A-Za-z0-9_.-]+)?");

  private Net() {
    // Utility
  }

  /**
   * Returns the trimmed host when it is syntactically usable as a backend address.
   *
   * @param host candidate host
   * @return trimmed host
   * @throws IllegalArgumentException if the host is blank or malformed
   */
  public static String requireHost(String host) {
    String trimmed = Strings.requireNonBlank("host", host);
    if (trimmed.indexOf(':') >= 0) {
      if (!IPV6_LITERAL.matcher(trimmed).matches() || (!trimmed.contains("::") && count(trimmed, ':') != 7)) {
        throw new IllegalArgumentException("host is not a valid IPv6 literal: " + trimmed);
      }
      return trimmed;
    }
    if (DOTTED_QUAD.matcher(trimmed).matches()) {
      for (String octet : trimmed.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return trimmed;
    }
    if (trimmed.length() > 253 || !HOST_NAME.matcher(trimmed).matches()) {
      throw new IllegalArgumentException("host is not a valid host name: " + trimmed);
    }
    return trimmed;
  }

  private static int count(String value, char c) {
    int n = 0;
    for (int i = 0; i < value.length(); i++) {
      if (value.charAt(i) == c) {
        n++;
      }
    }
    return n;
  }
}
