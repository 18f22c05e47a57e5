package io.sketchbridge.api;

import io.sketchbridge.application.transfer.TransferUseCase;
import io.sketchbridge.domain.cad.Backend;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Command results on stdout. Diagnostics go through Logback instead, so scripts can read stdout as data.
 */
final class CliPrinter {
  private static final PrintWriter STDOUT =
      new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
  private static volatile PrintWriter redirect;

  private CliPrinter() {
    // Utility
  }

  static void println(String message) {
    PrintWriter target = redirect;
    (target != null ? target : STDOUT).println(message);
  }

  /**
   * One row of the backend table: display name, state and, when connected, the status summary.
   */
  static void printBackend(Backend backend, boolean connected, Map<String, Object> status) {
    println(backendLine(backend, connected, status));
  }

  static String backendLine(Backend backend, boolean connected, Map<String, Object> status) {
    if (!connected) {
      return String.format(Locale.ROOT, "%-12s %s", backend.displayName(), "disconnected");
    }
    return String.format(Locale.ROOT, "%-12s %-13s%s",
        backend.displayName(), "connected", TransferUseCase.describeStatus(status));
  }

  static void setWriterForTesting(PrintWriter writer) {
    redirect = writer;
  }

  static void clearTestWriter() {
    redirect = null;
  }
}
