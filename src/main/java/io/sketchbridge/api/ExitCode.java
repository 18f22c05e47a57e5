package io.sketchbridge.api;

import java.util.Locale;

/**
 * Process exit status of every {@code sketchbridge} command.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0, "command finished"),
  UNREACHABLE(1, "a required backend could not be reached (status --require-all)"),
  INVALID_ARGS(2, "bad arguments or missing configuration file"),
  IO_ERROR(3, "configuration file could not be read"),
  CONFIG_ERROR(4, "configuration file is not valid YAML"),
  RUNTIME_FAILURE(5, "a transfer failed or an unexpected error occurred"),
  INTERRUPTED(130, "interrupted");

  private final int code;
  private final String meaning;

  ExitCode(int code, String meaning) {
    this.code = code;
    this.meaning = meaning;
  }

  public int code() {
    return code;
  }

  /**
   * Help-text block listing every code with its meaning.
   *
   * @return lines indented for the command help
   */
  static String helpBlock() {
    StringBuilder sb = new StringBuilder("Exit codes:");
    for (ExitCode exit : values()) {
      sb.append(String.format(Locale.ROOT, "%n  %-5d %s", exit.code, exit.meaning));
    }
    return sb.toString();
  }
}
