package io.sketchbridge.api;

import io.sketchbridge.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SketchBridge CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sketchbridge <status|monitor|transfer> [options]";
  private static final String HELP_TEXT = """
      SketchBridge command dispatcher

      Usage:
        sketchbridge <command> [options]

      Commands:
        status      Connect to each CAD backend once and print its status (status --help for details)
        monitor     Run the connection probe loop and log changes (monitor --help for details)
        transfer    Copy every sketch from one backend into another (transfer --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstNonFlag(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT + "\n" + ExitCode.helpBlock());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);

    return switch (command) {
      case StatusCli.COMMAND -> StatusCli.run(delegateArgs);
      case MonitorCli.COMMAND -> MonitorCli.run(delegateArgs);
      case TransferCli.COMMAND -> TransferCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstNonFlag(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.equalsIgnoreCase("help") && !arg.contains("=")) {
        return i;
      }
    }
    return -1;
  }
}
