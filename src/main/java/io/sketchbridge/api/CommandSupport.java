package io.sketchbridge.api;

import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.config.BridgeConfig;
import io.sketchbridge.config.ConfigMerger;
import io.sketchbridge.config.DefaultsForMode;
import io.sketchbridge.config.YamlConfigLoader;
import io.sketchbridge.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared start-up steps of the {@code status} and {@code monitor} commands: argument parsing, YAML loading,
 * merging, telemetry setup and typed configuration.
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {
    // Utility class
  }

  /**
   * Runs every start-up step for a command.
   *
   * @param command command name used to pick YAML section and defaults
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @return effective settings
   * @throws CliAbort when start-up fails; carries the exit code to return
   */
  static Prepared prepare(String command, CliInput input, String usage) throws CliAbort {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", command);
    }

    if (!input.problems().isEmpty()) {
      throw invalid("Invalid argument: " + String.join("; ", input.problems()), usage);
    }
    Map<String, String> cliKv = input.optionsCopy();

    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = loadYaml(command, configPath, usage);

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          command, yaml, cliKv, DefaultsForMode.asFlatMap(command), log::warn));
    } catch (IllegalArgumentException ex) {
      throw invalid("Invalid " + command + " configuration: " + ex.getMessage(), usage);
    }

    String exporter;
    BridgeConfig config;
    try {
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = BridgeConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      throw invalid("Invalid " + command + " configuration: " + ex.getMessage(), usage);
    }
    log.info("Configured {} command: probe={} ({} ms, liveness={}), metricsExporter={}",
        command,
        config.probeMode(),
        config.probeInterval().toMillis(),
        config.livenessPolicy(),
        exporter);
    return new Prepared(config, Map.copyOf(effective), exporter);
  }

  /**
   * Closes a metrics adapter that holds exporter resources.
   *
   * @param metrics adapter to close
   */
  static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static Optional<Map<String, String>> loadYaml(String command, String configPath, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath;
    try {
      yamlPath = Path.of(configPath);
    } catch (InvalidPathException ex) {
      throw invalid("Invalid configuration path: " + configPath, usage);
    }
    if (!Files.exists(yamlPath)) {
      throw invalid("Configuration file does not exist: " + yamlPath, usage);
    }
    try {
      return YamlConfigLoader.load(yamlPath, command);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  private static CliAbort invalid(String message, String usage) {
    log.error(message);
    CliPrinter.println(usage);
    return new CliAbort(ExitCode.INVALID_ARGS);
  }

  record Prepared(BridgeConfig config, Map<String, String> effective, String exporter) {}

  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;

    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
