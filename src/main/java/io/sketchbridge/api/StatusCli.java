package io.sketchbridge.api;

import io.sketchbridge.application.connection.ConnectionManager;
import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.config.BridgeConfig;
import io.sketchbridge.config.CompositionRoot;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.infrastructure.client.CadClients;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects once to each requested backend and prints its connectivity and status.
 *
 * @since 0.1.0
 */
public final class StatusCli {
  private static final Logger log = LoggerFactory.getLogger(StatusCli.class);
  static final String COMMAND = "status";
  private static final String SUMMARY_USAGE =
      "usage: status [backends=all|NAME[,NAME...]] [config=PATH] [connect.timeoutMillis=MS] [--require-all]";
  private static final String HELP_TEXT = """
      SketchBridge backend status

      Usage:
        status [options]

      Options:
        backends=all|NAME,...       Backends to check: freecad, inventor, solidworks, fusion (default all)
        config=PATH                 YAML file with common/status sections
        connect.timeoutMillis=MS    Connect timeout per backend (default 5000)
        backends.NAME.host=HOST     Override a backend's RPC host
        backends.NAME.port=PORT     Override a backend's RPC port
        metricsExporter=otlp|none   Configure metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --require-all               Exit with status 1 unless every checked backend is reachable
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private StatusCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, config -> CadClients.discover(config.endpoints()));
  }

  static ExitCode run(String[] args, Function<BridgeConfig, Map<Backend, CadClientPort>> clients) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    CommandSupport.Prepared prepared;
    List<Backend> backends;
    try {
      prepared = CommandSupport.prepare(COMMAND, input, SUMMARY_USAGE);
      backends = ConfigCliUtils.parseBackends(prepared.effective().get("backends"));
    } catch (CommandSupport.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid backends selection: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    BridgeConfig config = prepared.config();
    MetricsPort metrics = CompositionRoot.metricsFor(prepared.exporter());
    CompositionRoot root = new CompositionRoot(config, metrics, () -> clients.apply(config));
    ConnectionManager manager = null;
    try {
      manager = root.connectionManager();
      int reachable = 0;
      for (Backend backend : backends) {
        boolean connected = manager.connect(backend, config.connectTimeout());
        if (connected) {
          reachable++;
        }
        CliPrinter.printBackend(backend, connected, manager.status(backend));
      }
      for (Backend backend : backends) {
        if (manager.isConnected(backend)) {
          manager.disconnect(backend);
        }
      }
      log.info("{} of {} backends reachable", reachable, backends.size());
      if (input.hasFlag("--require-all") && reachable < backends.size()) {
        return ExitCode.UNREACHABLE;
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in status command", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (manager != null) {
        manager.stop();
      }
      CommandSupport.closeMetrics(metrics);
    }
  }
}
