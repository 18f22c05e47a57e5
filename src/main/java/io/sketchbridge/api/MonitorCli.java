package io.sketchbridge.api;

import io.sketchbridge.application.connection.ConnectionManager;
import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.config.BridgeConfig;
import io.sketchbridge.config.CompositionRoot;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.infrastructure.client.CadClients;
import io.sketchbridge.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the probe loop and logs connectivity changes until a duration elapses or the JVM shuts down.
 *
 * @since 0.1.0
 */
public final class MonitorCli {
  private static final Logger log = LoggerFactory.getLogger(MonitorCli.class);
  static final String COMMAND = "monitor";
  private static final long MAX_DURATION_SECONDS = TimeUnit.DAYS.toSeconds(30);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);
  private static final String SUMMARY_USAGE =
      "usage: monitor [durationSeconds=N] [config=PATH] [probe.intervalMillis=MS] "
          + "[probe.strategy=pooled|inline] [probe.livenessPolicy=trust-cached|revalidate]";
  private static final String HELP_TEXT = """
      SketchBridge connection monitor

      Usage:
        monitor [options]

      Options:
        durationSeconds=N                 Stop after N seconds; 0 runs until interrupted (default 0)
        config=PATH                       YAML file with common/monitor sections
        probe.intervalMillis=MS           Delay between probe cycles (default 5000)
        probe.timeoutMillis=MS            Connect timeout used by probes (default 1000)
        probe.strategy=pooled|inline      Probe on a worker pool or on the control thread (default pooled)
        probe.workers=N                   Worker threads for pooled probing (default 4)
        probe.livenessPolicy=trust-cached|revalidate
                                          Re-check connected backends via the adapter (default trust-cached)
        backends.NAME.host=HOST           Override a backend's RPC host
        backends.NAME.port=PORT           Override a backend's RPC port
        metricsExporter=otlp|none         Configure metrics exporter (default otlp)
        --verbose                         Enable DEBUG logging
        --help                            Show this message
      """;

  private MonitorCli() {}

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
    Duration duration;
    try {
      prepared = CommandSupport.prepare(COMMAND, input, SUMMARY_USAGE);
      duration = Duration.ofSeconds(Numbers.parseInRange(
          "durationSeconds", prepared.effective().getOrDefault("durationSeconds", "0"), 0, MAX_DURATION_SECONDS));
    } catch (CommandSupport.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid monitor configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    BridgeConfig config = prepared.config();
    MetricsPort metrics = CompositionRoot.metricsFor(prepared.exporter());
    CompositionRoot root = new CompositionRoot(config, metrics, () -> clients.apply(config));
    CountDownLatch shutdown = new CountDownLatch(1);
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = shutdownHook(shutdown, finished, SHUTDOWN_GRACE);
    ConnectionManager manager = null;
    try {
      manager = root.connectionManager();
      Runtime.getRuntime().addShutdownHook(hook);
      manager.start(config.probeInterval());
      if (duration.isZero()) {
        shutdown.await();
      } else if (!shutdown.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
        log.info("Monitoring duration of {} s elapsed", duration.getSeconds());
      }
      printSummary(manager);
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Monitoring interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in monitor command", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (manager != null) {
        manager.stop();
      }
      removeHook(hook);
      CommandSupport.closeMetrics(metrics);
      finished.countDown();
    }
  }

  /**
   * Hook that wakes the monitor and then holds JVM exit until the summary is printed and resources are closed,
   * or until {@code grace} passes.
   */
  static Thread shutdownHook(CountDownLatch shutdown, CountDownLatch finished, Duration grace) {
    return new Thread(() -> {
      shutdown.countDown();
      try {
        if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Monitor did not finish within {} ms of shutdown", grace.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Shutdown hook interrupted while waiting for the monitor");
      }
    }, "sketchbridge-shutdown");
  }

  private static void printSummary(ConnectionManager manager) {
    for (Backend backend : ConnectionManager.backends()) {
      CliPrinter.printBackend(backend, manager.isConnected(backend), manager.status(backend));
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }
}
