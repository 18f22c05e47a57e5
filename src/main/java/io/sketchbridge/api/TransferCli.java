package io.sketchbridge.api;

import io.sketchbridge.application.connection.ConnectionManager;
import io.sketchbridge.application.port.CadClientPort;
import io.sketchbridge.application.port.MetricsPort;
import io.sketchbridge.application.port.SketchSelector;
import io.sketchbridge.application.transfer.CollectResult;
import io.sketchbridge.application.transfer.CollectedSketch;
import io.sketchbridge.application.transfer.TransferUseCase;
import io.sketchbridge.application.transform.PivotPolicy;
import io.sketchbridge.application.transform.TransformRequest;
import io.sketchbridge.config.BridgeConfig;
import io.sketchbridge.config.CompositionRoot;
import io.sketchbridge.domain.cad.Backend;
import io.sketchbridge.infrastructure.client.CadClients;
import io.sketchbridge.validation.Numbers;
import io.sketchbridge.validation.Strings;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects every sketch from one backend and imports each into another, optionally moved on the way.
 *
 * @since 0.1.0
 */
public final class TransferCli {
  private static final Logger log = LoggerFactory.getLogger(TransferCli.class);
  static final String COMMAND = "transfer";
  private static final String SUMMARY_USAGE =
      "usage: transfer from=NAME to=NAME [dx=MM] [dy=MM] [angle=DEG] [pivot=centroid|origin] [strip=true|false] "
          + "[plane=ID]";
  private static final String HELP_TEXT = """
      SketchBridge sketch transfer

      Usage:
        transfer from=NAME to=NAME [options]

      Options:
        from=NAME                   Backend to collect every sketch from
        to=NAME                     Backend to import the sketches into
        dx=MM, dy=MM                Translation applied after rotation (default 0)
        angle=DEG                   Rotation, counter-clockwise positive (default 0)
        pivot=centroid|origin       Rotation center (default centroid)
        strip=true|false            Drop constraints from the moved copies (default false)
        plane=ID                    Target plane; blank lets the backend choose (default XY)
        config=PATH                 YAML file with common/transfer sections
        connect.timeoutMillis=MS    Connect timeout per backend (default 5000)
        metricsExporter=otlp|none   Configure metrics exporter (default otlp)
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private TransferCli() {}

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
    Plan plan;
    try {
      prepared = CommandSupport.prepare(COMMAND, input, SUMMARY_USAGE);
      plan = Plan.from(prepared.effective());
    } catch (CommandSupport.CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid transfer: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    BridgeConfig config = prepared.config();
    MetricsPort metrics = CompositionRoot.metricsFor(prepared.exporter());
    CompositionRoot root = new CompositionRoot(config, metrics, () -> clients.apply(config));
    ConnectionManager manager = null;
    try {
      manager = root.connectionManager();
      boolean sourceUp = manager.connect(plan.from(), config.connectTimeout());
      boolean targetUp = manager.connect(plan.to(), config.connectTimeout());
      if (!sourceUp || !targetUp) {
        CliPrinter.printBackend(plan.from(), sourceUp, manager.status(plan.from()));
        CliPrinter.printBackend(plan.to(), targetUp, manager.status(plan.to()));
        log.error("Transfer needs both {} and {} connected", plan.from().displayName(), plan.to().displayName());
        return ExitCode.UNREACHABLE;
      }
      return transfer(root.transferUseCase(manager), plan);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in transfer command", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (manager != null) {
        for (Backend backend : List.of(plan.from(), plan.to())) {
          if (manager.isConnected(backend)) {
            manager.disconnect(backend);
          }
        }
        manager.stop();
      }
      CommandSupport.closeMetrics(metrics);
    }
  }

  private static ExitCode transfer(TransferUseCase transfers, Plan plan) {
    CollectResult collected = transfers.collect(plan.from(), SketchSelector.ALL);
    switch (collected.outcome()) {
      case NO_SKETCHES:
        CliPrinter.println("No sketches in " + plan.from().displayName());
        return ExitCode.SUCCESS;
      case COLLECTED:
        break;
      default:
        CliPrinter.println("No sketch could be exported from " + plan.from().displayName());
        return ExitCode.RUNTIME_FAILURE;
    }

    int failed = 0;
    for (CollectedSketch sketch : collected.sketches()) {
      Optional<String> created =
          transfers.deliver(plan.to(), sketch.document(), null, plan.planeId(), plan.request());
      if (created.isPresent()) {
        CliPrinter.println(sketch.key() + " -> " + created.get());
      } else {
        failed++;
        CliPrinter.println(sketch.key() + " -> FAILED");
      }
    }
    CliPrinter.println(String.format(Locale.ROOT, "%d of %d sketch(es) transferred from %s to %s",
        collected.count() - failed, collected.count(), plan.from().displayName(), plan.to().displayName()));
    return failed == 0 ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
  }

  /** Source, target and movement resolved from the effective configuration. */
  record Plan(Backend from, Backend to, String planeId, TransformRequest request) {

    static Plan from(Map<String, String> effective) {
      Backend from = backend(effective, "from");
      Backend to = backend(effective, "to");
      if (from == to) {
        throw new IllegalArgumentException("from and to must name different backends");
      }
      TransformRequest request = new TransformRequest(
          Numbers.parseFinite("dx", effective.getOrDefault("dx", "0")),
          Numbers.parseFinite("dy", effective.getOrDefault("dy", "0")),
          Numbers.parseFinite("angle", effective.getOrDefault("angle", "0")),
          pivot(effective.getOrDefault("pivot", "centroid")),
          flag("strip", effective.getOrDefault("strip", "false")));
      return new Plan(from, to, Strings.blankToNull(effective.get("plane")), request);
    }

    private static Backend backend(Map<String, String> effective, String key) {
      String raw = Strings.blankToNull(effective.get(key));
      if (raw == null) {
        throw new IllegalArgumentException(key + " is required");
      }
      return Backend.fromName(raw);
    }

    private static PivotPolicy pivot(String raw) {
      switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "centroid":
          return PivotPolicy.CENTROID;
        case "origin":
          return PivotPolicy.ORIGIN;
        default:
          throw new IllegalArgumentException("pivot must be centroid or origin (was " + raw + ")");
      }
    }

    private static boolean flag(String name, String raw) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("true") && !normalized.equals("false")) {
        throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
      }
      return Boolean.parseBoolean(normalized);
    }
  }
}
