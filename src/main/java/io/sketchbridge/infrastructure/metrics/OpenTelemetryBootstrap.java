package io.sketchbridge.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter used for probe and transfer metrics.
 *
 * <p>Settings come from {@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint} and
 * {@code otel.resource.attributes} (system property first, then the matching {@code OTEL_*} variable). The CLI
 * fills those properties from its own options.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.sketchbridge";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    return initialize(Settings.fromEnvironment());
  }

  static BootstrapResult initialize(Settings settings) {
    if (!settings.exportsOtlp()) {
      log.info("Metrics export disabled (exporter={})", settings.exporter());
      return BootstrapResult.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      BootstrapResult result = build(reader, parseResourceAttributes(settings.resourceAttributes()));
      log.info("Exporting bridge metrics to {}", settings.endpoint());
      return result;
    } catch (RuntimeException ex) {
      log.error("Could not start OTLP metrics export to {}; metrics are dropped", settings.endpoint(), ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extras) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(
            AttributeKey.stringKey("service.name"), "sketchbridge",
            AttributeKey.stringKey("service.version"), version)))
        .merge(Resource.create(extras));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  /**
   * Parses {@code key=value,key=value}; entries without both parts are logged and skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String[] pair = entry.split("=", 2);
      String key = pair[0].trim();
      String value = pair.length == 2 ? pair[1].trim() : "";
      if (key.isEmpty() && value.isEmpty()) {
        continue;
      }
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Skipping resource attribute '{}'", entry.trim());
        continue;
      }
      builder.put(key, value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    String version = OpenTelemetryBootstrap.class.getPackage().getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  /**
   * Exporter settings resolved from properties and environment.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param endpoint OTLP gRPC endpoint
   * @param resourceAttributes raw extra resource attributes; may be empty
   */
  record Settings(String exporter, String endpoint, String resourceAttributes) {

    static Settings fromEnvironment() {
      return new Settings(
          lookup("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp"),
          lookup("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317"),
          lookup("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
    }

    boolean exportsOtlp() {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("none")) {
        return false;
      }
      if (!normalized.equals("otlp")) {
        log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
      }
      return true;
    }

    private static String lookup(String property, String variable, String fallback) {
      String value = System.getProperty(property);
      if (value == null || value.isBlank()) {
        value = System.getenv(variable);
      }
      return value == null || value.isBlank() ? fallback : value.trim();
    }
  }

  /**
   * Meter plus the provider that owns it; the provider is {@code null} when metrics are not exported.
   */
  record BootstrapResult(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !provider.forceFlush().join(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)
          .isSuccess()) {
        log.warn("Metrics flush did not finish within {}", SHUTDOWN_WAIT);
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        if (!provider.shutdown().join(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS).isSuccess()) {
          log.warn("Meter provider did not shut down within {}", SHUTDOWN_WAIT);
        }
      } catch (RuntimeException ex) {
        log.warn("Meter provider shutdown failed", ex);
      }
    }
  }
}
