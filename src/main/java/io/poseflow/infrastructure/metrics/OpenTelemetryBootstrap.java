package io.poseflow.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for POSEFLOW.
 *
 * <p>Settings come from system properties first, then environment variables:
 * {@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER} ({@code otlp} or {@code none}),
 * {@code otel.exporter.otlp.endpoint}/{@code OTEL_EXPORTER_OTLP_ENDPOINT}, and
 * {@code otel.resource.attributes}/{@code OTEL_RESOURCE_ATTRIBUTES}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.poseflow";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    return initialize(Settings.resolve(System.getProperties(), System.getenv()));
  }

  static BootstrapResult initialize(Settings settings) {
    try {
      if (settings.exporter() == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader, settings.resourceAttributes());
      log.info("OpenTelemetry metrics exporting to {} every {} s", settings.endpoint(), EXPORT_INTERVAL.toSeconds());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(SERVICE_NAME, "poseflow", SERVICE_VERSION, version)))
        .merge(extra.isEmpty() ? Resource.empty() : Resource.create(extra));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return BootstrapResult.active(provider, meter);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        if (!trimmed.isEmpty()) {
          log.warn("Ignoring malformed OTEL_RESOURCE_ATTRIBUTES entry: {}", trimmed);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? "0.0.0-dev" : impl;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  /**
   * Resolved exporter settings.
   *
   * @param exporter exporter mode
   * @param endpoint OTLP endpoint
   * @param resourceAttributes extra resource attributes
   */
  record Settings(ExporterMode exporter, String endpoint, Attributes resourceAttributes) {

    static Settings resolve(Map<?, ?> properties, Map<String, String> environment) {
      ExporterMode exporter = ExporterMode.from(
          firstNonBlank(properties.get("otel.metrics.exporter"), environment.get("OTEL_METRICS_EXPORTER"), "otlp"));
      String endpoint = firstNonBlank(
          properties.get("otel.exporter.otlp.endpoint"),
          environment.get("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      Attributes attributes = parseResourceAttributes(firstNonBlank(
          properties.get("otel.resource.attributes"), environment.get("OTEL_RESOURCE_ATTRIBUTES"), ""));
      return new Settings(exporter, endpoint, attributes);
    }

    private static String firstNonBlank(Object first, Object second, String fallback) {
      if (first != null && !first.toString().isBlank()) {
        return first.toString().trim();
      }
      if (second != null && !second.toString().isBlank()) {
        return second.toString().trim();
      }
      return fallback;
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within 5 s");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
