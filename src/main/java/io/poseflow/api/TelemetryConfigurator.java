package io.poseflow.api;

import io.poseflow.application.port.MetricsPort;
import io.poseflow.infrastructure.metrics.NoOpMetricsAdapter;
import io.poseflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.poseflow.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry arguments ({@code metricsExporter}, {@code otelEndpoint},
 * {@code otelResourceAttributes}) and builds the matching {@link MetricsPort}.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes telemetry keys from {@code args}, publishes them as OpenTelemetry system properties, and
   * creates the metrics adapter.
   *
   * @param args mutable effective arguments
   * @return no-op adapter for {@code metricsExporter=none}, otherwise an OpenTelemetry adapter
   * @throws IllegalArgumentException if a telemetry value is malformed
   */
  static MetricsPort configureMetrics(Map<String, String> args) {
    String exporter = Strings.trimToNull(args.remove("metricsExporter"));
    String normalized = exporter == null ? "otlp" : exporter.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    String endpoint = Strings.trimToNull(args.remove("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }
    String resourceAttributes = Strings.trimToNull(args.remove("otelResourceAttributes"));
    if (resourceAttributes != null) {
      System.setProperty("otel.resource.attributes", Strings.requirePrintableAscii(
          "otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH));
    }

    if (normalized.equals("none")) {
      log.debug("Metrics export disabled");
      return new NoOpMetricsAdapter();
    }
    System.setProperty("otel.metrics.exporter", normalized);
    return new OpenTelemetryMetricsAdapter();
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
