package io.poseflow.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void exporterNoneYieldsNoop() {
    OpenTelemetryBootstrap.Settings settings =
        OpenTelemetryBootstrap.Settings.resolve(Map.of("otel.metrics.exporter", "none"), Map.of());

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(settings);

    assertTrue(result.isNoop());
    result.close();
  }

  @Test
  void propertiesWinOverEnvironment() {
    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(
        Map.of("otel.exporter.otlp.endpoint", "http://collector:4317"),
        Map.of("OTEL_EXPORTER_OTLP_ENDPOINT", "http://other:4317", "OTEL_RESOURCE_ATTRIBUTES", "host=gpu1"));

    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("gpu1", settings.resourceAttributes().get(AttributeKey.stringKey("host")));
  }

  @Test
  void malformedResourceAttributesAreSkipped() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=vision, broken, =x, region = eu ");

    assertEquals(2, attributes.size());
    assertEquals("eu", attributes.get(AttributeKey.stringKey("region")));
  }
}
