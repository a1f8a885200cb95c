package io.poseflow.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.poseflow.application.port.MetricsPort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards counters and observations to OpenTelemetry.
 * <p><strong>Role:</strong> Observability adapter selected by {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created once per key and cached; safe for concurrent
 * use.</p>
 * <p><strong>Observability:</strong> Each instrument carries the original dotted key in the
 * {@code poseflow.metric.key} attribute, since instrument names are normalized.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("poseflow.metric.key");
  private static final String FALLBACK_METRIC_NAME = "poseflow.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    Counter counter = counters.computeIfAbsent(key, this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    Histogram histogram = histograms.computeIfAbsent(key, this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /**
   * Pushes pending metrics to the exporter.
   */
  public void flush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes and shuts down the meter provider.
   */
  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("POSEFLOW counter " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("POSEFLOW observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  /**
   * Normalizes a dotted key into a valid instrument name: lower case, letters first, and only
   * {@code [a-z0-9._-]}.
   *
   * @param key metric key
   * @return instrument name
   */
  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Normalized metric name '{}' -> '{}'", key, result);
    }
    return result;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
