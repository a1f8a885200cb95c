package io.poseflow.config;

import io.poseflow.application.dispatch.DispatchScheduler;
import io.poseflow.application.dispatch.SequentialFrameDispatcher;
import io.poseflow.application.interpolation.FrameMaterializer;
import io.poseflow.application.interpolation.GapInterpolator;
import io.poseflow.application.pipeline.FrameSequenceUseCase;
import io.poseflow.application.pipeline.PoseExtractionUseCase;
import io.poseflow.application.port.ClockPort;
import io.poseflow.application.port.FrameDispatcher;
import io.poseflow.application.port.MetricsPort;
import io.poseflow.application.port.PoseWorker;
import io.poseflow.application.quality.QualityClassifier;
import io.poseflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.poseflow.infrastructure.time.SystemClockAdapter;
import io.poseflow.infrastructure.worker.HttpPoseWorker;
import io.poseflow.infrastructure.worker.ProcessPoseWorker;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires POSEFLOW use cases to concrete adapters from one {@link PipelineConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection (process vs HTTP worker, OpenTelemetry vs no-op
 * metrics) in one place so use cases only see ports.</p>
 * <p><strong>Role:</strong> Composition root used by the CLI and by integration tests.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods build new instances and
 * are meant to run during startup.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class CompositionRoot {
  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public CompositionRoot(PipelineConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  public CompositionRoot(PipelineConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit metrics and clock.
   *
   * @param config pipeline configuration
   * @param metrics metrics sink shared by every component
   * @param clock time source shared by the dispatchers
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public PipelineConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the worker adapter selected by {@code worker.mode}.
   *
   * @return process or HTTP worker
   */
  public PoseWorker poseWorker() {
    return switch (config.worker().mode()) {
      case PROCESS -> new ProcessPoseWorker(config.worker());
      case HTTP -> new HttpPoseWorker(config.worker());
    };
  }

  /**
   * Starts a concurrent scheduler over {@code worker}. The caller owns and must close it.
   *
   * @param worker worker adapter
   * @return running scheduler
   */
  public DispatchScheduler dispatchScheduler(PoseWorker worker) {
    return DispatchScheduler.start(config.dispatch(), worker, metrics, clock);
  }

  /**
   * Builds the sequential fallback dispatcher over {@code worker}. The caller owns and must close it.
   *
   * @param worker worker adapter
   * @return sequential dispatcher
   */
  public SequentialFrameDispatcher sequentialDispatcher(PoseWorker worker) {
    return new SequentialFrameDispatcher(config.dispatch(), worker, metrics, clock);
  }

  /**
   * Builds the extraction use case.
   *
   * @param primary dispatcher used first
   * @param fallback dispatcher used when {@code primary} is closed; may be {@code null}
   * @return extraction use case
   */
  public PoseExtractionUseCase poseExtractionUseCase(FrameDispatcher primary, FrameDispatcher fallback) {
    return new PoseExtractionUseCase(primary, fallback, metrics);
  }

  /**
   * Builds the classification, interpolation, and caching use case.
   *
   * @return frame sequence use case
   */
  public FrameSequenceUseCase frameSequenceUseCase() {
    return new FrameSequenceUseCase(
        new QualityClassifier(config.quality()),
        new GapInterpolator(),
        new FrameMaterializer(),
        config.interpolation(),
        config.cache(),
        metrics);
  }
}
