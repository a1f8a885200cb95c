package io.poseflow.application.pipeline;

import io.poseflow.application.cache.FrameCache;
import io.poseflow.application.interpolation.FrameMaterializer;
import io.poseflow.application.interpolation.GapInterpolator;
import io.poseflow.application.port.MetricsPort;
import io.poseflow.application.quality.QualityClassifier;
import io.poseflow.config.CacheConfig;
import io.poseflow.config.InterpolationConfig;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.pose.RawSequence;
import io.poseflow.domain.quality.QualityReport;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Classifies a raw sequence, plans its logical mapping, and binds a frame cache.
 * <p><strong>Why:</strong> Downstream playback needs one gap-free index space; this use case is the single
 * place where quality verdicts turn into that mapping.</p>
 * <p><strong>Role:</strong> Application service between extraction and playback.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; each call yields a fresh cache.</p>
 * <p><strong>Observability:</strong> Emits {@code sequence.accepted}, {@code sequence.rejected},
 * {@code sequence.interpolated}, and {@code sequence.unavailable}; logs a summary at INFO.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class FrameSequenceUseCase {
  private static final Logger log = LoggerFactory.getLogger(FrameSequenceUseCase.class);

  private final QualityClassifier classifier;
  private final GapInterpolator interpolator;
  private final FrameMaterializer materializer;
  private final InterpolationConfig interpolation;
  private final CacheConfig cache;
  private final MetricsPort metrics;

  public FrameSequenceUseCase(
      QualityClassifier classifier,
      GapInterpolator interpolator,
      FrameMaterializer materializer,
      InterpolationConfig interpolation,
      CacheConfig cache,
      MetricsPort metrics) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.interpolator = Objects.requireNonNull(interpolator, "interpolator");
    this.materializer = Objects.requireNonNull(materializer, "materializer");
    this.interpolation = Objects.requireNonNull(interpolation, "interpolation");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Runs classification and interpolation, then initializes a new cache over the result.
   *
   * @param sequence raw observations in frame order
   * @return analyzed sequence with an initialized cache
   */
  public AnalyzedSequence prepare(RawSequence sequence) {
    Objects.requireNonNull(sequence, "sequence");
    MDC.put("pipeline", "sequence");
    try {
      QualityReport report = classifier.classify(sequence);
      FrameIndexMap mapping = interpolator.interpolate(sequence, report, interpolation.maxGap());
      FrameCache frameCache = new FrameCache(cache.capacity(), materializer, metrics);
      frameCache.initialize(sequence, mapping);

      SequenceStatistics statistics = SequenceStatistics.of(report, mapping);
      metrics.observe("sequence.accepted", statistics.accepted());
      metrics.observe("sequence.rejected", report.rejectedCount());
      metrics.observe("sequence.interpolated", statistics.interpolated());
      metrics.observe("sequence.unavailable", statistics.unavailable());
      log.info("Sequence prepared: frames={} accepted={} interpolated={} unavailable={} gaps={}",
          statistics.totalFrames(), statistics.accepted(), statistics.interpolated(),
          statistics.unavailable(), statistics.gaps());
      if (statistics.unavailable() > 0) {
        log.warn("{} frames have no usable pose (longest gap {} frames, maxGap={})",
            statistics.unavailable(), statistics.longestGap(), interpolation.maxGap());
      }
      return new AnalyzedSequence(report, mapping, frameCache, statistics);
    } finally {
      MDC.remove("pipeline");
    }
  }
}
