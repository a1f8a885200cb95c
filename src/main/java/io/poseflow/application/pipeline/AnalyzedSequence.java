package io.poseflow.application.pipeline;

import io.poseflow.application.cache.FrameCache;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.quality.QualityReport;
import java.util.Objects;

/**
 * Output of {@link FrameSequenceUseCase}: verdicts, the logical mapping, and a ready frame cache.
 *
 * @param report per-frame quality verdicts
 * @param mapping logical frame mapping
 * @param cache initialized playback cache
 * @param statistics summary counts
 * @since POSEFLOW 0.1
 */
public record AnalyzedSequence(
    QualityReport report, FrameIndexMap mapping, FrameCache cache, SequenceStatistics statistics) {

  public AnalyzedSequence {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(mapping, "mapping");
    Objects.requireNonNull(cache, "cache");
    Objects.requireNonNull(statistics, "statistics");
  }
}
