package io.poseflow.application.pipeline;

import io.poseflow.domain.frame.FrameGap;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.quality.QualityReport;
import io.poseflow.domain.quality.QualityVerdict;
import java.util.Objects;

/**
 * Summary counts for one analyzed sequence.
 *
 * @param totalFrames logical frames in the sequence
 * @param accepted frames that passed every quality rule
 * @param rejectedLowConfidence frames rejected for low confidence
 * @param rejectedOffScreen frames rejected for off-screen keypoints
 * @param rejectedOutlier frames rejected as motion outliers
 * @param absent frames with no observation
 * @param direct logical frames served from their own observation
 * @param interpolated logical frames synthesized from neighbours
 * @param unavailable logical frames with no usable pose
 * @param gaps runs of non-accepted frames
 * @param longestGap length of the longest run, or {@code 0}
 * @since POSEFLOW 0.1
 */
public record SequenceStatistics(
    int totalFrames,
    int accepted,
    int rejectedLowConfidence,
    int rejectedOffScreen,
    int rejectedOutlier,
    int absent,
    int direct,
    int interpolated,
    int unavailable,
    int gaps,
    int longestGap) {

  /**
   * Derives statistics from a quality report and the mapping planned from it.
   *
   * @param report per-frame verdicts
   * @param mapping logical mapping
   * @return statistics
   */
  public static SequenceStatistics of(QualityReport report, FrameIndexMap mapping) {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(mapping, "mapping");
    int longest = 0;
    for (FrameGap gap : mapping.gaps()) {
      longest = Math.max(longest, gap.length());
    }
    return new SequenceStatistics(
        report.length(),
        report.acceptedCount(),
        report.count(QualityVerdict.REJECTED_LOW_CONFIDENCE),
        report.count(QualityVerdict.REJECTED_OFF_SCREEN),
        report.count(QualityVerdict.REJECTED_OUTLIER),
        report.count(QualityVerdict.ABSENT),
        mapping.directCount(),
        mapping.interpolatedCount(),
        mapping.unavailableCount(),
        mapping.gaps().size(),
        longest);
  }

  /**
   * Share of logical frames that can be played back.
   *
   * @return {@code (direct + interpolated) / totalFrames}, or {@code 0} for an empty sequence
   */
  public double coverage() {
    return totalFrames == 0 ? 0d : (double) (direct + interpolated) / totalFrames;
  }
}
