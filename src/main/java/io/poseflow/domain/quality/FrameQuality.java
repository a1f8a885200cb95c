package io.poseflow.domain.quality;

import java.util.Objects;

/**
 * Verdict plus the measurements that produced it, for one frame index.
 *
 * @param index zero-based frame index
 * @param verdict classification outcome
 * @param confidence observation confidence; {@code 0} when absent
 * @param offScreenShare share of keypoints counted as off-screen, in {@code [0, 1]}
 * @param trendDeviation outlier deviation ratio; {@code NaN} when not evaluated
 * @since POSEFLOW 0.1
 */
public record FrameQuality(
    int index, QualityVerdict verdict, double confidence, double offScreenShare, double trendDeviation) {

  public FrameQuality {
    Objects.requireNonNull(verdict, "verdict");
  }

  /**
   * Diagnostics for an absent slot.
   *
   * @param index frame index
   * @return {@link QualityVerdict#ABSENT} diagnostics
   */
  public static FrameQuality absent(int index) {
    return new FrameQuality(index, QualityVerdict.ABSENT, 0d, 0d, Double.NaN);
  }
}
