package io.poseflow.domain.quality;

/**
 * Classification of a single raw frame.
 *
 * @since POSEFLOW 0.1
 */
public enum QualityVerdict {
  /** Frame passed every rule and is shown as-is. */
  ACCEPTED,
  /** Overall observation confidence fell below the minimum. */
  REJECTED_LOW_CONFIDENCE,
  /** Too many low-confidence keypoints lie outside the visible frame. */
  REJECTED_OFF_SCREEN,
  /** Keypoint centroid departs from the local motion trend. */
  REJECTED_OUTLIER,
  /** No observation exists for the frame. */
  ABSENT;

  /**
   * Reports whether the verdict keeps the raw frame.
   *
   * @return {@code true} only for {@link #ACCEPTED}
   */
  public boolean isAccepted() {
    return this == ACCEPTED;
  }
}
