package io.poseflow.domain.frame;

import java.util.Objects;

/**
 * Maximal run of non-accepted indices and how it was resolved.
 *
 * @param startIndex first index of the run
 * @param endIndex last index of the run (inclusive)
 * @param leftBound accepted index before the run, or {@code -1} when the run starts the sequence
 * @param rightBound accepted index after the run, or {@code -1} when the run ends the sequence
 * @param resolution {@link LogicalFrameEntry.Kind#INTERPOLATED} or {@link LogicalFrameEntry.Kind#UNAVAILABLE}
 * @since POSEFLOW 0.1
 */
public record FrameGap(
    int startIndex, int endIndex, int leftBound, int rightBound, LogicalFrameEntry.Kind resolution) {

  public FrameGap {
    if (startIndex < 0 || endIndex < startIndex) {
      throw new IllegalArgumentException("invalid gap range " + startIndex + ".." + endIndex);
    }
    Objects.requireNonNull(resolution, "resolution");
    if (resolution == LogicalFrameEntry.Kind.DIRECT) {
      throw new IllegalArgumentException("a gap cannot resolve to DIRECT");
    }
  }

  /**
   * Number of frames in the run.
   *
   * @return {@code endIndex - startIndex + 1}
   */
  public int length() {
    return endIndex - startIndex + 1;
  }

  public boolean atStart() {
    return leftBound < 0;
  }

  public boolean atEnd() {
    return rightBound < 0;
  }

  public boolean interpolated() {
    return resolution == LogicalFrameEntry.Kind.INTERPOLATED;
  }
}
