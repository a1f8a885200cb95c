package io.poseflow.application.quality;

import java.util.List;
import java.util.Optional;

/**
 * Least-squares line through 2D positions sampled at integer frame offsets.
 *
 * <p>Offsets are relative to the frame under test, so the expected position of that frame is the
 * intercept.</p>
 *
 * @param slopeX change in x per frame
 * @param slopeY change in y per frame
 * @param interceptX fitted x at offset 0
 * @param interceptY fitted y at offset 0
 * @since POSEFLOW 0.1
 */
public record MotionTrend(double slopeX, double slopeY, double interceptX, double interceptY) {
  private static final double DEGENERATE = 1e-10;

  /**
   * One sampled position.
   *
   * @param offset frame offset relative to the frame under test; never 0
   * @param x sampled x
   * @param y sampled y
   */
  public record Sample(int offset, double x, double y) {}

  /**
   * Fits a line through the samples.
   *
   * @param samples at least two samples at distinct offsets
   * @return fitted trend, or empty when fewer than two samples or all offsets coincide
   */
  public static Optional<MotionTrend> fit(List<Sample> samples) {
    int n = samples.size();
    if (n < 2) {
      return Optional.empty();
    }
    double sumT = 0d;
    double sumT2 = 0d;
    double sumX = 0d;
    double sumY = 0d;
    double sumTx = 0d;
    double sumTy = 0d;
    for (Sample sample : samples) {
      double t = sample.offset();
      sumT += t;
      sumT2 += t * t;
      sumX += sample.x();
      sumY += sample.y();
      sumTx += t * sample.x();
      sumTy += t * sample.y();
    }
    double denominator = n * sumT2 - sumT * sumT;
    if (Math.abs(denominator) < DEGENERATE) {
      return Optional.empty();
    }
    double slopeX = (n * sumTx - sumT * sumX) / denominator;
    double slopeY = (n * sumTy - sumT * sumY) / denominator;
    double interceptX = (sumX - slopeX * sumT) / n;
    double interceptY = (sumY - slopeY * sumT) / n;
    return Optional.of(new MotionTrend(slopeX, slopeY, interceptX, interceptY));
  }

  /**
   * Per-frame motion magnitude.
   *
   * @return Euclidean length of the slope vector
   */
  public double speed() {
    return Math.hypot(slopeX, slopeY);
  }

  /**
   * Distance between a position and the trend's expectation at offset 0.
   *
   * @param x observed x
   * @param y observed y
   * @return Euclidean distance in pixels
   */
  public double distanceFromExpected(double x, double y) {
    return Math.hypot(x - interceptX, y - interceptY);
  }
}
