package io.poseflow.application.quality;

import io.poseflow.config.QualityThresholds;
import io.poseflow.domain.pose.Keypoint;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.domain.pose.RawSequence;
import io.poseflow.domain.quality.FrameQuality;
import io.poseflow.domain.quality.QualityReport;
import io.poseflow.domain.quality.QualityVerdict;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assigns a {@link QualityVerdict} to every frame of a raw sequence.
 * <p><strong>Why:</strong> Playback should never show a pose the estimator was unsure about, a rider who
 * left the frame, or a one-frame jump that breaks the motion.</p>
 * <p><strong>Role:</strong> Pure application service; output feeds {@code GapInterpolator}.</p>
 * <p><strong>Responsibilities:</strong> rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>{@code REJECTED_LOW_CONFIDENCE} when the observation confidence is below {@code minConfidence}.</li>
 *   <li>{@code REJECTED_OFF_SCREEN} when the share of keypoints that are both outside the frame (or within
 *   {@code boundaryMargin} of an edge) and below {@code offScreenConfidenceThreshold} exceeds
 *   {@code offScreenShareThreshold}.</li>
 *   <li>{@code REJECTED_OUTLIER} when the keypoint centroid departs from the local motion trend by more than
 *   {@code outlierDeviationThreshold}.</li>
 *   <li>{@code ACCEPTED} otherwise. Absent slots are {@code ABSENT}.</li>
 * </ol>
 * <p><strong>Outlier method:</strong> the trend is a least-squares line through the keypoint centroids of
 * up to {@code trendWindowSize / 2} frames on each side. Left neighbours must already be accepted; right
 * neighbours must be present and pass rules 1 and 2. With fewer than two neighbours the frame cannot be an
 * outlier. The deviation ratio is the distance between the centroid and the trend's expectation, divided
 * by the per-frame speed plus the mean keypoint bounding-box diagonal of the neighbours (at least one
 * pixel).</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #classify(RawSequence)} is deterministic and may be
 * called concurrently.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class QualityClassifier {
  private static final Logger log = LoggerFactory.getLogger(QualityClassifier.class);

  private final QualityThresholds thresholds;
  private final int halfWindow;

  public QualityClassifier(QualityThresholds thresholds) {
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    this.halfWindow = Math.max(1, thresholds.trendWindowSize() / 2);
  }

  /**
   * Classifies every slot of the sequence.
   *
   * @param sequence raw per-frame observations
   * @return verdicts with diagnostics, one per index
   */
  public QualityReport classify(RawSequence sequence) {
    Objects.requireNonNull(sequence, "sequence");
    int n = sequence.length();
    List<FrameQuality> frames = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      frames.add(classifyAt(sequence, i, frames));
    }
    QualityReport report = new QualityReport(frames);
    log.debug("Classified {} frames: {}", n, report.counts());
    return report;
  }

  private FrameQuality classifyAt(RawSequence sequence, int index, List<FrameQuality> decided) {
    Optional<PoseObservation> slot = sequence.get(index);
    if (slot.isEmpty()) {
      return FrameQuality.absent(index);
    }
    PoseObservation observation = slot.get();
    double confidence = observation.confidence();
    double offScreenShare = offScreenShare(observation.keypoints());
    if (confidence < thresholds.minConfidence()) {
      return new FrameQuality(index, QualityVerdict.REJECTED_LOW_CONFIDENCE, confidence, offScreenShare, Double.NaN);
    }
    if (offScreenShare > thresholds.offScreenShareThreshold()) {
      return new FrameQuality(index, QualityVerdict.REJECTED_OFF_SCREEN, confidence, offScreenShare, Double.NaN);
    }
    double deviation = trendDeviation(sequence, index, observation, decided);
    QualityVerdict verdict = deviation > thresholds.outlierDeviationThreshold()
        ? QualityVerdict.REJECTED_OUTLIER
        : QualityVerdict.ACCEPTED;
    return new FrameQuality(index, verdict, confidence, offScreenShare, deviation);
  }

  private boolean passesBasicRules(PoseObservation observation) {
    return observation.confidence() >= thresholds.minConfidence()
        && offScreenShare(observation.keypoints()) <= thresholds.offScreenShareThreshold();
  }

  double offScreenShare(List<Keypoint> keypoints) {
    if (keypoints.isEmpty()) {
      return 1d;
    }
    double marginX = thresholds.frameWidth() * thresholds.boundaryMargin();
    double marginY = thresholds.frameHeight() * thresholds.boundaryMargin();
    int offScreen = 0;
    for (Keypoint keypoint : keypoints) {
      boolean outside = keypoint.x() < marginX
          || keypoint.x() > thresholds.frameWidth() - marginX
          || keypoint.y() < marginY
          || keypoint.y() > thresholds.frameHeight() - marginY;
      if (outside && keypoint.confidence() < thresholds.offScreenConfidenceThreshold()) {
        offScreen++;
      }
    }
    return (double) offScreen / keypoints.size();
  }

  /** Deviation ratio, or {@code 0} when the trend cannot be established. */
  private double trendDeviation(
      RawSequence sequence, int index, PoseObservation observation, List<FrameQuality> decided) {
    if (observation.keypoints().isEmpty()) {
      return 0d;
    }
    List<MotionTrend.Sample> samples = new ArrayList<>(halfWindow * 2);
    double diagonalSum = 0d;

    for (int j = Math.max(0, index - halfWindow); j < index; j++) {
      if (decided.get(j).verdict().isAccepted()) {
        PoseObservation neighbour = sequence.get(j).orElseThrow();
        if (!neighbour.keypoints().isEmpty()) {
          samples.add(centroidSample(j - index, neighbour.keypoints()));
          diagonalSum += boundingDiagonal(neighbour.keypoints());
        }
      }
    }
    int last = Math.min(sequence.length() - 1, index + halfWindow);
    for (int j = index + 1; j <= last; j++) {
      Optional<PoseObservation> candidate = sequence.get(j);
      if (candidate.isPresent()
          && !candidate.get().keypoints().isEmpty()
          && passesBasicRules(candidate.get())) {
        samples.add(centroidSample(j - index, candidate.get().keypoints()));
        diagonalSum += boundingDiagonal(candidate.get().keypoints());
      }
    }

    Optional<MotionTrend> trend = MotionTrend.fit(samples);
    if (trend.isEmpty()) {
      return 0d;
    }
    MotionTrend.Sample self = centroidSample(0, observation.keypoints());
    double referenceScale = diagonalSum / samples.size();
    double denominator = Math.max(1d, trend.get().speed() + referenceScale);
    return trend.get().distanceFromExpected(self.x(), self.y()) / denominator;
  }

  private static MotionTrend.Sample centroidSample(int offset, List<Keypoint> keypoints) {
    double sumX = 0d;
    double sumY = 0d;
    for (Keypoint keypoint : keypoints) {
      sumX += keypoint.x();
      sumY += keypoint.y();
    }
    return new MotionTrend.Sample(offset, sumX / keypoints.size(), sumY / keypoints.size());
  }

  private static double boundingDiagonal(List<Keypoint> keypoints) {
    double minX = Double.POSITIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    for (Keypoint keypoint : keypoints) {
      minX = Math.min(minX, keypoint.x());
      minY = Math.min(minY, keypoint.y());
      maxX = Math.max(maxX, keypoint.x());
      maxY = Math.max(maxY, keypoint.y());
    }
    return Math.hypot(maxX - minX, maxY - minY);
  }
}
