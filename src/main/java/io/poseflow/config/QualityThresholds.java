package io.poseflow.config;

import io.poseflow.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Thresholds used by the quality classifier.
 * <p><strong>Role:</strong> Configuration record consumed by {@code QualityClassifier}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param minConfidence frames with lower overall confidence are rejected; {@code [0, 1]}
 * @param offScreenConfidenceThreshold keypoints outside the frame count as off-screen only below this
 *     confidence; {@code [0, 1]}
 * @param offScreenShareThreshold frame is off-screen when the off-screen share exceeds this; {@code [0, 1]}
 * @param outlierDeviationThreshold maximum centroid deviation relative to the local trend; {@code (0, 10]}
 * @param frameWidth visible frame width in pixels
 * @param frameHeight visible frame height in pixels
 * @param boundaryMargin fraction of each dimension treated as outside near the edges; {@code [0, 0.5]}
 * @param trendWindowSize number of neighbouring frames consulted for the motion trend; {@code [3, 20]}
 * @since POSEFLOW 0.1
 */
public record QualityThresholds(
    double minConfidence,
    double offScreenConfidenceThreshold,
    double offScreenShareThreshold,
    double outlierDeviationThreshold,
    int frameWidth,
    int frameHeight,
    double boundaryMargin,
    int trendWindowSize) {

  public static final double DEFAULT_MIN_CONFIDENCE = 0.6;
  public static final double DEFAULT_OFF_SCREEN_CONFIDENCE = 0.3;
  public static final double DEFAULT_OFF_SCREEN_SHARE = 0.5;
  public static final double DEFAULT_OUTLIER_DEVIATION = 0.3;
  public static final int DEFAULT_FRAME_WIDTH = 1920;
  public static final int DEFAULT_FRAME_HEIGHT = 1080;
  public static final double DEFAULT_BOUNDARY_MARGIN = 0.05;
  public static final int DEFAULT_TREND_WINDOW = 5;

  public QualityThresholds {
    Numbers.requireRange("quality.minConfidence", minConfidence, 0d, 1d);
    Numbers.requireRange("quality.offScreenConfidenceThreshold", offScreenConfidenceThreshold, 0d, 1d);
    Numbers.requireRange("quality.offScreenShareThreshold", offScreenShareThreshold, 0d, 1d);
    Numbers.requireRange("quality.outlierDeviationThreshold", outlierDeviationThreshold, 0d, 10d);
    Numbers.requireRange("quality.frameWidth", frameWidth, 1, 100_000);
    Numbers.requireRange("quality.frameHeight", frameHeight, 1, 100_000);
    Numbers.requireRange("quality.boundaryMargin", boundaryMargin, 0d, 0.5d);
    Numbers.requireRange("quality.trendWindowSize", trendWindowSize, 3, 20);
  }

  public static QualityThresholds defaults() {
    return new QualityThresholds(
        DEFAULT_MIN_CONFIDENCE,
        DEFAULT_OFF_SCREEN_CONFIDENCE,
        DEFAULT_OFF_SCREEN_SHARE,
        DEFAULT_OUTLIER_DEVIATION,
        DEFAULT_FRAME_WIDTH,
        DEFAULT_FRAME_HEIGHT,
        DEFAULT_BOUNDARY_MARGIN,
        DEFAULT_TREND_WINDOW);
  }

  /**
   * Builds thresholds from flattened {@code quality.*} keys.
   *
   * @param options flattened configuration
   * @return validated thresholds
   */
  public static QualityThresholds fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new QualityThresholds(
        ConfigValues.doubleValue(options, "quality.minConfidence", DEFAULT_MIN_CONFIDENCE, 0d, 1d),
        ConfigValues.doubleValue(
            options, "quality.offScreenConfidenceThreshold", DEFAULT_OFF_SCREEN_CONFIDENCE, 0d, 1d),
        ConfigValues.doubleValue(options, "quality.offScreenShareThreshold", DEFAULT_OFF_SCREEN_SHARE, 0d, 1d),
        ConfigValues.doubleValue(
            options, "quality.outlierDeviationThreshold", DEFAULT_OUTLIER_DEVIATION, 0d, 10d),
        ConfigValues.intValue(options, "quality.frameWidth", DEFAULT_FRAME_WIDTH, 1, 100_000),
        ConfigValues.intValue(options, "quality.frameHeight", DEFAULT_FRAME_HEIGHT, 1, 100_000),
        ConfigValues.doubleValue(options, "quality.boundaryMargin", DEFAULT_BOUNDARY_MARGIN, 0d, 0.5d),
        ConfigValues.intValue(options, "quality.trendWindowSize", DEFAULT_TREND_WINDOW, 3, 20));
  }
}
