package io.poseflow.domain.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Verdict mapping for a whole raw sequence.
 * <p><strong>Role:</strong> Output of {@code QualityClassifier}; input to {@code GapInterpolator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class QualityReport {
  private final List<FrameQuality> frames;
  private final List<QualityVerdict> verdicts;
  private final Map<QualityVerdict, Integer> counts;

  /**
   * Creates a report from per-index diagnostics.
   *
   * @param frames diagnostics ordered by index; element {@code i} must describe index {@code i}
   * @throws IllegalArgumentException if diagnostics are out of order
   */
  public QualityReport(List<FrameQuality> frames) {
    Objects.requireNonNull(frames, "frames");
    List<QualityVerdict> verdictList = new ArrayList<>(frames.size());
    EnumMap<QualityVerdict, Integer> tally = new EnumMap<>(QualityVerdict.class);
    for (QualityVerdict verdict : QualityVerdict.values()) {
      tally.put(verdict, 0);
    }
    for (int i = 0; i < frames.size(); i++) {
      FrameQuality quality = Objects.requireNonNull(frames.get(i), "frame quality");
      if (quality.index() != i) {
        throw new IllegalArgumentException("diagnostics out of order at " + i + ": " + quality.index());
      }
      verdictList.add(quality.verdict());
      tally.merge(quality.verdict(), 1, Integer::sum);
    }
    this.frames = List.copyOf(frames);
    this.verdicts = Collections.unmodifiableList(verdictList);
    this.counts = Collections.unmodifiableMap(tally);
  }

  /**
   * Builds a report from bare verdicts, with empty diagnostics.
   *
   * @param verdicts verdict per index
   * @return report
   */
  public static QualityReport ofVerdicts(List<QualityVerdict> verdicts) {
    Objects.requireNonNull(verdicts, "verdicts");
    List<FrameQuality> frames = new ArrayList<>(verdicts.size());
    for (int i = 0; i < verdicts.size(); i++) {
      frames.add(new FrameQuality(i, verdicts.get(i), 0d, 0d, Double.NaN));
    }
    return new QualityReport(frames);
  }

  public int length() {
    return verdicts.size();
  }

  public QualityVerdict verdict(int index) {
    return verdicts.get(index);
  }

  public List<QualityVerdict> verdicts() {
    return verdicts;
  }

  public List<FrameQuality> frames() {
    return frames;
  }

  /**
   * Number of frames with the given verdict.
   *
   * @param verdict verdict to count
   * @return count, zero when none
   */
  public int count(QualityVerdict verdict) {
    return counts.get(verdict);
  }

  public int acceptedCount() {
    return count(QualityVerdict.ACCEPTED);
  }

  /**
   * Frames that carry an observation but were rejected by a rule.
   *
   * @return rejected count excluding absent slots
   */
  public int rejectedCount() {
    return length() - acceptedCount() - count(QualityVerdict.ABSENT);
  }

  public Map<QualityVerdict, Integer> counts() {
    return counts;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof QualityReport other && frames.equals(other.frames));
  }

  @Override
  public int hashCode() {
    return frames.hashCode();
  }

  @Override
  public String toString() {
    return "QualityReport" + counts;
  }
}
