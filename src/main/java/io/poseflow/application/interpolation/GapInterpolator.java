package io.poseflow.application.interpolation;

import io.poseflow.domain.frame.FrameGap;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.frame.InterpolationRecipe;
import io.poseflow.domain.frame.LogicalFrameEntry;
import io.poseflow.domain.pose.RawSequence;
import io.poseflow.domain.quality.QualityReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the logical frame mapping from a classified sequence.
 * <p><strong>Why:</strong> Playback must be able to address every frame index; short runs of rejected
 * or missing frames are bridged by blending their accepted neighbours, long runs are marked unavailable.</p>
 * <p><strong>Role:</strong> Pure application service between {@code QualityClassifier} and
 * {@code FrameCache}. It only plans; {@link FrameMaterializer} performs the numeric blend.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accepted index {@code i} maps to {@code DIRECT(i)}.</li>
 *   <li>A maximal non-accepted run bounded by accepted {@code L} and {@code R} with {@code R - L - 1 <= maxGap}
 *   maps each {@code i} to {@code INTERPOLATED(L, R, (i - L) / (R - L))}.</li>
 *   <li>Runs that are longer, or that touch either end of the sequence, map to {@code UNAVAILABLE}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class GapInterpolator {
  private static final Logger log = LoggerFactory.getLogger(GapInterpolator.class);

  /**
   * Plans the logical mapping.
   *
   * @param sequence raw sequence of length {@code N}
   * @param report verdicts for the same sequence
   * @param maxGap longest run that may be interpolated
   * @return mapping with {@code N} entries and the list of gaps
   * @throws IllegalArgumentException if the report length differs from the sequence or {@code maxGap} is negative
   */
  public FrameIndexMap interpolate(RawSequence sequence, QualityReport report, int maxGap) {
    Objects.requireNonNull(sequence, "sequence");
    Objects.requireNonNull(report, "report");
    if (report.length() != sequence.length()) {
      throw new IllegalArgumentException(
          "verdict count " + report.length() + " does not match sequence length " + sequence.length());
    }
    if (maxGap < 0) {
      throw new IllegalArgumentException("maxGap must be >= 0 (was " + maxGap + ")");
    }
    int n = sequence.length();
    List<LogicalFrameEntry> entries = new ArrayList<>(n);
    List<FrameGap> gaps = new ArrayList<>();
    int i = 0;
    while (i < n) {
      if (report.verdict(i).isAccepted()) {
        entries.add(LogicalFrameEntry.direct(i));
        i++;
        continue;
      }
      int start = i;
      while (i < n && !report.verdict(i).isAccepted()) {
        i++;
      }
      int end = i - 1;
      int left = start - 1;
      int right = i < n ? i : -1;
      boolean bridgeable = left >= 0 && right >= 0 && (right - left - 1) <= maxGap;
      for (int k = start; k <= end; k++) {
        entries.add(bridgeable
            ? LogicalFrameEntry.interpolated(k, InterpolationRecipe.between(left, right, k))
            : LogicalFrameEntry.unavailable(k));
      }
      gaps.add(new FrameGap(start, end, left, right,
          bridgeable ? LogicalFrameEntry.Kind.INTERPOLATED : LogicalFrameEntry.Kind.UNAVAILABLE));
    }
    FrameIndexMap map = new FrameIndexMap(entries, gaps);
    log.debug("Planned frame mapping: {}", map);
    return map;
  }
}
