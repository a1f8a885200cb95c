package io.poseflow.application.pipeline;

import io.poseflow.application.dispatch.DispatchErrorKind;
import io.poseflow.application.dispatch.DispatchException;
import io.poseflow.domain.pose.RawSequence;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw sequence produced by pose extraction together with the per-frame failures.
 *
 * @param sequence one slot per submitted frame; failed frames are absent
 * @param failures dispatch error per failed frame number, in frame order
 * @param fallbackDispatched frames that were re-run on the sequential fallback
 * @since POSEFLOW 0.1
 */
public record ExtractionResult(RawSequence sequence, Map<Integer, DispatchException> failures, int fallbackDispatched) {

  public ExtractionResult {
    Objects.requireNonNull(sequence, "sequence");
    failures = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(failures, "failures")));
  }

  public int succeeded() {
    return sequence.presentCount();
  }

  /**
   * Failure counts by kind.
   *
   * @return counts keyed by {@link DispatchErrorKind}
   */
  public Map<DispatchErrorKind, Integer> failureCounts() {
    EnumMap<DispatchErrorKind, Integer> counts = new EnumMap<>(DispatchErrorKind.class);
    for (DispatchException failure : failures.values()) {
      counts.merge(failure.kind(), 1, Integer::sum);
    }
    return counts;
  }
}
