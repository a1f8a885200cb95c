package io.poseflow.application.port;

import io.poseflow.application.dispatch.DispatchOutcome;
import io.poseflow.domain.pose.FrameRequest;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Inbound port that turns a batch of frame requests into per-request outcomes.
 * <p><strong>Role:</strong> Implemented by {@code DispatchScheduler} (bounded, concurrent) and
 * {@code SequentialFrameDispatcher} (one at a time, fallback); consumed by {@code PoseExtractionUseCase}.</p>
 * <p><strong>Thread-safety:</strong> {@link #submit(List)} may be called from any thread.</p>
 *
 * @since POSEFLOW 0.1
 */
public interface FrameDispatcher extends AutoCloseable {
  /**
   * Submits a batch of requests.
   *
   * @param batch requests in submission order; must not be {@code null}
   * @return one future per request, in the same order; futures always complete normally and carry either
   *     an observation or a typed dispatch error
   */
  List<CompletableFuture<DispatchOutcome>> submit(List<FrameRequest> batch);

  /**
   * Stops accepting work and releases resources once in-flight work has settled.
   */
  @Override
  void close();
}
