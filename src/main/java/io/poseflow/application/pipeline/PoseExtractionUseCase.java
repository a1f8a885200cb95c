package io.poseflow.application.pipeline;

import io.poseflow.application.dispatch.DispatchErrorKind;
import io.poseflow.application.dispatch.DispatchException;
import io.poseflow.application.dispatch.DispatchOutcome;
import io.poseflow.application.port.FrameDispatcher;
import io.poseflow.application.port.MetricsPort;
import io.poseflow.domain.pose.FramePayload;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.RawSequence;
import io.poseflow.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Turns an ordered list of frame images into a {@link RawSequence}.
 * <p><strong>Why:</strong> Callers think in frames, not dispatch outcomes; partial results beat failing
 * the whole video, so every failed frame becomes an absent slot and its error is reported alongside.</p>
 * <p><strong>Role:</strong> Inbound use case in front of a {@link FrameDispatcher}. Frames refused because
 * the primary queue was full are resubmitted once the admitted frames have settled, for as long as each
 * round admits at least one frame. When the primary dispatcher refuses frames because it is closed, those
 * frames are re-run on the fallback dispatcher.</p>
 * <p><strong>Thread-safety:</strong> {@link #extract(List)} may be called concurrently; resubmission and
 * fallback work are serialized on a dedicated coordinator thread.</p>
 * <p><strong>Observability:</strong> Emits {@code extract.frames}, {@code extract.resubmitted},
 * {@code extract.succeeded}, {@code extract.failed}, and {@code extract.fallback}.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class PoseExtractionUseCase implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PoseExtractionUseCase.class);

  private final FrameDispatcher primary;
  private final FrameDispatcher fallback;
  private final MetricsPort metrics;
  private final ExecutorService coordinator;

  /**
   * Creates the use case.
   *
   * @param primary dispatcher used for every frame
   * @param fallback dispatcher used for frames the primary refused because it was closed; may be {@code null}
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   */
  public PoseExtractionUseCase(FrameDispatcher primary, FrameDispatcher fallback, MetricsPort metrics) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.fallback = fallback;
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.coordinator = ExecutorFactories.newWorkerPool(1, "poseflow-extract", (t, ex) ->
        log.error("Extraction coordinator {} threw an uncaught exception", t.getName(), ex));
  }

  /**
   * Dispatches one request per frame; frame {@code i} of the input becomes slot {@code i} of the sequence.
   *
   * @param frames frame images in playback order
   * @return future completing once every frame has settled
   */
  public CompletableFuture<ExtractionResult> extract(List<FramePayload> frames) {
    Objects.requireNonNull(frames, "frames");
    List<FrameRequest> requests = new ArrayList<>(frames.size());
    for (int i = 0; i < frames.size(); i++) {
      requests.add(new FrameRequest(i, frames.get(i)));
    }
    metrics.observe("extract.frames", requests.size());
    AtomicInteger fallbackCount = new AtomicInteger();
    List<CompletableFuture<DispatchOutcome>> submitted;
    MDC.put("pipeline", "extract");
    try {
      log.info("Extracting poses for {} frames via {}", requests.size(), primary.getClass().getSimpleName());
      submitted = primary.submit(requests);
    } finally {
      MDC.remove("pipeline");
    }
    return settleAll(submitted)
        .thenComposeAsync(outcomes -> resubmitRefused(requests, outcomes), coordinator)
        .thenComposeAsync(outcomes -> retryClosed(requests, outcomes, fallbackCount), coordinator)
        .thenApply(outcomes -> assemble(requests.size(), outcomes, fallbackCount.get()));
  }

  @Override
  public void close() {
    coordinator.shutdown();
    try {
      if (!coordinator.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Extraction coordinator still active after 5 s; forcing shutdown");
        coordinator.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      coordinator.shutdownNow();
    }
  }

  /** Outcomes are positional: {@code outcomes.get(i)} settles {@code requests.get(i)}. */
  private CompletableFuture<List<DispatchOutcome>> resubmitRefused(
      List<FrameRequest> requests, List<DispatchOutcome> outcomes) {
    List<FrameRequest> refused = new ArrayList<>();
    List<Integer> positions = new ArrayList<>();
    for (int i = 0; i < outcomes.size(); i++) {
      DispatchOutcome outcome = outcomes.get(i);
      if (!outcome.succeeded() && outcome.error().kind() == DispatchErrorKind.QUEUE_FULL) {
        refused.add(requests.get(i));
        positions.add(i);
      }
    }
    if (refused.isEmpty()) {
      return CompletableFuture.completedFuture(outcomes);
    }
    if (refused.size() == requests.size()) {
      log.warn("Dispatcher admitted none of {} frames; giving up on resubmission", refused.size());
      return CompletableFuture.completedFuture(outcomes);
    }
    log.debug("Resubmitting {} frames refused while the queue was full", refused.size());
    metrics.observe("extract.resubmitted", refused.size());
    return settleAll(primary.submit(refused))
        .thenComposeAsync(retried -> resubmitRefused(refused, retried), coordinator)
        .thenApply(settled -> {
          List<DispatchOutcome> merged = new ArrayList<>(outcomes);
          for (int i = 0; i < settled.size(); i++) {
            merged.set(positions.get(i), settled.get(i));
          }
          return merged;
        });
  }

  private CompletableFuture<List<DispatchOutcome>> retryClosed(
      List<FrameRequest> requests, List<DispatchOutcome> outcomes, AtomicInteger fallbackCount) {
    if (fallback == null) {
      return CompletableFuture.completedFuture(outcomes);
    }
    List<FrameRequest> retry = new ArrayList<>();
    for (int i = 0; i < outcomes.size(); i++) {
      DispatchOutcome outcome = outcomes.get(i);
      if (!outcome.succeeded() && outcome.error().kind() == DispatchErrorKind.CLOSED) {
        retry.add(requests.get(i));
      }
    }
    if (retry.isEmpty()) {
      return CompletableFuture.completedFuture(outcomes);
    }
    log.warn("Primary dispatcher closed; re-running {} frames on the sequential fallback", retry.size());
    metrics.observe("extract.fallback", retry.size());
    fallbackCount.set(retry.size());
    return settleAll(fallback.submit(retry)).thenApply(retried -> {
      List<DispatchOutcome> merged = new ArrayList<>(outcomes);
      for (DispatchOutcome outcome : retried) {
        merged.set(outcome.frameNumber(), outcome);
      }
      return merged;
    });
  }

  private ExtractionResult assemble(int length, List<DispatchOutcome> outcomes, int fallbackCount) {
    RawSequence.Builder builder = RawSequence.builder(length);
    Map<Integer, DispatchException> failures = new LinkedHashMap<>();
    for (DispatchOutcome outcome : outcomes) {
      if (outcome.succeeded()) {
        builder.set(outcome.frameNumber(), outcome.observation());
      } else {
        failures.put(outcome.frameNumber(), outcome.error());
      }
    }
    ExtractionResult result = new ExtractionResult(builder.build(), failures, fallbackCount);
    metrics.observe("extract.succeeded", result.succeeded());
    metrics.observe("extract.failed", failures.size());
    if (failures.isEmpty()) {
      log.info("Extraction finished: {} frames", length);
    } else {
      log.warn("Extraction finished: {} of {} frames failed {}", failures.size(), length, result.failureCounts());
    }
    return result;
  }

  private static CompletableFuture<List<DispatchOutcome>> settleAll(List<CompletableFuture<DispatchOutcome>> futures) {
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
        .thenApply(ignored -> {
          List<DispatchOutcome> outcomes = new ArrayList<>(futures.size());
          for (CompletableFuture<DispatchOutcome> future : futures) {
            outcomes.add(future.join());
          }
          return outcomes;
        });
  }
}
