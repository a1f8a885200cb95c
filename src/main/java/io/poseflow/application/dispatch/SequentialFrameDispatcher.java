package io.poseflow.application.dispatch;

import io.poseflow.application.port.ClockPort;
import io.poseflow.application.port.FrameDispatcher;
import io.poseflow.application.port.MetricsPort;
import io.poseflow.application.port.PoseWorker;
import io.poseflow.application.port.WorkerInvocation;
import io.poseflow.config.DispatchConfig;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.infrastructure.exec.ExecutorFactories;
import io.poseflow.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fallback dispatcher that processes one request at a time on the caller thread.
 * <p><strong>Why:</strong> When the concurrent scheduler is unavailable (closed, or deliberately disabled
 * for a fragile worker), frames can still be analyzed with the same pacing and per-request timeout.</p>
 * <p><strong>Role:</strong> Alternative {@link FrameDispatcher}; selected by {@code PoseExtractionUseCase}
 * when the primary dispatcher refuses work because it is closed.</p>
 * <p><strong>Thread-safety:</strong> Concurrent {@link #submit(List)} calls are serialized; the returned
 * futures are already complete.</p>
 * <p><strong>Observability:</strong> Emits {@code dispatch.sequential.completed} and
 * {@code dispatch.sequential.failed.<kind>}.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class SequentialFrameDispatcher implements FrameDispatcher {
  private static final Logger log = LoggerFactory.getLogger(SequentialFrameDispatcher.class);

  private final DispatchConfig config;
  private final PoseWorker worker;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ExecutorService ioThread;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean();
  private long lastSpawnNanos;
  private boolean spawnedAny;

  /**
   * Creates a sequential dispatcher.
   *
   * @param config pacing and timeout; concurrency and queue limits are ignored
   * @param worker worker adapter
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @param clock time source; {@code null} selects {@link ClockPort#SYSTEM}
   */
  public SequentialFrameDispatcher(DispatchConfig config, PoseWorker worker, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.worker = Objects.requireNonNull(worker, "worker");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.ioThread = ExecutorFactories.newWorkerPool(1, "poseflow-sequential", (t, ex) ->
        log.error("Sequential worker thread {} threw an uncaught exception", t.getName(), ex));
  }

  /**
   * Processes the batch in order, blocking until every request has settled.
   *
   * @param batch requests in submission order
   * @return completed futures, one per request, in submission order
   */
  @Override
  public List<CompletableFuture<DispatchOutcome>> submit(List<FrameRequest> batch) {
    Objects.requireNonNull(batch, "batch");
    List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>(batch.size());
    lock.lock();
    try {
      for (FrameRequest request : batch) {
        Objects.requireNonNull(request, "request");
        DispatchOutcome outcome;
        if (closed.get() || Thread.currentThread().isInterrupted()) {
          outcome = DispatchOutcome.failure(new SchedulerClosedException(request.frameNumber()));
        } else {
          outcome = dispatchOne(request);
        }
        if (outcome.succeeded()) {
          metrics.increment("dispatch.sequential.completed");
        } else {
          metrics.increment("dispatch.sequential.failed." + outcome.error().kind().metricSuffix());
        }
        futures.add(CompletableFuture.completedFuture(outcome));
      }
    } finally {
      lock.unlock();
    }
    return List.copyOf(futures);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      ioThread.shutdownNow();
      try {
        if (!ioThread.awaitTermination(config.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
          log.warn("Sequential worker thread still active after {} ms", config.shutdownGraceMs());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private DispatchOutcome dispatchOne(FrameRequest request) {
    int frame = request.frameNumber();
    if (!awaitPacing()) {
      return DispatchOutcome.failure(new SchedulerClosedException(frame));
    }
    WorkerInvocation invocation;
    try {
      invocation = worker.spawn(request);
    } catch (IOException | RuntimeException ex) {
      markSpawned();
      log.warn("Failed to spawn worker for frame {}", frame, ex);
      return DispatchOutcome.failure(
          new WorkerFailureException(frame, "spawn failed: " + Logs.diagnostic(ex.getMessage()), ex));
    }
    markSpawned();

    Future<DispatchOutcome> running = ioThread.submit(() -> runInvocation(request, invocation));
    try {
      return running.get(config.perRequestTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      invocation.terminate();
      running.cancel(true);
      log.warn("Worker for frame {} exceeded {} ms; terminated", frame, config.perRequestTimeoutMs());
      return DispatchOutcome.failure(new WorkerTimeoutException(frame, config.perRequestTimeoutMs()));
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return DispatchOutcome.failure(
          new WorkerFailureException(frame, Logs.diagnostic(cause.getMessage()), ex));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      invocation.terminate();
      running.cancel(true);
      return DispatchOutcome.failure(new SchedulerClosedException(frame));
    }
  }

  private DispatchOutcome runInvocation(FrameRequest request, WorkerInvocation invocation) {
    Exception sendFailure = null;
    try {
      invocation.send();
    } catch (IOException | RuntimeException ex) {
      sendFailure = ex;
    }
    PoseObservation result = null;
    Exception awaitFailure = null;
    try {
      result = invocation.awaitResult();
    } catch (IOException | RuntimeException ex) {
      awaitFailure = ex;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      awaitFailure = ex;
    }
    return WorkerOutcomes.resolve(request, sendFailure, result, awaitFailure);
  }

  private boolean awaitPacing() {
    if (!spawnedAny) {
      return true;
    }
    long intervalNanos = TimeUnit.MILLISECONDS.toNanos(config.minSpawnIntervalMs());
    long remaining = lastSpawnNanos + intervalNanos - clock.nanoTime();
    while (remaining > 0) {
      try {
        TimeUnit.NANOSECONDS.sleep(remaining);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return false;
      }
      remaining = lastSpawnNanos + intervalNanos - clock.nanoTime();
    }
    return true;
  }

  private void markSpawned() {
    lastSpawnNanos = clock.nanoTime();
    spawnedAny = true;
  }
}
