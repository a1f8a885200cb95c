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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Bounded, paced dispatcher that runs frame requests on external pose workers.
 * <p><strong>Why:</strong> A single upload can produce hundreds of frame requests; each worker is a slow,
 * memory-hungry external invocation. The scheduler caps concurrency, bounds the wait queue, spaces spawns,
 * and enforces a per-request deadline so the host stays healthy.</p>
 * <p><strong>Role:</strong> Application service implementing {@link FrameDispatcher}; driven by
 * {@code PoseExtractionUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Admit each batch atomically and in order; refuse requests once {@code queueMaxSize} are waiting.</li>
 *   <li>Keep at most {@code maxConcurrentWorkers} invocations active.</li>
 *   <li>Space consecutive spawns by at least {@code minSpawnIntervalMs}.</li>
 *   <li>Kill workers that miss {@code perRequestTimeoutMs} and settle them as timed out.</li>
 *   <li>Settle every request exactly once without affecting its siblings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All scheduling state is confined to a single owner thread that
 * consumes an event channel ({@code Submit}, {@code WorkerFinished}, {@code Shutdown}). Worker threads
 * only perform I/O and post their result back. {@link #submit(List)}, {@link #status()}, and
 * {@link #close()} may be called from any thread.</p>
 * <p><strong>Performance:</strong> Pacing and deadlines are served by the event poll timeout; no timer
 * threads and no busy waiting. Futures complete on the owner thread, so dependent stages must not block.</p>
 * <p><strong>Observability:</strong> Emits {@code dispatch.admitted}, {@code dispatch.rejected.queueFull},
 * {@code dispatch.spawned}, {@code dispatch.completed}, {@code dispatch.failed.<kind>},
 * {@code dispatch.queue.depth}, {@code dispatch.queue.waitMillis}, and {@code dispatch.latencyMillis}.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class DispatchScheduler implements FrameDispatcher {
  private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

  private final DispatchConfig config;
  private final PoseWorker worker;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final long minSpawnIntervalNanos;
  private final long timeoutNanos;
  private final long startedAtMillis;

  private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
  private final Object lifecycleLock = new Object();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final ExecutorService workerPool;
  private final Thread owner;
  private volatile SchedulerStatus status = SchedulerStatus.initial();
  private boolean closed; // guarded by lifecycleLock

  // Owner-thread state.
  private final ArrayDeque<Pending> waiting = new ArrayDeque<>();
  private final Map<Long, InFlight> inFlight = new HashMap<>();
  private final PriorityQueue<InFlight> deadlines =
      new PriorityQueue<>((a, b) -> Long.compare(a.deadlineNanos, b.deadlineNanos));
  private long nextInvocationId;
  private long lastSpawnNanos;
  private boolean spawnedAny;
  private boolean draining;
  private int active;
  private long totalDispatched;
  private long totalCompleted;
  private long totalErrors;

  private DispatchScheduler(DispatchConfig config, PoseWorker worker, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.worker = Objects.requireNonNull(worker, "worker");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.minSpawnIntervalNanos = TimeUnit.MILLISECONDS.toNanos(config.minSpawnIntervalMs());
    this.timeoutNanos = TimeUnit.MILLISECONDS.toNanos(config.perRequestTimeoutMs());
    this.startedAtMillis = this.clock.nowMillis();
    this.workerPool = ExecutorFactories.newWorkerPool(
        config.maxConcurrentWorkers(), "poseflow-worker", this::handleWorkerCrash);
    this.owner = ExecutorFactories.ownerThreadFactory("poseflow-dispatch", this::handleOwnerCrash)
        .newThread(this::runLoop);
  }

  /**
   * Creates a scheduler and starts its owner thread.
   *
   * @param config dispatch limits
   * @param worker worker adapter used for every request
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @param clock time source; {@code null} selects {@link ClockPort#SYSTEM}
   * @return running scheduler
   */
  public static DispatchScheduler start(
      DispatchConfig config, PoseWorker worker, MetricsPort metrics, ClockPort clock) {
    DispatchScheduler scheduler = new DispatchScheduler(config, worker, metrics, clock);
    scheduler.owner.start();
    return scheduler;
  }

  /**
   * Submits a batch; the whole batch is admitted before the scheduler spawns anything further.
   *
   * @param batch requests in submission order
   * @return one future per request, in submission order, each completing normally with the outcome
   */
  @Override
  public List<CompletableFuture<DispatchOutcome>> submit(List<FrameRequest> batch) {
    Objects.requireNonNull(batch, "batch");
    if (batch.isEmpty()) {
      return List.of();
    }
    List<Pending> pending = new ArrayList<>(batch.size());
    List<CompletableFuture<DispatchOutcome>> futures = new ArrayList<>(batch.size());
    long now = clock.nanoTime();
    for (FrameRequest request : batch) {
      Pending item = new Pending(Objects.requireNonNull(request, "request"), new CompletableFuture<>(), now);
      pending.add(item);
      futures.add(item.future());
    }
    synchronized (lifecycleLock) {
      if (!closed) {
        events.add(new Submit(pending));
        return List.copyOf(futures);
      }
    }
    log.warn("Rejecting batch of {} frames; dispatch scheduler is closed", pending.size());
    for (Pending item : pending) {
      metrics.increment("dispatch.failed." + DispatchErrorKind.CLOSED.metricSuffix());
      item.future().complete(
          DispatchOutcome.failure(new SchedulerClosedException(item.request().frameNumber())));
    }
    return List.copyOf(futures);
  }

  /**
   * Returns the most recently published load snapshot.
   *
   * @return status with uptime measured now
   */
  public SchedulerStatus status() {
    return status.withUptime(clock.nowMillis() - startedAtMillis);
  }

  /**
   * Reports whether {@link #close()} has been requested or the owner thread has stopped.
   *
   * @return {@code true} once new submissions are refused
   */
  public boolean isClosed() {
    synchronized (lifecycleLock) {
      return closed;
    }
  }

  /**
   * Stops accepting requests, settles queued requests with {@link SchedulerClosedException}, and blocks
   * until every in-flight worker has completed or timed out.
   */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (!closed) {
        closed = true;
        events.add(new Shutdown());
        log.info("Dispatch scheduler shutdown requested");
      }
    }
    if (Thread.currentThread() == owner) {
      return;
    }
    try {
      while (!terminated.await(config.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
        SchedulerStatus snapshot = status;
        log.warn("Dispatch scheduler still draining after {} ms (active={}, queued={})",
            config.shutdownGraceMs(), snapshot.active(), snapshot.queued());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for dispatch scheduler to drain");
    }
  }

  private void runLoop() {
    MDC.put("pipeline", "dispatch");
    log.info("Dispatch scheduler started (workers={}, queueMaxSize={}, minSpawnIntervalMs={}, timeoutMs={}, worker={})",
        config.maxConcurrentWorkers(), config.queueMaxSize(), config.minSpawnIntervalMs(),
        config.perRequestTimeoutMs(), worker.describe());
    try {
      while (!(draining && active == 0)) {
        Event event = nextEvent();
        if (event != null) {
          handle(event);
        }
        expireDeadlines();
        spawnReady();
        publishStatus();
      }
      log.info("Dispatch scheduler drained; dispatched={}, completed={}, errors={}",
          totalDispatched, totalCompleted, totalErrors);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Dispatch owner interrupted; abandoning {} queued and {} in-flight requests",
          waiting.size(), inFlight.size());
    } finally {
      abandonRemaining();
      publishStatus();
      shutdownWorkerPool();
      MDC.remove("pipeline");
      terminated.countDown();
    }
  }

  private Event nextEvent() throws InterruptedException {
    long waitNanos = nextWakeupNanos(clock.nanoTime());
    if (waitNanos < 0) {
      return events.take();
    }
    if (waitNanos == 0) {
      return events.poll();
    }
    return events.poll(waitNanos, TimeUnit.NANOSECONDS);
  }

  /** Nanoseconds until the next pacing slot or deadline; {@code -1} when nothing is scheduled. */
  private long nextWakeupNanos(long now) {
    long wait = -1L;
    if (!draining && active < config.maxConcurrentWorkers() && !waiting.isEmpty()) {
      wait = spawnedAny ? Math.max(0L, lastSpawnNanos + minSpawnIntervalNanos - now) : 0L;
    }
    InFlight earliest = deadlines.peek();
    if (earliest != null) {
      long untilDeadline = Math.max(0L, earliest.deadlineNanos - now);
      wait = wait < 0 ? untilDeadline : Math.min(wait, untilDeadline);
    }
    return wait;
  }

  private void handle(Event event) {
    if (event instanceof Submit submit) {
      admit(submit.batch());
    } else if (event instanceof WorkerFinished finished) {
      settle(finished);
    } else if (event instanceof Shutdown) {
      beginDrain();
    }
  }

  private void admit(List<Pending> batch) {
    int rejected = 0;
    for (Pending item : batch) {
      int frame = item.request().frameNumber();
      if (draining) {
        fail(item, new SchedulerClosedException(frame));
      } else if (waiting.size() >= config.queueMaxSize()) {
        rejected++;
        metrics.increment("dispatch.rejected.queueFull");
        fail(item, new QueueFullException(frame, config.queueMaxSize()));
      } else {
        waiting.addLast(item);
        metrics.increment("dispatch.admitted");
      }
    }
    if (rejected > 0) {
      log.warn("Queue full (max {}); rejected {} of {} submitted frames",
          config.queueMaxSize(), rejected, batch.size());
    }
    metrics.observe("dispatch.queue.depth", waiting.size());
  }

  private void spawnReady() {
    while (!draining && active < config.maxConcurrentWorkers() && !waiting.isEmpty()) {
      if (spawnedAny && clock.nanoTime() - lastSpawnNanos < minSpawnIntervalNanos) {
        return;
      }
      spawn(waiting.pollFirst());
    }
  }

  private void spawn(Pending pending) {
    FrameRequest request = pending.request();
    WorkerInvocation invocation;
    try {
      invocation = worker.spawn(request);
    } catch (IOException | RuntimeException ex) {
      markSpawned();
      log.warn("Failed to spawn worker for frame {}", request.frameNumber(), ex);
      fail(pending, new WorkerFailureException(
          request.frameNumber(), "spawn failed: " + Logs.diagnostic(ex.getMessage()), ex));
      return;
    }
    markSpawned();
    metrics.observe("dispatch.queue.waitMillis",
        TimeUnit.NANOSECONDS.toMillis(lastSpawnNanos - pending.submittedAtNanos()));

    InFlight flight = new InFlight(nextInvocationId++, pending, invocation, lastSpawnNanos, lastSpawnNanos + timeoutNanos);
    inFlight.put(flight.id, flight);
    deadlines.add(flight);
    active++;
    totalDispatched++;
    metrics.increment("dispatch.spawned");
    log.debug("Spawned worker for frame {} (active={}, queued={})", request.frameNumber(), active, waiting.size());
    try {
      workerPool.execute(() -> runInvocation(flight));
    } catch (RejectedExecutionException ex) {
      inFlight.remove(flight.id);
      deadlines.remove(flight);
      active--;
      flight.state.set(WorkerState.FAILED);
      terminate(flight);
      fail(pending, new WorkerFailureException(request.frameNumber(), "worker pool rejected invocation", ex));
    }
  }

  private void markSpawned() {
    lastSpawnNanos = clock.nanoTime();
    spawnedAny = true;
  }

  /** Runs on a worker thread: send, then await, then report back to the owner. */
  private void runInvocation(InFlight flight) {
    Exception sendFailure = null;
    flight.state.compareAndSet(WorkerState.SPAWNING, WorkerState.SENDING);
    try {
      flight.invocation.send();
    } catch (IOException | RuntimeException ex) {
      sendFailure = ex;
    }
    flight.state.compareAndSet(WorkerState.SENDING, WorkerState.AWAITING_RESULT);
    PoseObservation result = null;
    Exception awaitFailure = null;
    try {
      result = flight.invocation.awaitResult();
    } catch (IOException | RuntimeException ex) {
      awaitFailure = ex;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      awaitFailure = ex;
    }
    events.add(new WorkerFinished(flight.id, sendFailure, result, awaitFailure));
  }

  private void settle(WorkerFinished finished) {
    InFlight flight = inFlight.remove(finished.invocationId());
    if (flight == null) {
      log.debug("Ignoring late result for invocation {}", finished.invocationId());
      return;
    }
    deadlines.remove(flight);
    active--;
    metrics.observe("dispatch.latencyMillis",
        TimeUnit.NANOSECONDS.toMillis(clock.nanoTime() - flight.spawnedAtNanos));
    DispatchOutcome outcome = WorkerOutcomes.resolve(
        flight.pending.request(), finished.sendFailure(), finished.result(), finished.awaitFailure());
    if (outcome.succeeded()) {
      flight.state.set(WorkerState.COMPLETED);
      totalCompleted++;
      metrics.increment("dispatch.completed");
      publishStatus();
      flight.pending.future().complete(outcome);
    } else {
      flight.state.set(WorkerState.FAILED);
      log.warn("Frame {} failed: {}", outcome.frameNumber(), outcome.error().getMessage());
      fail(flight.pending, outcome.error());
    }
  }

  private void expireDeadlines() {
    long now = clock.nanoTime();
    while (!deadlines.isEmpty() && deadlines.peek().deadlineNanos <= now) {
      InFlight flight = deadlines.poll();
      inFlight.remove(flight.id);
      active--;
      WorkerState reached = flight.state.getAndSet(WorkerState.TIMED_OUT);
      terminate(flight);
      int frame = flight.pending.request().frameNumber();
      log.warn("Worker for frame {} exceeded {} ms while {}; terminated",
          frame, config.perRequestTimeoutMs(), reached);
      fail(flight.pending, new WorkerTimeoutException(frame, config.perRequestTimeoutMs()));
    }
  }

  private void beginDrain() {
    draining = true;
    int rejected = waiting.size();
    while (!waiting.isEmpty()) {
      Pending item = waiting.pollFirst();
      fail(item, new SchedulerClosedException(item.request().frameNumber()));
    }
    log.info("Dispatch scheduler draining; rejected {} queued requests, waiting on {} in-flight workers",
        rejected, active);
  }

  private void abandonRemaining() {
    synchronized (lifecycleLock) {
      closed = true;
    }
    draining = true;
    while (!waiting.isEmpty()) {
      Pending item = waiting.pollFirst();
      fail(item, new SchedulerClosedException(item.request().frameNumber()));
    }
    for (InFlight flight : new ArrayList<>(inFlight.values())) {
      flight.state.set(WorkerState.FAILED);
      terminate(flight);
      fail(flight.pending, new SchedulerClosedException(flight.pending.request().frameNumber()));
    }
    inFlight.clear();
    deadlines.clear();
    active = 0;
    List<Event> leftovers = new ArrayList<>();
    events.drainTo(leftovers);
    for (Event event : leftovers) {
      if (event instanceof Submit submit) {
        for (Pending item : submit.batch()) {
          fail(item, new SchedulerClosedException(item.request().frameNumber()));
        }
      }
    }
  }

  private void terminate(InFlight flight) {
    try {
      flight.invocation.terminate();
    } catch (RuntimeException ex) {
      log.warn("Failed to terminate worker for frame {}", flight.pending.request().frameNumber(), ex);
    }
  }

  private void fail(Pending pending, DispatchException error) {
    totalErrors++;
    metrics.increment("dispatch.failed." + error.kind().metricSuffix());
    publishStatus();
    pending.future().complete(DispatchOutcome.failure(error));
  }

  private void publishStatus() {
    status = new SchedulerStatus(active, waiting.size(), totalDispatched, totalCompleted, totalErrors, 0L);
  }

  private void shutdownWorkerPool() {
    workerPool.shutdown();
    boolean poolTerminated = false;
    try {
      poolTerminated = workerPool.awaitTermination(config.shutdownGraceMs(), TimeUnit.MILLISECONDS);
      if (!poolTerminated) {
        log.warn("Worker threads active after {} ms; forcing shutdown", config.shutdownGraceMs());
        workerPool.shutdownNow();
        poolTerminated = workerPool.awaitTermination(config.shutdownGraceMs(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      workerPool.shutdownNow();
    }
    if (!poolTerminated) {
      log.error("Worker threads failed to terminate cleanly");
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("dispatch.worker.uncaught");
    log.error("Worker thread {} threw an uncaught exception", thread.getName(), throwable);
  }

  private void handleOwnerCrash(Thread thread, Throwable throwable) {
    log.error("Dispatch owner thread {} terminated unexpectedly", thread.getName(), throwable);
  }

  private sealed interface Event permits Submit, WorkerFinished, Shutdown {}

  private record Submit(List<Pending> batch) implements Event {}

  private record WorkerFinished(
      long invocationId, Exception sendFailure, PoseObservation result, Exception awaitFailure)
      implements Event {}

  private record Shutdown() implements Event {}

  private record Pending(FrameRequest request, CompletableFuture<DispatchOutcome> future, long submittedAtNanos) {}

  private static final class InFlight {
    private final long id;
    private final Pending pending;
    private final WorkerInvocation invocation;
    private final long spawnedAtNanos;
    private final long deadlineNanos;
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.SPAWNING);

    private InFlight(long id, Pending pending, WorkerInvocation invocation, long spawnedAtNanos, long deadlineNanos) {
      this.id = id;
      this.pending = pending;
      this.invocation = invocation;
      this.spawnedAtNanos = spawnedAtNanos;
      this.deadlineNanos = deadlineNanos;
    }
  }
}
