package io.poseflow.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.poseflow.config.DispatchConfig;
import io.poseflow.domain.pose.FramePayload;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.testutil.FakePoseWorker;
import io.poseflow.testutil.Poses;
import io.poseflow.testutil.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DispatchSchedulerTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private DispatchScheduler scheduler;

  @AfterEach
  void tearDown() {
    if (scheduler != null) {
      scheduler.close();
    }
  }

  @Test
  void everyRequestSettlesWithItsOwnFrame() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(5);
    scheduler = DispatchScheduler.start(new DispatchConfig(3, 100, 0, 5_000, 5_000), worker, metrics, null);

    List<DispatchOutcome> outcomes = awaitAll(scheduler.submit(requests(10)));

    assertEquals(10, outcomes.size());
    for (int i = 0; i < outcomes.size(); i++) {
      DispatchOutcome outcome = outcomes.get(i);
      assertTrue(outcome.succeeded(), () -> "frame " + outcome.frameNumber() + " failed: " + outcome.error());
      assertEquals(i, outcome.frameNumber());
      assertEquals(i, outcome.observation().frameNumber());
    }
    assertEquals(10, metrics.count("dispatch.completed"));
    assertEquals(10, metrics.count("dispatch.admitted"));
    assertEquals(10, metrics.observations("dispatch.latencyMillis").size());
  }

  @Test
  void concurrentWorkersNeverExceedLimit() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(40);
    scheduler = DispatchScheduler.start(new DispatchConfig(3, 100, 0, 5_000, 5_000), worker, metrics, null);

    List<DispatchOutcome> outcomes = awaitAll(scheduler.submit(requests(12)));

    assertTrue(outcomes.stream().allMatch(DispatchOutcome::succeeded));
    assertTrue(worker.maxActive() <= 3, "max active was " + worker.maxActive());
    assertEquals(12, worker.spawnCount());
  }

  @Test
  void spawnsAreSpacedByMinimumInterval() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(0);
    scheduler = DispatchScheduler.start(new DispatchConfig(5, 100, 40, 5_000, 5_000), worker, metrics, null);

    awaitAll(scheduler.submit(requests(5)));

    List<Long> spawns = worker.spawnNanos();
    assertEquals(5, spawns.size());
    for (int i = 1; i < spawns.size(); i++) {
      long gapMs = TimeUnit.NANOSECONDS.toMillis(spawns.get(i) - spawns.get(i - 1));
      assertTrue(gapMs >= 40, "spawn " + i + " followed previous after " + gapMs + " ms");
    }
  }

  @Test
  void requestsBeyondQueueCapacityAreRejected() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(5);
    scheduler = DispatchScheduler.start(new DispatchConfig(1, 2, 0, 5_000, 5_000), worker, metrics, null);

    List<DispatchOutcome> outcomes = awaitAll(scheduler.submit(requests(3)));

    assertTrue(outcomes.get(0).succeeded());
    assertTrue(outcomes.get(1).succeeded());
    QueueFullException error = assertInstanceOf(QueueFullException.class, outcomes.get(2).error());
    assertEquals(2, error.frameNumber());
    assertEquals(2, error.queueMaxSize());
    assertTrue(error.retryable());
    assertEquals(1, metrics.count("dispatch.rejected.queueFull"));
    assertFalse(worker.spawnedFrames().contains(2));
  }

  @Test
  void failedSendIsTransmissionErrorEvenWhenWorkerAnswers() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(0).failSend(1);
    scheduler = DispatchScheduler.start(new DispatchConfig(2, 10, 0, 5_000, 5_000), worker, metrics, null);

    List<DispatchOutcome> outcomes = awaitAll(scheduler.submit(requests(3)));

    assertTrue(outcomes.get(0).succeeded());
    TransmissionException error = assertInstanceOf(TransmissionException.class, outcomes.get(1).error());
    assertTrue(error.getMessage().contains("broken pipe"));
    assertEquals(DispatchErrorKind.TRANSMISSION, error.kind());
    assertTrue(outcomes.get(2).succeeded());
    assertEquals(1, metrics.count("dispatch.failed.transmission"));
  }

  @Test
  void hungWorkerTimesOutAndIsTerminated() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(0).on(1, FakePoseWorker.hang());
    scheduler = DispatchScheduler.start(new DispatchConfig(2, 10, 0, 150, 5_000), worker, metrics, null);

    List<DispatchOutcome> outcomes = awaitAll(scheduler.submit(requests(3)));

    WorkerTimeoutException error = assertInstanceOf(WorkerTimeoutException.class, outcomes.get(1).error());
    assertEquals(150, error.timeoutMs());
    assertTrue(worker.wasTerminated(1));
    assertTrue(outcomes.get(0).succeeded());
    assertTrue(outcomes.get(2).succeeded());
    assertEquals(1, metrics.count("dispatch.failed.timeout"));
  }

  @Test
  void failingWorkerDoesNotAffectSiblings() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(5)
        .on(2, FakePoseWorker.fail("segmentation fault"))
        .failSpawn(4);
    scheduler = DispatchScheduler.start(new DispatchConfig(3, 10, 0, 5_000, 5_000), worker, metrics, null);

    List<DispatchOutcome> outcomes = awaitAll(scheduler.submit(requests(6)));

    WorkerFailureException crashed = assertInstanceOf(WorkerFailureException.class, outcomes.get(2).error());
    assertTrue(crashed.diagnostic().contains("segmentation fault"));
    assertFalse(crashed.retryable());
    WorkerFailureException unspawned = assertInstanceOf(WorkerFailureException.class, outcomes.get(4).error());
    assertTrue(unspawned.diagnostic().startsWith("spawn failed"));
    for (int frame : new int[] {0, 1, 3, 5}) {
      assertTrue(outcomes.get(frame).succeeded(), "frame " + frame);
    }
  }

  @Test
  void workerReportedErrorAndMismatchedFrameAreFailures() throws Exception {
    PoseObservation refused = new PoseObservation(
        0, List.of(), false, null, null, null, null, 0d, 0L, "no person detected");
    FakePoseWorker worker = new FakePoseWorker(0)
        .on(0, FakePoseWorker.returning(refused))
        .on(1, FakePoseWorker.returning(Poses.at(7, 500, 500)));
    scheduler = DispatchScheduler.start(new DispatchConfig(2, 10, 0, 5_000, 5_000), worker, metrics, null);

    List<DispatchOutcome> outcomes = awaitAll(scheduler.submit(requests(2)));

    WorkerFailureException refusedError = assertInstanceOf(WorkerFailureException.class, outcomes.get(0).error());
    assertTrue(refusedError.diagnostic().contains("no person detected"));
    WorkerFailureException mismatch = assertInstanceOf(WorkerFailureException.class, outcomes.get(1).error());
    assertTrue(mismatch.diagnostic().contains("frame 7"));
  }

  @Test
  void closeDrainsInFlightWorkAndRejectsQueuedAndLaterRequests() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(200);
    scheduler = DispatchScheduler.start(new DispatchConfig(1, 10, 0, 5_000, 5_000), worker, metrics, null);
    List<CompletableFuture<DispatchOutcome>> futures = scheduler.submit(requests(3));
    waitUntil(() -> worker.spawnCount() >= 1);

    scheduler.close();

    assertTrue(scheduler.isClosed());
    List<DispatchOutcome> outcomes = awaitAll(futures);
    assertTrue(outcomes.get(0).succeeded(), "in-flight work completes during drain");
    assertInstanceOf(SchedulerClosedException.class, outcomes.get(1).error());
    assertInstanceOf(SchedulerClosedException.class, outcomes.get(2).error());
    assertEquals(1, worker.spawnCount());

    List<DispatchOutcome> late = awaitAll(scheduler.submit(requests(1)));
    SchedulerClosedException rejected = assertInstanceOf(SchedulerClosedException.class, late.get(0).error());
    assertEquals(DispatchErrorKind.CLOSED, rejected.kind());
  }

  @Test
  void statusReportsTotalsOnceSettled() throws Exception {
    FakePoseWorker worker = new FakePoseWorker(0).on(3, FakePoseWorker.fail("boom"));
    scheduler = DispatchScheduler.start(new DispatchConfig(2, 10, 0, 5_000, 5_000), worker, metrics, null);

    awaitAll(scheduler.submit(requests(5)));
    SchedulerStatus status = scheduler.status();

    assertEquals(0, status.active());
    assertEquals(0, status.queued());
    assertEquals(5, status.totalDispatched());
    assertEquals(4, status.totalCompleted());
    assertEquals(1, status.totalErrors());
    assertTrue(status.uptimeMillis() >= 0);
  }

  @Test
  void emptyBatchReturnsNoFutures() {
    scheduler = DispatchScheduler.start(DispatchConfig.defaults(), new FakePoseWorker(0), metrics, null);

    assertTrue(scheduler.submit(List.of()).isEmpty());
  }

  static List<FrameRequest> requests(int count) {
    List<FrameRequest> requests = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      requests.add(new FrameRequest(i, FramePayload.ofBytes(new byte[] {(byte) i})));
    }
    return requests;
  }

  static List<DispatchOutcome> awaitAll(List<CompletableFuture<DispatchOutcome>> futures) throws Exception {
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(10, TimeUnit.SECONDS);
    List<DispatchOutcome> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<DispatchOutcome> future : futures) {
      outcomes.add(future.join());
    }
    return outcomes;
  }

  private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not reached within 5 s");
      }
      Thread.sleep(5);
    }
  }
}
