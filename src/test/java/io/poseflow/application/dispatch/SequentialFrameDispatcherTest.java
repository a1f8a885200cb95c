package io.poseflow.application.dispatch;

import static io.poseflow.application.dispatch.DispatchSchedulerTest.requests;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.poseflow.config.DispatchConfig;
import io.poseflow.testutil.FakePoseWorker;
import io.poseflow.testutil.RecordingMetricsPort;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class SequentialFrameDispatcherTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void processesOneFrameAtATimeInOrder() {
    FakePoseWorker worker = new FakePoseWorker(10);
    try (SequentialFrameDispatcher dispatcher =
        new SequentialFrameDispatcher(new DispatchConfig(8, 10, 0, 5_000, 1_000), worker, metrics, null)) {
      List<CompletableFuture<DispatchOutcome>> futures = dispatcher.submit(requests(4));

      assertTrue(futures.stream().allMatch(CompletableFuture::isDone));
      for (int i = 0; i < 4; i++) {
        assertTrue(futures.get(i).join().succeeded());
        assertEquals(i, futures.get(i).join().frameNumber());
      }
      assertEquals(1, worker.maxActive());
      assertEquals(List.of(0, 1, 2, 3), worker.spawnedFrames());
      assertEquals(4, metrics.count("dispatch.sequential.completed"));
    }
  }

  @Test
  void timeoutTerminatesWorkerAndContinues() {
    FakePoseWorker worker = new FakePoseWorker(0).on(0, FakePoseWorker.hang());
    try (SequentialFrameDispatcher dispatcher =
        new SequentialFrameDispatcher(new DispatchConfig(1, 10, 0, 100, 1_000), worker, metrics, null)) {
      List<CompletableFuture<DispatchOutcome>> futures = dispatcher.submit(requests(2));

      assertInstanceOf(WorkerTimeoutException.class, futures.get(0).join().error());
      assertTrue(worker.wasTerminated(0));
      assertTrue(futures.get(1).join().succeeded());
      assertEquals(1, metrics.count("dispatch.sequential.failed.timeout"));
    }
  }

  @Test
  void sendFailureAndWorkerErrorAreClassified() {
    FakePoseWorker worker = new FakePoseWorker(0).failSend(0).on(1, FakePoseWorker.fail("model not loaded"));
    try (SequentialFrameDispatcher dispatcher =
        new SequentialFrameDispatcher(new DispatchConfig(1, 10, 0, 5_000, 1_000), worker, metrics, null)) {
      List<CompletableFuture<DispatchOutcome>> futures = dispatcher.submit(requests(2));

      assertInstanceOf(TransmissionException.class, futures.get(0).join().error());
      WorkerFailureException failure =
          assertInstanceOf(WorkerFailureException.class, futures.get(1).join().error());
      assertTrue(failure.diagnostic().contains("model not loaded"));
    }
  }

  @Test
  void honoursMinimumSpawnInterval() {
    FakePoseWorker worker = new FakePoseWorker(0);
    try (SequentialFrameDispatcher dispatcher =
        new SequentialFrameDispatcher(new DispatchConfig(1, 10, 30, 5_000, 1_000), worker, metrics, null)) {
      dispatcher.submit(requests(3));

      List<Long> spawns = worker.spawnNanos();
      for (int i = 1; i < spawns.size(); i++) {
        assertTrue(spawns.get(i) - spawns.get(i - 1) >= 30_000_000L);
      }
    }
  }

  @Test
  void rejectsWorkAfterClose() {
    SequentialFrameDispatcher dispatcher =
        new SequentialFrameDispatcher(DispatchConfig.defaults(), new FakePoseWorker(0), metrics, null);
    dispatcher.close();

    DispatchOutcome outcome = dispatcher.submit(requests(1)).get(0).join();

    assertInstanceOf(SchedulerClosedException.class, outcome.error());
    assertEquals(1, metrics.count("dispatch.sequential.failed.closed"));
  }
}
