package io.poseflow.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named threads the dispatch scheduler and worker adapters run on.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for worker I/O (sending payloads, awaiting results).
   *
   * <p>The scheduler never hands out more tasks than {@code size}, so the unbounded hand-off queue only
   * absorbs the moment between a task finishing and its thread becoming idle.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = namedFactory(prefix, "poseflow-worker", handler, true);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds an elastic pool for short blocking reads such as draining a child process's stderr.
   *
   * <p>Threads are created on demand and retire after 60 seconds idle; concurrency is already bounded by
   * the scheduler's worker limit.</p>
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newStreamDrainPool(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = namedFactory(prefix, "poseflow-drain", handler, true);
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the factory used for the scheduler's single owner thread.
   *
   * @param name thread name
   * @param handler uncaught exception handler
   * @return thread factory producing one named daemon thread per call
   */
  public static ThreadFactory ownerThreadFactory(String name, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    String threadName = (name == null || name.isBlank()) ? "poseflow-dispatch" : name;
    return runnable -> {
      Thread thread = new Thread(runnable, threadName);
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static ThreadFactory namedFactory(
      String prefix, String fallback, UncaughtExceptionHandler handler, boolean daemon) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
