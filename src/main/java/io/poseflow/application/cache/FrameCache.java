package io.poseflow.application.cache;

import io.poseflow.application.interpolation.FrameMaterializer;
import io.poseflow.application.port.MetricsPort;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.frame.InterpolationRecipe;
import io.poseflow.domain.frame.LogicalFrameEntry;
import io.poseflow.domain.frame.MaterializedFrame;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.domain.pose.RawSequence;
import io.poseflow.validation.Numbers;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Random-access, bounded cache of playback frames for one analyzed sequence.
 * <p><strong>Why:</strong> Playback scrubs back and forth; blending a frame on every request is wasteful,
 * while caching every frame of a long video is unbounded.</p>
 * <p><strong>Role:</strong> Application service consulted by playback consumers; initialized once by
 * {@code FrameSequenceUseCase} with the raw sequence and its logical mapping.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serve {@code DIRECT} frames as the raw observation and {@code INTERPOLATED} frames as a blend.</li>
 *   <li>Collapse concurrent misses for the same index into a single materialization.</li>
 *   <li>Evict the least recently used frames beyond {@code capacity}.</li>
 *   <li>Return an explicit {@code UNAVAILABLE} frame, never a zeroed pose, for unbridgeable gaps.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent readers. Each index is guarded by its own
 * in-flight future; eviction scans are serialized but never block lookups.</p>
 * <p><strong>Observability:</strong> Emits {@code cache.hit}, {@code cache.miss}, {@code cache.coalesced},
 * and {@code cache.eviction}; see {@link #statistics()}.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class FrameCache {
  private static final Logger log = LoggerFactory.getLogger(FrameCache.class);

  private final int capacity;
  private final FrameMaterializer materializer;
  private final MetricsPort metrics;
  private final AtomicReference<Source> source = new AtomicReference<>();
  private final ConcurrentHashMap<Integer, Entry> entries = new ConcurrentHashMap<>();
  private final AtomicLong clock = new AtomicLong();
  private final Object evictionLock = new Object();
  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder coalesced = new LongAdder();
  private final LongAdder materializations = new LongAdder();
  private final LongAdder evictions = new LongAdder();

  /**
   * Creates an empty, uninitialized cache.
   *
   * @param capacity maximum frames retained; at least 1
   * @param materializer blend implementation for interpolated frames
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   */
  public FrameCache(int capacity, FrameMaterializer materializer, MetricsPort metrics) {
    this.capacity = (int) Numbers.requireRange("capacity", capacity, 1, Integer.MAX_VALUE);
    this.materializer = Objects.requireNonNull(materializer, "materializer");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Binds the cache to a sequence and its mapping. May be called exactly once.
   *
   * @param sequence raw observations
   * @param mapping logical mapping planned for {@code sequence}
   * @throws IllegalArgumentException if lengths differ or a mapped source slot is absent
   * @throws IllegalStateException if the cache is already initialized
   */
  public void initialize(RawSequence sequence, FrameIndexMap mapping) {
    Objects.requireNonNull(sequence, "sequence");
    Objects.requireNonNull(mapping, "mapping");
    if (sequence.length() != mapping.length()) {
      throw new IllegalArgumentException(
          "mapping length " + mapping.length() + " does not match sequence length " + sequence.length());
    }
    for (LogicalFrameEntry entry : mapping.entries()) {
      switch (entry.kind()) {
        case DIRECT -> requireSource(sequence, entry.index(), entry.sourceIndex());
        case INTERPOLATED -> {
          requireSource(sequence, entry.index(), entry.recipe().leftSourceIndex());
          requireSource(sequence, entry.index(), entry.recipe().rightSourceIndex());
        }
        case UNAVAILABLE -> { }
      }
    }
    if (!source.compareAndSet(null, new Source(sequence, mapping))) {
      throw new IllegalStateException("Frame cache already initialized");
    }
    log.info("Frame cache initialized for {} frames (capacity={})", sequence.length(), capacity);
  }

  /**
   * Reports whether {@link #initialize} has completed.
   *
   * @return {@code true} once bound to a sequence
   */
  public boolean isInitialized() {
    return source.get() != null;
  }

  /**
   * Returns the playback frame for a logical index.
   *
   * @param index logical index in {@code 0..N-1}
   * @return direct, interpolated, or unavailable frame
   * @throws FrameCacheNotInitializedException if called before {@link #initialize}
   * @throws IndexOutOfBoundsException if {@code index} is outside {@code 0..N-1}
   */
  public MaterializedFrame getFrame(int index) {
    Source current = source.get();
    if (current == null) {
      throw new FrameCacheNotInitializedException();
    }
    Objects.checkIndex(index, current.mapping().length());
    LogicalFrameEntry entry = current.mapping().entry(index);
    if (entry.kind() == LogicalFrameEntry.Kind.UNAVAILABLE) {
      return MaterializedFrame.unavailable(index);
    }

    Entry cached = entries.get(index);
    if (cached != null) {
      return join(reuse(cached));
    }
    Entry created = new Entry(new CompletableFuture<>(), clock.incrementAndGet());
    Entry existing = entries.putIfAbsent(index, created);
    if (existing != null) {
      return join(reuse(existing));
    }

    misses.increment();
    metrics.increment("cache.miss");
    MaterializedFrame frame;
    try {
      frame = materialize(current.sequence(), entry);
    } catch (RuntimeException ex) {
      entries.remove(index, created);
      created.future.completeExceptionally(ex);
      throw ex;
    }
    materializations.increment();
    created.future.complete(frame);
    evictIfNeeded();
    return frame;
  }

  /**
   * Drops every cached frame; the binding to the sequence is kept.
   */
  public void clearCache() {
    int dropped = entries.size();
    entries.clear();
    log.debug("Frame cache cleared ({} frames dropped)", dropped);
  }

  /**
   * Current counters.
   *
   * @return statistics snapshot
   */
  public CacheStatistics statistics() {
    return new CacheStatistics(
        entries.size(),
        capacity,
        hits.sum(),
        misses.sum(),
        coalesced.sum(),
        materializations.sum(),
        evictions.sum());
  }

  private CompletableFuture<MaterializedFrame> reuse(Entry entry) {
    entry.lastAccess = clock.incrementAndGet();
    if (entry.future.isDone()) {
      hits.increment();
      metrics.increment("cache.hit");
    } else {
      coalesced.increment();
      metrics.increment("cache.coalesced");
    }
    return entry.future;
  }

  private MaterializedFrame materialize(RawSequence sequence, LogicalFrameEntry entry) {
    if (entry.kind() == LogicalFrameEntry.Kind.DIRECT) {
      return MaterializedFrame.direct(entry.index(), observation(sequence, entry.sourceIndex()));
    }
    InterpolationRecipe recipe = entry.recipe();
    PoseObservation blended = materializer.blend(
        entry.index(),
        observation(sequence, recipe.leftSourceIndex()),
        observation(sequence, recipe.rightSourceIndex()),
        recipe);
    return MaterializedFrame.interpolated(entry.index(), blended, recipe);
  }

  private void evictIfNeeded() {
    if (entries.size() <= capacity) {
      return;
    }
    synchronized (evictionLock) {
      while (entries.size() > capacity) {
        Map.Entry<Integer, Entry> oldest = null;
        for (Map.Entry<Integer, Entry> candidate : entries.entrySet()) {
          Entry value = candidate.getValue();
          if (value.future.isDone()
              && (oldest == null || value.lastAccess < oldest.getValue().lastAccess)) {
            oldest = candidate;
          }
        }
        if (oldest == null) {
          return;
        }
        if (entries.remove(oldest.getKey(), oldest.getValue())) {
          evictions.increment();
          metrics.increment("cache.eviction");
        }
      }
    }
  }

  private static MaterializedFrame join(CompletableFuture<MaterializedFrame> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw ex;
    }
  }

  private static PoseObservation observation(RawSequence sequence, int index) {
    return sequence.get(index)
        .orElseThrow(() -> new IllegalStateException("source frame " + index + " is absent"));
  }

  private static void requireSource(RawSequence sequence, int logicalIndex, int sourceIndex) {
    if (sourceIndex < 0 || sourceIndex >= sequence.length() || !sequence.isPresent(sourceIndex)) {
      throw new IllegalArgumentException(
          "logical frame " + logicalIndex + " references absent source frame " + sourceIndex);
    }
  }

  private record Source(RawSequence sequence, FrameIndexMap mapping) {}

  private static final class Entry {
    private final CompletableFuture<MaterializedFrame> future;
    private volatile long lastAccess;

    private Entry(CompletableFuture<MaterializedFrame> future, long lastAccess) {
      this.future = future;
      this.lastAccess = lastAccess;
    }
  }
}
