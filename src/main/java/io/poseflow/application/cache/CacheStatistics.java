package io.poseflow.application.cache;

/**
 * Snapshot of frame cache counters.
 *
 * @param size frames currently cached
 * @param capacity maximum frames retained
 * @param hits lookups served from a cached frame
 * @param misses lookups that had to materialize
 * @param coalesced lookups that joined another caller's in-flight materialization
 * @param materializations frames built (direct copies and blends)
 * @param evictions frames dropped to respect capacity
 * @since POSEFLOW 0.1
 */
public record CacheStatistics(
    int size, int capacity, long hits, long misses, long coalesced, long materializations, long evictions) {

  /**
   * Share of lookups served without materializing, counting coalesced lookups as hits.
   *
   * @return ratio in {@code [0, 1]}; {@code 0} before the first lookup
   */
  public double hitRate() {
    long total = hits + misses + coalesced;
    return total == 0 ? 0d : (double) (hits + coalesced) / total;
  }
}
