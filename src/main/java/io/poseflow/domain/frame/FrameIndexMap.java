package io.poseflow.domain.frame;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Logical frame mapping for a sequence of {@code N} frames.
 * <p><strong>Role:</strong> Output of {@code GapInterpolator}; consulted by {@code FrameCache} on every
 * miss and serialized by {@code FrameIndexMapCodec} for storage.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class FrameIndexMap {
  private final List<LogicalFrameEntry> entries;
  private final List<FrameGap> gaps;
  private final int directCount;
  private final int interpolatedCount;
  private final int unavailableCount;

  /**
   * Creates a mapping.
   *
   * @param entries entry {@code i} must describe logical index {@code i}
   * @param gaps non-accepted runs in ascending order
   * @throws IllegalArgumentException if entries are out of order
   */
  public FrameIndexMap(List<LogicalFrameEntry> entries, List<FrameGap> gaps) {
    Objects.requireNonNull(entries, "entries");
    Objects.requireNonNull(gaps, "gaps");
    int direct = 0;
    int interpolated = 0;
    int unavailable = 0;
    for (int i = 0; i < entries.size(); i++) {
      LogicalFrameEntry entry = Objects.requireNonNull(entries.get(i), "entry");
      if (entry.index() != i) {
        throw new IllegalArgumentException("entry " + i + " describes index " + entry.index());
      }
      switch (entry.kind()) {
        case DIRECT -> direct++;
        case INTERPOLATED -> interpolated++;
        case UNAVAILABLE -> unavailable++;
      }
    }
    this.entries = List.copyOf(entries);
    this.gaps = List.copyOf(gaps);
    this.directCount = direct;
    this.interpolatedCount = interpolated;
    this.unavailableCount = unavailable;
  }

  public int length() {
    return entries.size();
  }

  /**
   * Entry for a logical index.
   *
   * @param index logical index
   * @return entry
   * @throws IndexOutOfBoundsException if {@code index} is outside {@code 0..N-1}
   */
  public LogicalFrameEntry entry(int index) {
    return entries.get(index);
  }

  public List<LogicalFrameEntry> entries() {
    return entries;
  }

  public List<FrameGap> gaps() {
    return gaps;
  }

  public int directCount() {
    return directCount;
  }

  public int interpolatedCount() {
    return interpolatedCount;
  }

  public int unavailableCount() {
    return unavailableCount;
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof FrameIndexMap other && entries.equals(other.entries) && gaps.equals(other.gaps));
  }

  @Override
  public int hashCode() {
    return 31 * entries.hashCode() + gaps.hashCode();
  }

  @Override
  public String toString() {
    return "FrameIndexMap{length=" + entries.size()
        + ", direct=" + directCount
        + ", interpolated=" + interpolatedCount
        + ", unavailable=" + unavailableCount
        + ", gaps=" + gaps.size() + '}';
  }
}
