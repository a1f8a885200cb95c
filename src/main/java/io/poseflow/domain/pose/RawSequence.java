package io.poseflow.domain.pose;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable, ordered per-frame slots produced by pose extraction.
 * <p><strong>Why:</strong> Downstream classification and interpolation index the sequence by frame
 * number and must never observe a later mutation.</p>
 * <p><strong>Role:</strong> Domain aggregate handed from extraction to the quality classifier, the gap
 * interpolator, and the frame cache.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe to share across threads.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class RawSequence {
  private final List<Optional<PoseObservation>> slots;

  private RawSequence(List<Optional<PoseObservation>> slots) {
    this.slots = Collections.unmodifiableList(slots);
  }

  /**
   * Builds a sequence from explicit slots; {@code null} elements are treated as absent.
   *
   * @param observations per-index observations
   * @return immutable sequence
   */
  public static RawSequence of(PoseObservation... observations) {
    Objects.requireNonNull(observations, "observations");
    return ofNullable(Arrays.asList(observations));
  }

  /**
   * Builds a sequence from a list whose {@code null} entries mark absent slots.
   *
   * @param observations per-index observations
   * @return immutable sequence
   */
  public static RawSequence ofNullable(List<PoseObservation> observations) {
    Objects.requireNonNull(observations, "observations");
    List<Optional<PoseObservation>> copy = new ArrayList<>(observations.size());
    for (PoseObservation observation : observations) {
      copy.add(Optional.ofNullable(observation));
    }
    return new RawSequence(copy);
  }

  /**
   * Starts a builder for a sequence of {@code length} initially absent slots.
   *
   * @param length number of frames; must be non-negative
   * @return builder
   */
  public static Builder builder(int length) {
    return new Builder(length);
  }

  /**
   * Number of frames {@code N}.
   *
   * @return sequence length
   */
  public int length() {
    return slots.size();
  }

  /**
   * Returns the slot at {@code index}.
   *
   * @param index zero-based frame index
   * @return observation or empty when absent
   * @throws IndexOutOfBoundsException if {@code index} is outside {@code 0..N-1}
   */
  public Optional<PoseObservation> get(int index) {
    return slots.get(index);
  }

  /**
   * Reports whether the slot at {@code index} holds an observation.
   *
   * @param index zero-based frame index
   * @return {@code true} when present
   */
  public boolean isPresent(int index) {
    return slots.get(index).isPresent();
  }

  /**
   * Counts present slots.
   *
   * @return number of frames with an observation
   */
  public int presentCount() {
    int count = 0;
    for (Optional<PoseObservation> slot : slots) {
      if (slot.isPresent()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Unmodifiable view of all slots.
   *
   * @return slots in frame order
   */
  public List<Optional<PoseObservation>> slots() {
    return slots;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof RawSequence other && slots.equals(other.slots));
  }

  @Override
  public int hashCode() {
    return slots.hashCode();
  }

  @Override
  public String toString() {
    return "RawSequence{length=" + slots.size() + ", present=" + presentCount() + '}';
  }

  /**
   * Single-use builder; {@link #build()} freezes the collected slots.
   */
  public static final class Builder {
    private final List<Optional<PoseObservation>> slots;
    private boolean built;

    private Builder(int length) {
      if (length < 0) {
        throw new IllegalArgumentException("length must be >= 0");
      }
      this.slots = new ArrayList<>(Collections.nCopies(length, Optional.empty()));
    }

    /**
     * Stores an observation at {@code index}.
     *
     * @param index slot index
     * @param observation observation; must not be {@code null}
     * @return this builder
     */
    public Builder set(int index, PoseObservation observation) {
      ensureOpen();
      slots.set(index, Optional.of(Objects.requireNonNull(observation, "observation")));
      return this;
    }

    /**
     * Marks the slot at {@code index} as absent.
     *
     * @param index slot index
     * @return this builder
     */
    public Builder clear(int index) {
      ensureOpen();
      slots.set(index, Optional.empty());
      return this;
    }

    /**
     * Freezes the builder.
     *
     * @return immutable sequence
     * @throws IllegalStateException if called twice
     */
    public RawSequence build() {
      ensureOpen();
      built = true;
      return new RawSequence(new ArrayList<>(slots));
    }

    private void ensureOpen() {
      if (built) {
        throw new IllegalStateException("builder already used");
      }
    }
  }
}
