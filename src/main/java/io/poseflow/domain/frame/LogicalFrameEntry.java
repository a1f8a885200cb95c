package io.poseflow.domain.frame;

import java.util.Objects;
import java.util.Optional;

/**
 * How the frame at one logical index is obtained.
 *
 * @param index logical index
 * @param kind resolution kind
 * @param sourceIndex raw index for {@link Kind#DIRECT}; {@code -1} otherwise
 * @param recipe blend recipe for {@link Kind#INTERPOLATED}; {@code null} otherwise
 * @since POSEFLOW 0.1
 */
public record LogicalFrameEntry(int index, Kind kind, int sourceIndex, InterpolationRecipe recipe) {

  /** Resolution kinds for a logical frame. */
  public enum Kind {
    /** Raw frame shown as-is. */
    DIRECT,
    /** Frame synthesized from two accepted neighbours. */
    INTERPOLATED,
    /** No frame can be shown; consumers decide how to render the hole. */
    UNAVAILABLE
  }

  public LogicalFrameEntry {
    Objects.requireNonNull(kind, "kind");
    switch (kind) {
      case DIRECT -> {
        if (sourceIndex < 0 || recipe != null) {
          throw new IllegalArgumentException("DIRECT entry needs a source index and no recipe");
        }
      }
      case INTERPOLATED -> {
        if (recipe == null || sourceIndex != -1) {
          throw new IllegalArgumentException("INTERPOLATED entry needs a recipe and no source index");
        }
      }
      case UNAVAILABLE -> {
        if (recipe != null || sourceIndex != -1) {
          throw new IllegalArgumentException("UNAVAILABLE entry carries no source");
        }
      }
    }
  }

  public static LogicalFrameEntry direct(int index) {
    return new LogicalFrameEntry(index, Kind.DIRECT, index, null);
  }

  public static LogicalFrameEntry interpolated(int index, InterpolationRecipe recipe) {
    return new LogicalFrameEntry(index, Kind.INTERPOLATED, -1, Objects.requireNonNull(recipe, "recipe"));
  }

  public static LogicalFrameEntry unavailable(int index) {
    return new LogicalFrameEntry(index, Kind.UNAVAILABLE, -1, null);
  }

  public Optional<InterpolationRecipe> recipeIfAny() {
    return Optional.ofNullable(recipe);
  }
}
