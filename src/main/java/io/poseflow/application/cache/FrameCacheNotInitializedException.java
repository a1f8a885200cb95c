package io.poseflow.application.cache;

/**
 * Raised when a frame is requested before {@link FrameCache#initialize} has run.
 *
 * @since POSEFLOW 0.1
 */
public final class FrameCacheNotInitializedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public FrameCacheNotInitializedException() {
    super("Frame cache not initialized; call initialize(sequence, mapping) first");
  }
}
