package io.poseflow.domain.pose;

import java.util.Objects;

/**
 * One unit of dispatch work: analyze the frame with the given number.
 *
 * <p>The result channel is the per-request future returned by the dispatcher, so the request itself
 * stays a plain immutable value.</p>
 *
 * @param frameNumber zero-based frame number; must be non-negative
 * @param payload image data for the worker
 * @since POSEFLOW 0.1
 */
public record FrameRequest(int frameNumber, FramePayload payload) {

  /**
   * Validates the request.
   *
   * @throws IllegalArgumentException if {@code frameNumber} is negative
   * @throws NullPointerException if {@code payload} is {@code null}
   */
  public FrameRequest {
    if (frameNumber < 0) {
      throw new IllegalArgumentException("frameNumber must be >= 0");
    }
    Objects.requireNonNull(payload, "payload");
  }
}
