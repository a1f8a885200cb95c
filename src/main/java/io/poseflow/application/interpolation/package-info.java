/**
 * Gap planning and frame synthesis between accepted observations.
 * <p>{@link io.poseflow.application.interpolation.GapInterpolator} plans the logical mapping;
 * {@link io.poseflow.application.interpolation.FrameMaterializer} blends a planned frame on demand.</p>
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.application.interpolation;
