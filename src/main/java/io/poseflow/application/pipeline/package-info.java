/**
 * Use cases that run extraction and sequence preparation end to end.
 * <p>Each use case receives its collaborators from {@code io.poseflow.config.CompositionRoot} and surfaces
 * counters via {@link io.poseflow.application.port.MetricsPort}. Create a fresh analyzed sequence per
 * video; the cache it carries is bound to that sequence.</p>
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.application.pipeline;
