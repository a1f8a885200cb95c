/**
 * Immutable pose observations and the raw per-frame sequence built from worker results.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.domain.pose;
