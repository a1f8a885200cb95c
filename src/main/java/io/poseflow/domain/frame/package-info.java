/**
 * Logical frame mapping types: direct, interpolated, and unavailable entries plus the gaps between
 * accepted frames.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.domain.frame;
