/**
 * Per-frame quality verdicts for a raw pose sequence.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.application.quality;
