/**
 * Pose worker adapters: one child process per frame, or one HTTP request per frame against a pose service.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.infrastructure.worker;
