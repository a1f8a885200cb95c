/**
 * Logback setup for the CLI and bounded diagnostics for worker output.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.logging;
