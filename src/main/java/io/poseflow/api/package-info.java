/**
 * Command-line entry points: {@code analyze}, {@code config-check}, and {@code mapping}.
 * <p>Every command returns an {@link io.poseflow.api.ExitCode}; {@link io.poseflow.api.Main} maps it to the
 * process exit status. Human-readable output goes through {@link io.poseflow.api.CliPrinter}, diagnostics
 * through SLF4J.</p>
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.api;
