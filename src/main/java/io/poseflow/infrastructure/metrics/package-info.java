/**
 * OpenTelemetry-backed implementations of {@link io.poseflow.application.port.MetricsPort}.
 * <p>Exporter selection follows the standard {@code otel.*} system properties and {@code OTEL_*}
 * environment variables.</p>
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.infrastructure.metrics;
