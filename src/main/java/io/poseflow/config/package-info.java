/**
 * <strong>Purpose:</strong> Typed, validated pipeline configuration and the composition root.
 * <p>Configuration is layered: built-in defaults, then the YAML {@code common} section and one profile,
 * then CLI {@code key=value} overrides. {@link io.poseflow.config.PipelineConfig#fromMap(java.util.Map)}
 * validates the merged map before any worker is started.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.config;
