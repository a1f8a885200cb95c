/**
 * Random-access playback cache over an analyzed sequence.
 * <p>Lookups are single-flight per logical index and bounded by an LRU capacity.</p>
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.application.cache;
