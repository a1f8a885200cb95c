/**
 * Ports between the application core and its adapters: pose workers, dispatchers, metrics, and time.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.application.port;
