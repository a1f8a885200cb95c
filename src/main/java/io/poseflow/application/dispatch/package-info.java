/**
 * <strong>Purpose:</strong> Bounded, paced dispatch of frame requests to external pose workers.
 * <p><strong>Pipeline role:</strong> First stage of the pipeline; produces one
 * {@link io.poseflow.application.dispatch.DispatchOutcome} per submitted frame.
 * <p><strong>Concurrency:</strong> {@link io.poseflow.application.dispatch.DispatchScheduler} owns its queue
 * and active set on a single event-loop thread; workers run on a separate pool and report back through an
 * event channel.
 * <p><strong>Observability:</strong> Metrics under the {@code dispatch.*} prefix.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.application.dispatch;
