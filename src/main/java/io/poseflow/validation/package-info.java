/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via
 * {@link IllegalArgumentException}.
 *
 * @since POSEFLOW 0.1
 */
package io.poseflow.validation;
