package io.poseflow.api;

/**
 * <strong>What:</strong> Process exit codes shared by POSEFLOW commands.
 * <p><strong>Why:</strong> Scripts driving batch analysis need to tell bad input from worker trouble.</p>
 *
 * @since POSEFLOW 0.1
 */
public enum ExitCode {
  /** Every frame was analyzed or deliberately marked unavailable. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading frames or writing output failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Analysis completed, but no frame produced a usable pose. */
  NO_USABLE_FRAMES(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric status reported to the operating system.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
