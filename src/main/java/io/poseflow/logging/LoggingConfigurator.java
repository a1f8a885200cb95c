package io.poseflow.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Bridges the CLI {@code --verbose} flag to the logging backend.
 *
 * <p>Only the {@value #POSEFLOW_LOGGER} hierarchy is raised. Third-party loggers such as
 * OpenTelemetry keep the levels from {@code logback.xml}, so verbose runs show pipeline
 * decisions without exporter chatter. Non-Logback bindings keep their defaults and a warning
 * is logged.</p>
 *
 * @since POSEFLOW 0.1
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Parent logger of every POSEFLOW class. */
  public static final String POSEFLOW_LOGGER = "io.poseflow";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the {@value #POSEFLOW_LOGGER} threshold to DEBUG.
   *
   * <p>Intended for single-threaded CLI startup.</p>
   *
   * @return level configured before the change; empty when it was inherited or the backend is
   *     not Logback
   */
  public static Optional<Level> enableVerboseLogging() {
    return setPoseflowLevel(Level.DEBUG);
  }

  /**
   * Sets the {@value #POSEFLOW_LOGGER} level, or clears it back to inheritance when
   * {@code level} is null.
   *
   * @param level new level, or null to inherit from the root logger
   * @return level configured before the change
   */
  public static Optional<Level> setPoseflowLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Logging level change for {} ignored; backend {} does not support dynamic updates",
          POSEFLOW_LOGGER, factory.getClass().getName());
      return Optional.empty();
    }
    Logger poseflow = context.getLogger(POSEFLOW_LOGGER);
    Level previous = poseflow.getLevel();
    poseflow.setLevel(level);
    return Optional.ofNullable(previous);
  }
}
