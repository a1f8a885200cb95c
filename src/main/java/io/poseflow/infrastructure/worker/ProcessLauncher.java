package io.poseflow.infrastructure.worker;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Starts operating-system processes for {@link ProcessPoseWorker}.
 *
 * @since POSEFLOW 0.1
 */
@FunctionalInterface
public interface ProcessLauncher {
  /** Launcher backed by {@link ProcessBuilder}. */
  ProcessLauncher SYSTEM = (command, workingDirectory) -> {
    ProcessBuilder builder = new ProcessBuilder(command);
    workingDirectory.ifPresent(dir -> builder.directory(dir.toFile()));
    return builder.start();
  };

  /**
   * Starts a process.
   *
   * @param command program and arguments
   * @param workingDirectory optional working directory
   * @return running process with piped stdin, stdout, and stderr
   * @throws IOException if the process cannot be started
   */
  Process launch(List<String> command, Optional<Path> workingDirectory) throws IOException;
}
