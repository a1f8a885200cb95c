package io.poseflow.infrastructure.worker;

import io.poseflow.application.port.PoseWorker;
import io.poseflow.application.port.WorkerInvocation;
import io.poseflow.config.WorkerConfig;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.infrastructure.exec.ExecutorFactories;
import io.poseflow.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PoseWorker} that runs one child process per frame.
 * <p><strong>Why:</strong> Pose models ship as Python scripts; a fresh process per frame isolates model
 * crashes and memory leaks from the rest of the batch.</p>
 * <p><strong>Role:</strong> Outbound adapter. The request document goes to stdin, which is then closed;
 * stdout must hold the JSON result; a non-zero exit code is a failure whose diagnostic is stderr.</p>
 * <p><strong>Thread-safety:</strong> Stateless between invocations; each invocation is confined to the
 * dispatcher's worker thread except {@code terminate()}, which may come from any thread.</p>
 * <p><strong>Observability:</strong> Logs launch and exit at DEBUG and non-zero exits at WARN with a
 * bounded stderr excerpt.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class ProcessPoseWorker implements PoseWorker {
  private static final Logger log = LoggerFactory.getLogger(ProcessPoseWorker.class);

  private final WorkerConfig config;
  private final ProcessLauncher launcher;
  private final PoseJsonCodec codec;
  private final ExecutorService stderrDrains;

  public ProcessPoseWorker(WorkerConfig config) {
    this(config, ProcessLauncher.SYSTEM, new PoseJsonCodec());
  }

  /**
   * Creates a worker with an explicit launcher.
   *
   * @param config command and working directory
   * @param launcher process launcher
   * @param codec wire codec
   */
  public ProcessPoseWorker(WorkerConfig config, ProcessLauncher launcher, PoseJsonCodec codec) {
    this.config = Objects.requireNonNull(config, "config");
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.stderrDrains = ExecutorFactories.newStreamDrainPool("poseflow-stderr", (t, ex) ->
        log.error("Stderr drain thread {} threw an uncaught exception", t.getName(), ex));
  }

  @Override
  public WorkerInvocation spawn(FrameRequest request) throws IOException {
    Objects.requireNonNull(request, "request");
    List<String> command = config.command();
    Process process = launcher.launch(command, config.workingDirectory());
    log.debug("Launched worker process for frame {}: {}", request.frameNumber(), command);
    return new ProcessInvocation(request, process);
  }

  @Override
  public String describe() {
    return "process " + String.join(" ", config.command());
  }

  private final class ProcessInvocation implements WorkerInvocation {
    private final FrameRequest request;
    private final Process process;
    private final AtomicBoolean terminated = new AtomicBoolean();

    private ProcessInvocation(FrameRequest request, Process process) {
      this.request = request;
      this.process = process;
    }

    @Override
    public void send() throws IOException {
      try (OutputStream stdin = process.getOutputStream()) {
        codec.writeProcessRequest(request, stdin);
      }
    }

    @Override
    public PoseObservation awaitResult() throws IOException, InterruptedException {
      CompletableFuture<String> stderr = drain(process.getErrorStream());
      byte[] stdout;
      try (InputStream in = process.getInputStream()) {
        stdout = in.readAllBytes();
      }
      int exitCode = process.waitFor();
      String diagnostic = stderrText(stderr);
      if (terminated.get()) {
        throw new IOException("worker process for frame " + request.frameNumber() + " was terminated");
      }
      if (exitCode != 0) {
        log.warn("Worker process for frame {} exited with code {}: {}",
            request.frameNumber(), exitCode, Logs.diagnostic(diagnostic));
        throw new IOException("worker exited with code " + exitCode + ": " + Logs.diagnostic(diagnostic));
      }
      if (!diagnostic.isBlank()) {
        log.debug("Worker process for frame {} stderr: {}", request.frameNumber(), Logs.diagnostic(diagnostic));
      }
      log.debug("Worker process for frame {} exited cleanly ({} bytes of output)",
          request.frameNumber(), stdout.length);
      return codec.parseResult(stdout, request.frameNumber());
    }

    @Override
    public void terminate() {
      if (terminated.compareAndSet(false, true) && process.isAlive()) {
        process.destroyForcibly();
        log.debug("Forcibly terminated worker process for frame {}", request.frameNumber());
      }
    }

    private CompletableFuture<String> drain(InputStream stream) {
      return CompletableFuture.supplyAsync(() -> {
        try (InputStream in = stream) {
          return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
          return "<stderr unavailable: " + ex.getMessage() + ">";
        }
      }, stderrDrains);
    }

    private String stderrText(CompletableFuture<String> stderr) throws InterruptedException {
      try {
        return stderr.get();
      } catch (ExecutionException ex) {
        return "<stderr unavailable: " + ex.getCause() + ">";
      }
    }
  }
}
