package io.poseflow.infrastructure.worker;

import io.poseflow.application.port.PoseWorker;
import io.poseflow.application.port.WorkerInvocation;
import io.poseflow.config.WorkerConfig;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PoseWorker} that posts each frame to a long-running pose service.
 * <p><strong>Why:</strong> Loading a pose model per frame is slow; a resident service amortizes it while
 * the dispatcher keeps the same spawn/send/await/terminate lifecycle.</p>
 * <p><strong>Role:</strong> Outbound adapter over the JDK {@link HttpClient}. {@code spawn} only prepares
 * the request; {@code send} starts the exchange; {@code terminate} cancels it.</p>
 * <p><strong>Thread-safety:</strong> The shared client is thread-safe; invocations follow the
 * {@link WorkerInvocation} contract.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class HttpPoseWorker implements PoseWorker {
  private static final Logger log = LoggerFactory.getLogger(HttpPoseWorker.class);

  private final URI endpoint;
  private final HttpClient client;
  private final PoseJsonCodec codec;

  public HttpPoseWorker(WorkerConfig config) {
    this(config, HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
        .build(), new PoseJsonCodec());
  }

  /**
   * Creates a worker with an explicit client.
   *
   * @param config base URL and request path
   * @param client HTTP client
   * @param codec wire codec
   */
  public HttpPoseWorker(WorkerConfig config, HttpClient client, PoseJsonCodec codec) {
    this.endpoint = Objects.requireNonNull(config, "config").requestUri();
    this.client = Objects.requireNonNull(client, "client");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public WorkerInvocation spawn(FrameRequest request) {
    return new HttpInvocation(Objects.requireNonNull(request, "request"));
  }

  @Override
  public String describe() {
    return "http " + endpoint;
  }

  private final class HttpInvocation implements WorkerInvocation {
    private final FrameRequest request;
    private volatile CompletableFuture<HttpResponse<byte[]>> exchange;
    private volatile boolean terminated;

    private HttpInvocation(FrameRequest request) {
      this.request = request;
    }

    @Override
    public void send() throws IOException {
      if (terminated) {
        throw new IOException("invocation terminated before send");
      }
      HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofByteArray(codec.httpRequestBody(request)))
          .build();
      exchange = client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
      log.debug("Posted frame {} to {}", request.frameNumber(), endpoint);
      if (terminated) {
        exchange.cancel(true);
      }
    }

    @Override
    public PoseObservation awaitResult() throws IOException, InterruptedException {
      CompletableFuture<HttpResponse<byte[]>> pending = exchange;
      if (pending == null) {
        throw new IOException("request for frame " + request.frameNumber() + " was never sent");
      }
      HttpResponse<byte[]> response;
      try {
        response = pending.get();
      } catch (CancellationException ex) {
        throw new IOException("request for frame " + request.frameNumber() + " was cancelled", ex);
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        throw new IOException("request for frame " + request.frameNumber() + " failed: " + cause.getMessage(), cause);
      }
      int status = response.statusCode();
      if (status < 200 || status >= 300) {
        String body = new String(response.body(), StandardCharsets.UTF_8);
        log.warn("Pose service answered frame {} with HTTP {}: {}", request.frameNumber(), status, Logs.diagnostic(body));
        throw new IOException("pose service returned HTTP " + status + ": " + Logs.diagnostic(body));
      }
      return codec.parseResult(response.body(), request.frameNumber());
    }

    @Override
    public void terminate() {
      terminated = true;
      CompletableFuture<HttpResponse<byte[]>> pending = exchange;
      if (pending != null) {
        pending.cancel(true);
      }
    }
  }
}
