package io.poseflow.infrastructure.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.poseflow.application.port.WorkerInvocation;
import io.poseflow.config.WorkerConfig;
import io.poseflow.domain.pose.FramePayload;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.PoseObservation;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpPoseWorkerTest {
  private HttpServer server;
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastContentType = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String response = "{}";

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/pose/hybrid", this::handle);
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void postsFrameAndParsesResult() throws Exception {
    response = "{\"frame_number\":6,\"keypoints\":[{\"x\":3,\"y\":4,\"confidence\":0.6}],\"has3d\":false}";
    HttpPoseWorker worker = new HttpPoseWorker(config());

    WorkerInvocation invocation = worker.spawn(new FrameRequest(6, FramePayload.ofBytes(new byte[] {1})));
    invocation.send();
    PoseObservation pose = invocation.awaitResult();

    assertEquals(6, pose.frameNumber());
    assertEquals(0.6, pose.confidence(), 1e-9);
    assertEquals("application/json", lastContentType.get());
    assertTrue(lastBody.get().contains("\"frame_number\":6"));
    assertTrue(worker.describe().endsWith("/pose/hybrid"));
  }

  @Test
  void nonSuccessStatusBecomesIoError() throws Exception {
    status = 503;
    response = "model loading";
    HttpPoseWorker worker = new HttpPoseWorker(config());

    WorkerInvocation invocation = worker.spawn(new FrameRequest(1, FramePayload.ofBytes(new byte[] {1})));
    invocation.send();
    IOException ex = assertThrows(IOException.class, invocation::awaitResult);

    assertEquals("pose service returned HTTP 503: model loading", ex.getMessage());
  }

  @Test
  void awaitingWithoutSendFails() {
    WorkerInvocation invocation =
        new HttpPoseWorker(config()).spawn(new FrameRequest(1, FramePayload.ofBytes(new byte[] {1})));

    assertThrows(IOException.class, invocation::awaitResult);
  }

  @Test
  void terminateBeforeSendRefusesToSend() {
    WorkerInvocation invocation =
        new HttpPoseWorker(config()).spawn(new FrameRequest(1, FramePayload.ofBytes(new byte[] {1})));
    invocation.terminate();

    assertThrows(IOException.class, invocation::send);
  }

  private WorkerConfig config() {
    return WorkerConfig.fromMap(Map.of(
        "worker.mode", "http",
        "worker.baseUrl", "http://127.0.0.1:" + server.getAddress().getPort()));
  }

  private void handle(HttpExchange exchange) throws IOException {
    lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
    lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
