package io.poseflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    PipelineConfig config = PipelineConfig.defaults();

    assertEquals(8, config.dispatch().maxConcurrentWorkers());
    assertEquals(100, config.dispatch().queueMaxSize());
    assertEquals(0.6, config.quality().minConfidence());
    assertEquals(5, config.quality().trendWindowSize());
    assertEquals(10, config.interpolation().maxGap());
    assertEquals(256, config.cache().capacity());
    assertEquals(WorkerMode.PROCESS, config.worker().mode());
    assertEquals(List.of("python", "app.py"), config.worker().command());
  }

  @Test
  void toMapRoundTripsThroughFromMap() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of(
        "dispatch.maxConcurrentWorkers", "3",
        "quality.outlierDeviationThreshold", "0.45",
        "worker.mode", "http",
        "worker.baseUrl", "http://gpu-box:8080/",
        "worker.workingDirectory", "/opt/pose"));

    assertEquals(config, PipelineConfig.fromMap(config.toMap()));
    assertEquals("http", config.toMap().get("worker.mode"));
  }

  @Test
  void fromMapParsesWorkerSettings() {
    WorkerConfig worker = PipelineConfig.fromMap(Map.of(
        "worker.mode", "HTTP",
        "worker.baseUrl", "http://pose-service:5000/",
        "worker.requestPath", "pose/hybrid",
        "worker.command", "  python3   worker.py  ")).worker();

    assertEquals(WorkerMode.HTTP, worker.mode());
    assertEquals(URI.create("http://pose-service:5000/pose/hybrid"), worker.requestUri());
    assertEquals(List.of("python3", "worker.py"), worker.command());
    assertTrue(worker.workingDirectory().isEmpty());
  }

  @Test
  void outOfRangeValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("dispatch.maxConcurrentWorkers", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("quality.minConfidence", "1.5")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("quality.trendWindowSize", "2")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("interpolation.maxGap", "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("cache.capacity", "many")));
  }

  @Test
  void workerSettingsAreValidated() {
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("worker.mode", "grpc")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("worker.baseUrl", "ftp://pose-service")));
  }
}
