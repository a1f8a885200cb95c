package io.poseflow.infrastructure.worker;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.poseflow.domain.pose.FramePayload;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.infrastructure.json.JsonSupport;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PoseJsonCodecTest {
  private final PoseJsonCodec codec = new PoseJsonCodec();

  @TempDir Path tempDir;

  @Test
  void processRequestCarriesBase64OrPath() throws IOException {
    ByteArrayOutputStream bytesOut = new ByteArrayOutputStream();
    codec.writeProcessRequest(new FrameRequest(4, FramePayload.ofBytes(new byte[] {1, 2, 3})), bytesOut);
    ByteArrayOutputStream pathOut = new ByteArrayOutputStream();
    codec.writeProcessRequest(new FrameRequest(5, FramePayload.ofPath(Path.of("/frames/0005.jpg"))), pathOut);

    Map<String, Object> inline = firstFrame(bytesOut.toByteArray());
    assertEquals(4, JsonSupport.asInt(inline.get("frameNumber"), "frameNumber"));
    assertEquals(Base64.getEncoder().encodeToString(new byte[] {1, 2, 3}), inline.get("imageBase64"));
    Map<String, Object> byPath = firstFrame(pathOut.toByteArray());
    assertEquals("/frames/0005.jpg", byPath.get("imagePath"));
    assertFalse(byPath.containsKey("imageBase64"));
  }

  @Test
  void httpBodyEncodesFileContents() throws IOException {
    Path image = tempDir.resolve("frame.png");
    Files.write(image, new byte[] {9, 8, 7});

    byte[] body = codec.httpRequestBody(new FrameRequest(2, FramePayload.ofPath(image)));

    Map<String, Object> root = JsonSupport.asObject(new JsonSupport().parse(body), "body");
    assertEquals(Base64.getEncoder().encodeToString(new byte[] {9, 8, 7}), root.get("image_base64"));
    assertEquals(2, JsonSupport.asInt(root.get("frame_number"), "frame_number"));
  }

  @Test
  void parsesHybridResultWithSnakeCaseKeys() throws IOException {
    String json = """
        {
          "frame_number": 7,
          "keypoints": [
            {"name": "nose", "x": 100.0, "y": 50.0, "z": 0.2, "confidence": 0.9},
            {"name": "hip", "x": 110.0, "y": 150.0, "score": 0.7}
          ],
          "has_3d": true,
          "mesh_vertices_data": [[0.0, 1.0, 2.0], [3.0, 4.0, 5.0]],
          "mesh_faces_data": [[0, 1, 0]],
          "camera_translation": [0.1, 0.2, 4.5],
          "joint_angles_3d": {"left_knee": 35.5, "right_knee": null},
          "processing_time_ms": 412.6
        }
        """;

    PoseObservation pose = codec.parseResult(json.getBytes(StandardCharsets.UTF_8), 7);

    assertEquals(7, pose.frameNumber());
    assertEquals(2, pose.keypoints().size());
    assertEquals(0.2, pose.keypoints().get(0).z());
    assertEquals(0.7, pose.keypoints().get(1).confidence());
    assertEquals(0.8, pose.confidence(), 1e-9);
    assertTrue(pose.has3D());
    assertArrayEquals(new double[] {3, 4, 5}, pose.meshVertices().get(1));
    assertArrayEquals(new int[] {0, 1, 0}, pose.meshFaces().get(0));
    assertArrayEquals(new double[] {0.1, 0.2, 4.5}, pose.cameraTranslation());
    assertEquals(Map.of("left_knee", 35.5), pose.jointAngles());
    assertEquals(413L, pose.processingTimeMs());
    assertNull(pose.error());
  }

  @Test
  void arrayResponsePrefersRequestedFrame() throws IOException {
    String json = "[{\"frameNumber\":1,\"keypoints\":[]},{\"frameNumber\":2,\"keypoints\":[],\"meshVertices\":[]}]";

    PoseObservation pose = codec.parseResult(json.getBytes(StandardCharsets.UTF_8), 2);
    List<PoseObservation> all = codec.parseResults(json.getBytes(StandardCharsets.UTF_8));

    assertEquals(2, pose.frameNumber());
    assertNull(pose.meshVertices());
    assertEquals(2, all.size());
    assertEquals(1, codec.parseResult(json.getBytes(StandardCharsets.UTF_8), 9).frameNumber());
  }

  @Test
  void workerErrorIsCarriedOnTheObservation() throws IOException {
    byte[] json = "{\"frameNumber\":3,\"error\":\"no person detected\"}".getBytes(StandardCharsets.UTF_8);

    assertEquals("no person detected", codec.parseResult(json, 3).error());
  }

  @Test
  void emptyOrMalformedResponsesFail() {
    assertThrows(IOException.class, () -> codec.parseResult(new byte[0], 0));
    assertThrows(IOException.class, () -> codec.parseResult("[]".getBytes(StandardCharsets.UTF_8), 0));
    assertThrows(IOException.class, () -> codec.parseResult("{\"keypoints\":[]}".getBytes(StandardCharsets.UTF_8), 0));
    assertThrows(IOException.class, () -> codec.parseResult("not json".getBytes(StandardCharsets.UTF_8), 0));
  }

  private static Map<String, Object> firstFrame(byte[] document) throws IOException {
    Map<String, Object> root = JsonSupport.asObject(new JsonSupport().parse(document), "root");
    return JsonSupport.asObject(JsonSupport.asArray(root.get("frames"), "frames").get(0), "frame");
  }
}
