package io.poseflow.infrastructure.worker;

import com.fasterxml.jackson.core.JsonGenerator;
import io.poseflow.domain.pose.FramePayload;
import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.Keypoint;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.infrastructure.json.JsonSupport;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Wire codec between frame requests, worker JSON, and {@link PoseObservation}.
 * <p><strong>Why:</strong> Both worker transports speak JSON, with slightly different key spellings; one
 * tolerant parser keeps the adapters thin.</p>
 * <p><strong>Role:</strong> Infrastructure helper shared by {@link ProcessPoseWorker} and
 * {@link HttpPoseWorker}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared jackson factory; safe for concurrent
 * use.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class PoseJsonCodec {
  private final JsonSupport json = new JsonSupport();

  /**
   * Writes the process-worker stdin document
   * {@code {"frames":[{"frameNumber":n,"imageBase64":...}]}} (or {@code imagePath} for file payloads).
   *
   * @param request frame to describe
   * @param out destination; left open
   * @throws IOException if writing fails
   */
  public void writeProcessRequest(FrameRequest request, OutputStream out) throws IOException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.writeStartObject();
      gen.writeArrayFieldStart("frames");
      gen.writeStartObject();
      gen.writeNumberField("frameNumber", request.frameNumber());
      FramePayload payload = request.payload();
      Optional<byte[]> bytes = payload.bytes();
      if (bytes.isPresent()) {
        gen.writeStringField("imageBase64", Base64.getEncoder().encodeToString(bytes.get()));
      } else {
        gen.writeStringField("imagePath", payload.path().orElseThrow().toString());
      }
      gen.writeEndObject();
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  /**
   * Builds the HTTP request body {@code {"image_base64":...,"frame_number":n}}. File payloads are read and
   * encoded because the service cannot see the caller's filesystem.
   *
   * @param request frame to describe
   * @return UTF-8 JSON body
   * @throws IOException if a referenced image cannot be read
   */
  public byte[] httpRequestBody(FrameRequest request) throws IOException {
    Objects.requireNonNull(request, "request");
    FramePayload payload = request.payload();
    byte[] image = payload.bytes().isPresent() ? payload.bytes().get() : readImage(payload.path().orElseThrow());
    ByteArrayOutputStream out = new ByteArrayOutputStream(image.length * 4 / 3 + 64);
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("image_base64", Base64.getEncoder().encodeToString(image));
      gen.writeNumberField("frame_number", request.frameNumber());
      gen.writeEndObject();
    }
    return out.toByteArray();
  }

  /**
   * Parses a worker response that is either one result object or an array of them, and picks the result
   * for {@code expectedFrame}. When no element carries that frame number, the first element is returned
   * and the mismatch is left to the caller.
   *
   * @param body UTF-8 JSON response
   * @param expectedFrame frame number that was requested
   * @return parsed observation
   * @throws IOException if the body is empty, malformed, or has no results
   */
  public PoseObservation parseResult(byte[] body, int expectedFrame) throws IOException {
    List<PoseObservation> results = parseResults(body);
    if (results.isEmpty()) {
      throw new IOException("worker returned no results");
    }
    for (PoseObservation result : results) {
      if (result.frameNumber() == expectedFrame) {
        return result;
      }
    }
    return results.get(0);
  }

  /**
   * Parses every result in a worker response.
   *
   * @param body UTF-8 JSON response: one object or an array of objects
   * @return observations in response order
   * @throws IOException if the body is empty or malformed
   */
  public List<PoseObservation> parseResults(byte[] body) throws IOException {
    Objects.requireNonNull(body, "body");
    Object root = json.parse(body);
    if (root == null) {
      throw new IOException("worker returned an empty response");
    }
    if (root instanceof Map<?, ?>) {
      return List.of(toObservation(JsonSupport.asObject(root, "result")));
    }
    List<Object> elements = JsonSupport.asArray(root, "results");
    List<PoseObservation> observations = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      observations.add(toObservation(JsonSupport.asObject(elements.get(i), "results[" + i + "]")));
    }
    return observations;
  }

  private PoseObservation toObservation(Map<String, Object> object) throws IOException {
    Object frameValue = JsonSupport.field(object, "frameNumber", "frame_number");
    if (frameValue == null) {
      throw new IOException("result is missing frameNumber");
    }
    int frameNumber = JsonSupport.asInt(frameValue, "frameNumber");
    List<Keypoint> keypoints = readKeypoints(JsonSupport.field(object, "keypoints"));
    boolean has3D = Boolean.TRUE.equals(JsonSupport.field(object, "has3d", "has3D", "has_3d"));
    List<double[]> vertices = readVertices(JsonSupport.field(object, "mesh_vertices_data", "meshVertices"));
    List<int[]> faces = readFaces(JsonSupport.field(object, "mesh_faces_data", "meshFaces"));
    double[] camera = readVector(JsonSupport.field(object, "cameraTranslation", "camera_translation"));
    Map<String, Double> angles = readAngles(JsonSupport.field(object, "jointAngles3d", "joint_angles_3d"));
    Object timeValue = JsonSupport.field(object, "processingTimeMs", "processing_time_ms");
    long processingTimeMs = timeValue == null ? 0L : Math.round(JsonSupport.asDouble(timeValue, "processingTimeMs"));
    Object errorValue = JsonSupport.field(object, "error");
    String error = errorValue == null ? null : errorValue.toString();
    return new PoseObservation(
        frameNumber,
        keypoints,
        has3D,
        vertices,
        faces,
        camera,
        angles,
        PoseObservation.meanConfidence(keypoints),
        processingTimeMs,
        error);
  }

  private static List<Keypoint> readKeypoints(Object value) throws IOException {
    List<Object> elements = JsonSupport.asArray(value, "keypoints");
    List<Keypoint> keypoints = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      String where = "keypoints[" + i + "]";
      Map<String, Object> kp = JsonSupport.asObject(elements.get(i), where);
      Object name = kp.get("name");
      Object z = kp.get("z");
      Object confidence = JsonSupport.field(kp, "confidence", "score", "visibility");
      keypoints.add(new Keypoint(
          name == null ? null : name.toString(),
          JsonSupport.asDouble(kp.get("x"), where + ".x"),
          JsonSupport.asDouble(kp.get("y"), where + ".y"),
          z == null ? null : JsonSupport.asDouble(z, where + ".z"),
          confidence == null ? 0d : JsonSupport.asDouble(confidence, where + ".confidence")));
    }
    return keypoints;
  }

  private static List<double[]> readVertices(Object value) throws IOException {
    if (value == null) {
      return null;
    }
    List<Object> rows = JsonSupport.asArray(value, "mesh_vertices_data");
    if (rows.isEmpty()) {
      return null;
    }
    List<double[]> vertices = new ArrayList<>(rows.size());
    for (Object row : rows) {
      vertices.add(readVector(row));
    }
    return vertices;
  }

  private static List<int[]> readFaces(Object value) throws IOException {
    if (value == null) {
      return null;
    }
    List<Object> rows = JsonSupport.asArray(value, "mesh_faces_data");
    if (rows.isEmpty()) {
      return null;
    }
    List<int[]> faces = new ArrayList<>(rows.size());
    for (Object row : rows) {
      List<Object> indices = JsonSupport.asArray(row, "mesh face");
      int[] face = new int[indices.size()];
      for (int i = 0; i < face.length; i++) {
        face[i] = JsonSupport.asInt(indices.get(i), "mesh face index");
      }
      faces.add(face);
    }
    return faces;
  }

  private static double[] readVector(Object value) throws IOException {
    if (value == null) {
      return null;
    }
    List<Object> components = JsonSupport.asArray(value, "vector");
    double[] vector = new double[components.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = JsonSupport.asDouble(components.get(i), "vector component");
    }
    return vector;
  }

  private static Map<String, Double> readAngles(Object value) throws IOException {
    if (value == null) {
      return null;
    }
    Map<String, Object> raw = JsonSupport.asObject(value, "jointAngles3d");
    Map<String, Double> angles = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      if (entry.getValue() != null) {
        angles.put(entry.getKey(), JsonSupport.asDouble(entry.getValue(), "jointAngles3d." + entry.getKey()));
      }
    }
    return angles;
  }

  private static byte[] readImage(Path path) throws IOException {
    return Files.readAllBytes(path);
  }
}
