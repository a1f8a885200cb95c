package io.poseflow.infrastructure.json;

import com.fasterxml.jackson.core.JsonGenerator;
import io.poseflow.domain.frame.MaterializedFrame;
import io.poseflow.domain.pose.Keypoint;
import io.poseflow.domain.pose.PoseObservation;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Streams playback frames as JSON Lines, one object per logical frame.
 *
 * <p>Unavailable frames are written as {@code {"index":i,"kind":"unavailable"}} with no pose, so readers
 * never mistake a hole for a zeroed skeleton. Mesh geometry is omitted; only keypoints, joint angles, and
 * the camera translation are written.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class MaterializedFrameWriter implements Closeable {
  private final JsonGenerator gen;

  /**
   * Creates a writer over {@code out}; closing the writer closes the stream.
   *
   * @param out destination stream
   * @throws IOException if the generator cannot be created
   */
  public MaterializedFrameWriter(OutputStream out) throws IOException {
    this.gen = new JsonSupport().factory().createGenerator(Objects.requireNonNull(out, "out"));
    this.gen.setRootValueSeparator(null);
  }

  /**
   * Appends one frame.
   *
   * @param frame frame to write
   * @throws IOException if writing fails
   */
  public void write(MaterializedFrame frame) throws IOException {
    Objects.requireNonNull(frame, "frame");
    gen.writeStartObject();
    gen.writeNumberField("index", frame.logicalIndex());
    gen.writeStringField("kind", frame.kind().name().toLowerCase(Locale.ROOT));
    if (frame.recipe() != null) {
      gen.writeNumberField("left", frame.recipe().leftSourceIndex());
      gen.writeNumberField("right", frame.recipe().rightSourceIndex());
      gen.writeNumberField("weight", frame.recipe().weight());
    }
    PoseObservation pose = frame.observation();
    if (pose != null) {
      gen.writeNumberField("confidence", pose.confidence());
      gen.writeBooleanField("has3d", pose.has3D());
      gen.writeArrayFieldStart("keypoints");
      for (Keypoint keypoint : pose.keypoints()) {
        gen.writeStartObject();
        if (keypoint.name() != null) {
          gen.writeStringField("name", keypoint.name());
        }
        gen.writeNumberField("x", keypoint.x());
        gen.writeNumberField("y", keypoint.y());
        if (keypoint.hasDepth()) {
          gen.writeNumberField("z", keypoint.z());
        }
        gen.writeNumberField("confidence", keypoint.confidence());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      if (pose.jointAngles() != null) {
        gen.writeObjectFieldStart("jointAngles3d");
        for (Map.Entry<String, Double> angle : pose.jointAngles().entrySet()) {
          gen.writeNumberField(angle.getKey(), angle.getValue());
        }
        gen.writeEndObject();
      }
      if (pose.cameraTranslation() != null) {
        gen.writeArrayFieldStart("cameraTranslation");
        for (double component : pose.cameraTranslation()) {
          gen.writeNumber(component);
        }
        gen.writeEndArray();
      }
    }
    gen.writeEndObject();
    gen.writeRaw('\n');
  }

  @Override
  public void close() throws IOException {
    gen.close();
  }
}
