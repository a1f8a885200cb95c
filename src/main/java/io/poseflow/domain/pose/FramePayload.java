package io.poseflow.domain.pose;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Image data handed to a pose worker: either the encoded image bytes or a path the worker can read.
 *
 * <p>Exactly one of the two forms is present. Instances are immutable; byte content is copied on
 * construction and on access.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class FramePayload {
  private final byte[] imageBytes;
  private final Path imagePath;

  private FramePayload(byte[] imageBytes, Path imagePath) {
    this.imageBytes = imageBytes;
    this.imagePath = imagePath;
  }

  /**
   * Wraps encoded image bytes.
   *
   * @param imageBytes encoded image (JPEG, PNG); must not be {@code null}
   * @return payload carrying a copy of the bytes
   */
  public static FramePayload ofBytes(byte[] imageBytes) {
    return new FramePayload(Objects.requireNonNull(imageBytes, "imageBytes").clone(), null);
  }

  /**
   * References an image file the worker reads itself.
   *
   * @param imagePath path to the image; must not be {@code null}
   * @return payload referencing the path
   */
  public static FramePayload ofPath(Path imagePath) {
    return new FramePayload(null, Objects.requireNonNull(imagePath, "imagePath"));
  }

  /**
   * Returns a copy of the image bytes when the payload carries them.
   *
   * @return optional copy of the bytes
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Returns a fresh copy.")
  public Optional<byte[]> bytes() {
    return imageBytes == null ? Optional.empty() : Optional.of(imageBytes.clone());
  }

  /**
   * Returns the image path when the payload references a file.
   *
   * @return optional path
   */
  public Optional<Path> path() {
    return Optional.ofNullable(imagePath);
  }

  /**
   * Payload size in bytes; {@code -1} for path references.
   *
   * @return byte length or {@code -1}
   */
  public int byteLength() {
    return imageBytes == null ? -1 : imageBytes.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FramePayload other)) {
      return false;
    }
    return Arrays.equals(imageBytes, other.imageBytes) && Objects.equals(imagePath, other.imagePath);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(imageBytes) + Objects.hashCode(imagePath);
  }

  @Override
  public String toString() {
    return imagePath != null
        ? "FramePayload{path=" + imagePath + '}'
        : "FramePayload{bytes=" + imageBytes.length + '}';
  }
}
