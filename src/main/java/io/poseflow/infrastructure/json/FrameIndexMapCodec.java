package io.poseflow.infrastructure.json;

import com.fasterxml.jackson.core.JsonGenerator;
import io.poseflow.domain.frame.FrameGap;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.frame.InterpolationRecipe;
import io.poseflow.domain.frame.LogicalFrameEntry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> JSON form of a {@link FrameIndexMap} for storage next to the raw frames.
 * <p><strong>Why:</strong> Playback services load the mapping instead of re-running classification.</p>
 * <p>Document shape:</p>
 * <pre>{@code
 * {"version":1,"length":N,
 *  "entries":[{"index":0,"kind":"direct","source":0},
 *             {"index":1,"kind":"interpolated","left":0,"right":2,"weight":0.5},
 *             {"index":5,"kind":"unavailable"}],
 *  "gaps":[{"start":1,"end":1,"leftBound":0,"rightBound":2,"resolution":"interpolated"}]}
 * }</pre>
 *
 * @since POSEFLOW 0.1
 */
public final class FrameIndexMapCodec {
  static final int VERSION = 1;

  private final JsonSupport json = new JsonSupport();

  /**
   * Serializes a mapping.
   *
   * @param mapping mapping to write
   * @return UTF-8 JSON
   * @throws IOException if generation fails
   */
  public byte[] toJson(FrameIndexMap mapping) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(64 + mapping.length() * 48);
    write(mapping, out);
    return out.toByteArray();
  }

  /**
   * Writes a mapping to a file, replacing it.
   *
   * @param mapping mapping to write
   * @param target destination file
   * @throws IOException if writing fails
   */
  public void write(FrameIndexMap mapping, Path target) throws IOException {
    Objects.requireNonNull(target, "target");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(target)) {
      write(mapping, out);
    }
  }

  /**
   * Writes a mapping to a stream; the stream is left open.
   *
   * @param mapping mapping to write
   * @param out destination
   * @throws IOException if writing fails
   */
  public void write(FrameIndexMap mapping, OutputStream out) throws IOException {
    Objects.requireNonNull(mapping, "mapping");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.writeStartObject();
      gen.writeNumberField("version", VERSION);
      gen.writeNumberField("length", mapping.length());
      gen.writeArrayFieldStart("entries");
      for (LogicalFrameEntry entry : mapping.entries()) {
        gen.writeStartObject();
        gen.writeNumberField("index", entry.index());
        gen.writeStringField("kind", label(entry.kind()));
        switch (entry.kind()) {
          case DIRECT -> gen.writeNumberField("source", entry.sourceIndex());
          case INTERPOLATED -> {
            gen.writeNumberField("left", entry.recipe().leftSourceIndex());
            gen.writeNumberField("right", entry.recipe().rightSourceIndex());
            gen.writeNumberField("weight", entry.recipe().weight());
          }
          case UNAVAILABLE -> { }
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("gaps");
      for (FrameGap gap : mapping.gaps()) {
        gen.writeStartObject();
        gen.writeNumberField("start", gap.startIndex());
        gen.writeNumberField("end", gap.endIndex());
        gen.writeNumberField("leftBound", gap.leftBound());
        gen.writeNumberField("rightBound", gap.rightBound());
        gen.writeStringField("resolution", label(gap.resolution()));
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  /**
   * Reads a mapping written by {@link #write(FrameIndexMap, OutputStream)}.
   *
   * @param document UTF-8 JSON
   * @return mapping
   * @throws IOException if the document is malformed or describes an invalid mapping
   */
  public FrameIndexMap read(byte[] document) throws IOException {
    Map<String, Object> root = JsonSupport.asObject(json.parse(document), "frame index map");
    Object version = root.get("version");
    if (version != null && JsonSupport.asInt(version, "version") != VERSION) {
      throw new IOException("unsupported frame index map version " + version);
    }
    List<Object> rawEntries = JsonSupport.asArray(root.get("entries"), "entries");
    List<Object> rawGaps = JsonSupport.asArray(root.get("gaps"), "gaps");
    try {
      List<LogicalFrameEntry> entries = new ArrayList<>(rawEntries.size());
      for (int i = 0; i < rawEntries.size(); i++) {
        entries.add(readEntry(JsonSupport.asObject(rawEntries.get(i), "entries[" + i + "]")));
      }
      List<FrameGap> gaps = new ArrayList<>(rawGaps.size());
      for (int i = 0; i < rawGaps.size(); i++) {
        gaps.add(readGap(JsonSupport.asObject(rawGaps.get(i), "gaps[" + i + "]")));
      }
      Object length = root.get("length");
      if (length != null && JsonSupport.asInt(length, "length") != entries.size()) {
        throw new IOException("length " + length + " does not match " + entries.size() + " entries");
      }
      return new FrameIndexMap(entries, gaps);
    } catch (IllegalArgumentException ex) {
      throw new IOException("invalid frame index map: " + ex.getMessage(), ex);
    }
  }

  /**
   * Reads a mapping from a file.
   *
   * @param source file written by {@link #write(FrameIndexMap, Path)}
   * @return mapping
   * @throws IOException if the file cannot be read or is malformed
   */
  public FrameIndexMap read(Path source) throws IOException {
    return read(Files.readAllBytes(source));
  }

  private static LogicalFrameEntry readEntry(Map<String, Object> object) throws IOException {
    int index = JsonSupport.asInt(object.get("index"), "index");
    LogicalFrameEntry.Kind kind = kind(object.get("kind"));
    return switch (kind) {
      case DIRECT -> {
        int source = JsonSupport.asInt(object.get("source"), "source");
        yield new LogicalFrameEntry(index, LogicalFrameEntry.Kind.DIRECT, source, null);
      }
      case INTERPOLATED -> LogicalFrameEntry.interpolated(index, new InterpolationRecipe(
          JsonSupport.asInt(object.get("left"), "left"),
          JsonSupport.asInt(object.get("right"), "right"),
          JsonSupport.asDouble(object.get("weight"), "weight")));
      case UNAVAILABLE -> LogicalFrameEntry.unavailable(index);
    };
  }

  private static FrameGap readGap(Map<String, Object> object) throws IOException {
    return new FrameGap(
        JsonSupport.asInt(object.get("start"), "start"),
        JsonSupport.asInt(object.get("end"), "end"),
        JsonSupport.asInt(object.get("leftBound"), "leftBound"),
        JsonSupport.asInt(object.get("rightBound"), "rightBound"),
        kind(object.get("resolution")));
  }

  private static LogicalFrameEntry.Kind kind(Object raw) throws IOException {
    if (!(raw instanceof String text)) {
      throw new IOException("kind must be a string but was " + raw);
    }
    try {
      return LogicalFrameEntry.Kind.valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IOException("unknown frame kind '" + text + "'", ex);
    }
  }

  private static String label(LogicalFrameEntry.Kind kind) {
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
