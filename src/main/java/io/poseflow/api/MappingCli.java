package io.poseflow.api;

import io.poseflow.domain.frame.FrameGap;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.infrastructure.json.FrameIndexMapCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a summary of a stored logical frame mapping.
 *
 * @since POSEFLOW 0.1
 */
public final class MappingCli {
  private static final Logger log = LoggerFactory.getLogger(MappingCli.class);
  private static final String SUMMARY_USAGE = "usage: mapping in=PATH";

  private MappingCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    Path in;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String raw = kv.get("in");
      if (raw == null) {
        throw new IllegalArgumentException("in is required");
      }
      in = Path.of(raw);
      if (!Files.isRegularFile(in)) {
        throw new IllegalArgumentException("mapping file does not exist: " + in);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    FrameIndexMap mapping;
    try {
      mapping = new FrameIndexMapCodec().read(in);
    } catch (IOException ex) {
      log.error("Unable to read mapping {}: {}", in, ex.getMessage());
      return ExitCode.IO_ERROR;
    }
    CliPrinter.printf("frames=%d direct=%d interpolated=%d unavailable=%d",
        mapping.length(), mapping.directCount(), mapping.interpolatedCount(), mapping.unavailableCount());
    for (FrameGap gap : mapping.gaps()) {
      CliPrinter.printf("gap %d..%d (%d frames) %s", gap.startIndex(), gap.endIndex(), gap.length(),
          gap.interpolated() ? "interpolated" : "unavailable");
    }
    return ExitCode.SUCCESS;
  }
}
