package io.poseflow.api;

import io.poseflow.application.cache.CacheStatistics;
import io.poseflow.application.cache.FrameCache;
import io.poseflow.application.dispatch.DispatchErrorKind;
import io.poseflow.application.pipeline.AnalyzedSequence;
import io.poseflow.application.pipeline.ExtractionResult;
import io.poseflow.application.pipeline.PoseExtractionUseCase;
import io.poseflow.application.pipeline.SequenceStatistics;
import io.poseflow.application.port.FrameDispatcher;
import io.poseflow.application.port.MetricsPort;
import io.poseflow.application.port.PoseWorker;
import io.poseflow.config.CompositionRoot;
import io.poseflow.config.PipelineConfig;
import io.poseflow.domain.frame.FrameGap;
import io.poseflow.domain.pose.FramePayload;
import io.poseflow.infrastructure.json.FrameIndexMapCodec;
import io.poseflow.infrastructure.json.MaterializedFrameWriter;
import io.poseflow.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full analysis over a directory of extracted video frames.
 *
 * <p>Frames are the image files in {@code frames=DIR}, ordered by file name; file {@code i} becomes frame
 * number {@code i}.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "webp");
  private static final int MAX_GAPS_PRINTED = 20;
  private static final String SUMMARY_USAGE =
      "usage: analyze frames=DIR [config=PATH] [profile=NAME] [mappingOut=PATH] [framesOut=PATH] "
          + "[--sequential] [metricsExporter=otlp|none] [key=value...]";
  private static final String HELP_TEXT = """
      POSEFLOW analyze

      Usage:
        analyze frames=./frames [options]

      Required:
        frames=DIR                 Directory of frame images (jpg, png, ...), ordered by file name

      Optional:
        config=PATH                YAML configuration file
        profile=NAME               YAML profile layered over 'common' (default 'default')
        mappingOut=PATH            Write the logical frame mapping as JSON
        framesOut=PATH             Write every playback frame as JSON Lines
        --sequential               Dispatch one frame at a time instead of concurrently
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        <section>.<key>=VALUE      Any pipeline setting, e.g. dispatch.maxConcurrentWorkers=4
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private AnalyzeCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> effective;
    Path framesDir;
    Path mappingOut;
    Path framesOut;
    boolean sequential;
    MetricsPort metrics;
    PipelineConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String framesRaw = kv.remove("frames");
      String mappingRaw = kv.remove("mappingOut");
      String framesOutRaw = kv.remove("framesOut");
      if (framesRaw == null) {
        throw new IllegalArgumentException("frames is required");
      }
      framesDir = Path.of(framesRaw);
      if (!Files.isDirectory(framesDir)) {
        throw new IllegalArgumentException("frames directory does not exist: " + framesDir);
      }
      mappingOut = mappingRaw == null ? null : Path.of(mappingRaw);
      framesOut = framesOutRaw == null ? null : Path.of(framesOutRaw);
      effective = ConfigCliUtils.effectiveConfig(kv, log);
      sequential = input.hasFlag("--sequential") || ConfigCliUtils.parseBoolean(effective, "sequential", false);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }
    try {
      config = PipelineConfig.fromMap(effective);
      metrics = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    List<FramePayload> frames;
    try {
      frames = listFrames(framesDir);
    } catch (IOException ex) {
      log.error("Unable to list frames in {}", framesDir, ex);
      return ExitCode.IO_ERROR;
    }
    if (frames.isEmpty()) {
      log.error("No frame images found in {}", framesDir);
      return ExitCode.INVALID_ARGS;
    }

    try {
      return analyze(new CompositionRoot(config, metrics), frames, sequential, mappingOut, framesOut);
    } finally {
      if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
        otel.close();
      }
    }
  }

  private static ExitCode analyze(
      CompositionRoot root, List<FramePayload> frames, boolean sequential, Path mappingOut, Path framesOut) {
    PoseWorker worker = root.poseWorker();
    log.info("Analyzing {} frames with {} ({} dispatch)",
        frames.size(), worker.describe(), sequential ? "sequential" : "concurrent");
    FrameDispatcher primary = sequential ? root.sequentialDispatcher(worker) : root.dispatchScheduler(worker);
    FrameDispatcher fallback = sequential ? null : root.sequentialDispatcher(worker);
    try (primary;
         fallback;
         PoseExtractionUseCase extraction = root.poseExtractionUseCase(primary, fallback)) {
      ExtractionResult extracted = extraction.extract(frames).get();
      AnalyzedSequence analyzed = root.frameSequenceUseCase().prepare(extracted.sequence());
      if (mappingOut != null) {
        new FrameIndexMapCodec().write(analyzed.mapping(), mappingOut);
        log.info("Wrote frame mapping to {}", mappingOut);
      }
      if (framesOut != null) {
        writeFrames(analyzed.cache(), analyzed.mapping().length(), framesOut);
        log.info("Wrote {} playback frames to {}", analyzed.mapping().length(), framesOut);
      }
      printReport(extracted, analyzed);
      SequenceStatistics stats = analyzed.statistics();
      return stats.direct() + stats.interpolated() == 0 ? ExitCode.NO_USABLE_FRAMES : ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analysis interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException ex) {
      log.error("Pose extraction failed", ex.getCause() == null ? ex : ex.getCause());
      return ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Unable to write analysis output", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during analysis", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<FramePayload> listFrames(Path dir) throws IOException {
    List<Path> images;
    try (Stream<Path> entries = Files.list(dir)) {
      images = entries
          .filter(Files::isRegularFile)
          .filter(AnalyzeCli::isImage)
          .sorted()
          .toList();
    }
    List<FramePayload> payloads = new ArrayList<>(images.size());
    for (Path image : images) {
      payloads.add(FramePayload.ofPath(image.toAbsolutePath()));
    }
    return payloads;
  }

  private static boolean isImage(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  private static void writeFrames(FrameCache cache, int length, Path target) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(target);
         MaterializedFrameWriter writer = new MaterializedFrameWriter(out)) {
      for (int i = 0; i < length; i++) {
        writer.write(cache.getFrame(i));
      }
    }
  }

  private static void printReport(ExtractionResult extracted, AnalyzedSequence analyzed) {
    SequenceStatistics stats = analyzed.statistics();
    CliPrinter.printf("frames            %d", stats.totalFrames());
    CliPrinter.printf("extracted         %d (failed %d, fallback %d)",
        extracted.succeeded(), extracted.failures().size(), extracted.fallbackDispatched());
    for (Map.Entry<DispatchErrorKind, Integer> failure : extracted.failureCounts().entrySet()) {
      CliPrinter.printf("  %-16s%d", failure.getKey().metricSuffix(), failure.getValue());
    }
    CliPrinter.printf("accepted          %d", stats.accepted());
    CliPrinter.printf("rejected          low-confidence=%d off-screen=%d outlier=%d absent=%d",
        stats.rejectedLowConfidence(), stats.rejectedOffScreen(), stats.rejectedOutlier(), stats.absent());
    CliPrinter.printf("playback          direct=%d interpolated=%d unavailable=%d (coverage %.1f%%)",
        stats.direct(), stats.interpolated(), stats.unavailable(), stats.coverage() * 100d);
    List<FrameGap> gaps = analyzed.mapping().gaps();
    for (int i = 0; i < Math.min(gaps.size(), MAX_GAPS_PRINTED); i++) {
      FrameGap gap = gaps.get(i);
      CliPrinter.printf("  gap %d..%d (%d frames) %s", gap.startIndex(), gap.endIndex(), gap.length(),
          gap.interpolated() ? "interpolated" : "unavailable");
    }
    if (gaps.size() > MAX_GAPS_PRINTED) {
      CliPrinter.printf("  ... %d more gaps", gaps.size() - MAX_GAPS_PRINTED);
    }
    CacheStatistics cache = analyzed.cache().statistics();
    CliPrinter.printf("cache             size=%d/%d materializations=%d evictions=%d",
        cache.size(), cache.capacity(), cache.materializations(), cache.evictions());
  }
}
