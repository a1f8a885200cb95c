package io.poseflow.config;

import io.poseflow.validation.Numbers;
import io.poseflow.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Describes how pose workers are reached.
 * <p><strong>Role:</strong> Configuration record consumed by {@code CompositionRoot} when choosing between
 * {@code ProcessPoseWorker} and {@code HttpPoseWorker}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param mode transport
 * @param command process command line (program plus arguments) for {@link WorkerMode#PROCESS}
 * @param workingDirectory optional working directory for spawned processes
 * @param baseUrl pose service base URL for {@link WorkerMode#HTTP}
 * @param requestPath path appended to {@code baseUrl} for per-frame requests
 * @param connectTimeoutMs HTTP connect timeout in milliseconds
 * @since POSEFLOW 0.1
 */
public record WorkerConfig(
    WorkerMode mode,
    List<String> command,
    Optional<Path> workingDirectory,
    URI baseUrl,
    String requestPath,
    long connectTimeoutMs) {

  public static final List<String> DEFAULT_COMMAND = List.of("python", "app.py");
  public static final String DEFAULT_BASE_URL = "http://localhost:5000";
  public static final String DEFAULT_REQUEST_PATH = "/pose/hybrid";
  public static final long DEFAULT_CONNECT_TIMEOUT_MS = 5_000L;

  public WorkerConfig {
    mode = Objects.requireNonNullElse(mode, WorkerMode.PROCESS);
    command = List.copyOf(Objects.requireNonNull(command, "command"));
    if (command.isEmpty()) {
      throw new IllegalArgumentException("worker.command must not be empty");
    }
    workingDirectory = Objects.requireNonNullElse(workingDirectory, Optional.empty());
    Objects.requireNonNull(baseUrl, "baseUrl");
    if (baseUrl.getScheme() == null
        || !(baseUrl.getScheme().equals("http") || baseUrl.getScheme().equals("https"))) {
      throw new IllegalArgumentException("worker.baseUrl must be an http(s) URL (was " + baseUrl + ")");
    }
    requestPath = Strings.requireNonBlank("worker.requestPath", requestPath);
    if (!requestPath.startsWith("/")) {
      requestPath = "/" + requestPath;
    }
    Numbers.requireRange("worker.connectTimeoutMs", connectTimeoutMs, 1, 600_000);
  }

  public static WorkerConfig defaults() {
    return new WorkerConfig(
        WorkerMode.PROCESS,
        DEFAULT_COMMAND,
        Optional.empty(),
        URI.create(DEFAULT_BASE_URL),
        DEFAULT_REQUEST_PATH,
        DEFAULT_CONNECT_TIMEOUT_MS);
  }

  /**
   * Builds worker settings from flattened {@code worker.*} keys.
   *
   * <p>{@code worker.command} is split on whitespace.</p>
   *
   * @param options flattened configuration
   * @return validated worker settings
   * @throws IllegalArgumentException when a value is malformed
   */
  public static WorkerConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    WorkerMode mode = WorkerMode.fromString(options.get("worker.mode"));
    String commandRaw = Strings.trimToNull(options.get("worker.command"));
    List<String> command = commandRaw == null ? DEFAULT_COMMAND : Arrays.asList(commandRaw.split("\\s+"));
    Optional<Path> workingDirectory =
        Optional.ofNullable(Strings.trimToNull(options.get("worker.workingDirectory")))
            .map(WorkerConfig::parsePath);
    URI baseUrl = parseUri(ConfigValues.stringValue(options, "worker.baseUrl", DEFAULT_BASE_URL));
    String requestPath = ConfigValues.stringValue(options, "worker.requestPath", DEFAULT_REQUEST_PATH);
    long connectTimeoutMs =
        ConfigValues.longValue(options, "worker.connectTimeoutMs", DEFAULT_CONNECT_TIMEOUT_MS, 1, 600_000);
    return new WorkerConfig(mode, command, workingDirectory, baseUrl, requestPath, connectTimeoutMs);
  }

  /**
   * Full per-frame request URI.
   *
   * @return {@code baseUrl} joined with {@code requestPath}
   */
  public URI requestUri() {
    String base = baseUrl.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + requestPath);
  }

  private static Path parsePath(String raw) {
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("worker.workingDirectory is not a valid path: " + raw, ex);
    }
  }

  private static URI parseUri(String raw) {
    try {
      return new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("worker.baseUrl is not a valid URI: " + raw, ex);
    }
  }
}
