package io.poseflow.api;

import io.poseflow.config.PipelineConfig;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates configuration and prints the effective settings without starting any worker.
 *
 * @since POSEFLOW 0.1
 */
public final class ConfigCheckCli {
  private static final Logger log = LoggerFactory.getLogger(ConfigCheckCli.class);
  private static final String SUMMARY_USAGE = "usage: config-check [config=PATH] [profile=NAME] [key=value...]";

  private ConfigCheckCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(
          new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs())), log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    PipelineConfig config;
    try {
      config = PipelineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    for (Map.Entry<String, String> entry : config.toMap().entrySet()) {
      CliPrinter.println(entry.getKey() + "=" + entry.getValue());
    }
    return ExitCode.SUCCESS;
  }
}
