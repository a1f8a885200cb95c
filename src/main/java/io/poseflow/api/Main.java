package io.poseflow.api;

import io.poseflow.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POSEFLOW command dispatcher.
 *
 * @since POSEFLOW 0.1
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: poseflow <analyze|config-check|mapping> [options]";
  private static final String HELP_TEXT = """
      POSEFLOW command dispatcher

      Usage:
        poseflow <command> [options]

      Commands:
        analyze       Extract poses from frame images and build the playback mapping
        config-check  Validate configuration and print effective settings
        mapping       Summarize a stored frame mapping

      Global flags:
        --help        Show this message
        --verbose     Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(remainder, 1, remainder.length);
    if (input.help()) {
      delegateArgs = append(delegateArgs, "--help");
    }
    return switch (command) {
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "config-check" -> ConfigCheckCli.run(delegateArgs);
      case "mapping" -> MappingCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] append(String[] args, String extra) {
    String[] copy = Arrays.copyOf(args, args.length + 1);
    copy[args.length] = extra;
    return copy;
  }
}
