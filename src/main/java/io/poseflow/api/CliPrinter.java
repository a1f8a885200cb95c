package io.poseflow.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text and analysis reports.
 *
 * <p>Writes to the stdout file descriptor directly so reports stay separate from log output, which
 * goes to stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a formatted line.
   *
   * @param format {@link String#format} pattern
   * @param args pattern arguments
   */
  public static void printf(String format, Object... args) {
    PrintWriter writer = writer();
    writer.printf(format, args);
    writer.println();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
