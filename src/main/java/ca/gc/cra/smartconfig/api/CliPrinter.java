package ca.gc.cra.smartconfig.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.function.Function;

/**
 * Stdout channel for command results.
 *
 * <p>Writes to the native stdout descriptor so a document printed by {@code load} or {@code rollback} can be
 * piped into a file without log lines mixed in; logging goes to stderr. Tests swap the writer to capture
 * output.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints one line per item, such as validation errors or diff entries.
   *
   * @param items items in output order
   * @param render line for one item
   * @param <T> item type
   */
  public static <T> void printEach(Collection<? extends T> items, Function<? super T, String> render) {
    PrintWriter writer = writer();
    for (T item : items) {
      writer.println(render.apply(item));
    }
  }

  /**
   * Prints rendered document text as-is and flushes.
   *
   * @param text document text, normally ending with a newline
   */
  public static void printDocument(String text) {
    PrintWriter writer = writer();
    writer.print(text);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
