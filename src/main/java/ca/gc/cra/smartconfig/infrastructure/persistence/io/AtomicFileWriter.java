package ca.gc.cra.smartconfig.infrastructure.persistence.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a file atomically: the content is written to a temporary sibling, forced to disk, then renamed over
 * the target. Readers see either the old or the new file, never a partial one.
 */
public final class AtomicFileWriter {
  private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

  private AtomicFileWriter() {}

  /**
   * Writes {@code content} to {@code target}, creating parent directories when needed.
   *
   * @param target file to replace
   * @param content complete new content
   * @throws IOException when writing, syncing or renaming fails; the target is left untouched
   */
  public static void write(Path target, byte[] content) throws IOException {
    Path absolute = target.toAbsolutePath();
    Path dir = absolute.getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
    try {
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      try {
        Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; falling back to replace", absolute);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
