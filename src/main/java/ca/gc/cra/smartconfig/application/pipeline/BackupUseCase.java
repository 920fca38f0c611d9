package ca.gc.cra.smartconfig.application.pipeline;

import ca.gc.cra.smartconfig.application.port.ClockPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies a configuration file to {@code <backupDir>/<stem>_<yyyyMMdd_HHmmss><ext>}. A relative backup
 * directory is resolved against the source file's directory.
 *
 * @since 0.1.0
 */
public final class BackupUseCase {
  private static final Logger log = LoggerFactory.getLogger(BackupUseCase.class);
  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final ClockPort clock;
  private final ZoneId zone;

  public BackupUseCase(ClockPort clock) {
    this(clock, ZoneId.systemDefault());
  }

  public BackupUseCase(ClockPort clock, ZoneId zone) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Creates the backup copy, keeping file attributes.
   *
   * @param source file to copy
   * @param backupDir target directory, created when missing
   * @return path of the copy
   * @throws IOException when the copy fails or a backup with the same name already exists
   */
  public Path backup(Path source, Path backupDir) throws IOException {
    if (!Files.isRegularFile(source)) {
      throw new IOException("Not a regular file: " + source);
    }
    Path parent = source.toAbsolutePath().getParent();
    Path dir = backupDir.isAbsolute() || parent == null ? backupDir : parent.resolve(backupDir);
    Files.createDirectories(dir);

    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String ext = dot > 0 ? name.substring(dot) : "";
    String stamp = STAMP.format(clock.now().atZone(zone));
    Path target = dir.resolve(stem + "_" + stamp + ext);

    Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
    log.info("Backed up {} to {}", source, target);
    return target;
  }
}
