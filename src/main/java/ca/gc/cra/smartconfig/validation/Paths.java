package ca.gc.cra.smartconfig.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and settings flows.
 * <p><strong>Role:</strong> Support utilities executed before documents are read or the history store is opened.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject paths with null bytes or control characters.</li>
 *   <li>Require input documents to be readable regular files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user-supplied path string.
   *
   * @param name logical parameter name for diagnostics
   * @param raw path text
   * @return parsed path, normalized
   * @throws IllegalArgumentException when the text is blank or contains control characters
   */
  public static Path parse(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    if (text.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(text).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that {@code path} names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return the same path
   * @throws IllegalArgumentException when the file is missing, a directory or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(name + " does not exist: " + path);
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " is not readable: " + path);
    }
    return path;
  }
}
