package ca.gc.cra.beacon.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the BEACON state directory.
 * <p><strong>Why:</strong> Sync state, stored events, and the client id are rewritten continuously; the directory
 * must exist and be writable before the pipeline starts.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrency limited by underlying filesystem semantics.</p>
 *
 * @since BEACON 0.1
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Expands a leading {@code ~} to the user's home directory.
   *
   * @param raw raw path text
   * @return resolved path
   * @throws IllegalArgumentException if {@code raw} is blank or contains control characters
   */
  public static Path expandHome(String raw) {
    String sanitized = Strings.requireNonBlank("path", raw);
    if (sanitized.equals("~")) {
      return Path.of(System.getProperty("user.home", "."));
    }
    if (sanitized.startsWith("~/")) {
      return Path.of(System.getProperty("user.home", "."), sanitized.substring(2));
    }
    return Path.of(sanitized);
  }

  /**
   * Validates that {@code path} is (or can become) a writable state directory.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a directory, not writable, or creation fails
   */
  public static Path validateStateDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }
}
