package ca.gc.cra.beacon.infrastructure.persistence;

import ca.gc.cra.beacon.application.port.StateStorePort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StateStorePort} storing each key as {@code <dir>/<key>.json}.
 *
 * <p>Writes go to a temporary file in the same directory and are moved over the target, atomically where the file
 * system supports it, so a crash mid-write leaves the previous document intact.</p>
 *
 * @since BEACON 0.1
 */
public final class FileStateStore implements StateStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);
  private static final Pattern KEY_PATTERN = Pattern.compile("[a-z0-9_]{1,64}");

  private final Path directory;

  /**
   * Creates a store rooted at {@code directory}; the directory must exist.
   *
   * @param directory state directory
   */
  public FileStateStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public Optional<String> read(String key) throws IOException {
    try {
      return Optional.of(Files.readString(fileFor(key), StandardCharsets.UTF_8));
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
  }

  @Override
  public void write(String key, String document) throws IOException {
    Objects.requireNonNull(document, "document");
    Path target = fileFor(key);
    Path temp = Files.createTempFile(directory, key + '-', ".tmp");
    try {
      Files.writeString(temp, document, StandardCharsets.UTF_8);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported in {}; replacing {} non-atomically", directory, target.getFileName());
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public void delete(String key) throws IOException {
    Files.deleteIfExists(fileFor(key));
  }

  public Path directory() {
    return directory;
  }

  private Path fileFor(String key) {
    Objects.requireNonNull(key, "key");
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid state key: " + key);
    }
    return directory.resolve(key + ".json");
  }
}
