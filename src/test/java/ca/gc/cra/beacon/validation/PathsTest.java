package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void expandsHomePrefix() {
    Path home = Path.of(System.getProperty("user.home", "."));
    assertEquals(home, Paths.expandHome("~"));
    assertEquals(home.resolve(".beacon/state"), Paths.expandHome("~/.beacon/state"));
    assertEquals(Path.of("/var/lib/beacon"), Paths.expandHome("/var/lib/beacon"));
  }

  @Test
  void createsMissingStateDirectoryOnRequest() {
    Path target = tempDir.resolve("nested/state");

    Path unchecked = Paths.validateStateDir(target, false);
    assertFalse(Files.exists(unchecked));

    Path created = Paths.validateStateDir(target, true);
    assertTrue(Files.isDirectory(created));
  }

  @Test
  void rejectsRegularFile() throws Exception {
    Path file = Files.createFile(tempDir.resolve("state.json"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateStateDir(file, true));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateStateDir(null, true));
  }
}
