package ca.gc.cra.beacon.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileStateStoreTest {
  @TempDir Path tempDir;

  private FileStateStore store;

  @BeforeEach
  void setUp() {
    store = new FileStateStore(tempDir);
  }

  @Test
  void writeReplacesDocumentWithoutLeavingTempFiles() throws Exception {
    store.write("sync_state", "{\"v\":1}");
    store.write("sync_state", "{\"v\":2}");

    assertEquals("{\"v\":2}", store.read("sync_state").orElseThrow());
    assertEquals("{\"v\":2}", Files.readString(tempDir.resolve("sync_state.json"), StandardCharsets.UTF_8));
    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void missingKeyReadsEmptyAndDeletesQuietly() throws Exception {
    assertTrue(store.read("events").isEmpty());
    store.delete("events");

    store.write("events", "[]");
    store.delete("events");
    assertFalse(Files.exists(tempDir.resolve("events.json")));
  }

  @Test
  void rejectsKeysThatCouldEscapeDirectory() {
    assertThrows(IllegalArgumentException.class, () -> store.read("../etc/passwd"));
    assertThrows(IllegalArgumentException.class, () -> store.write("Events", "[]"));
    assertThrows(IllegalArgumentException.class, () -> store.delete(""));
  }
}
