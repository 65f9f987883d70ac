package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void flattensCommonAndModeSections() throws Exception {
    Path file = tempDir.resolve("beacon.yaml");
    Files.writeString(file, String.join("\n",
        "common:",
        "  stateDir: /data/beacon",
        "run:",
        "  serverUrl: wss://alerts/ws",
        "  channels:",
        "    - barora_cd",
        "    - lodna_vd",
        "  ackBatchSize: 25",
        "status:",
        "  stateDir: /ignored",
        ""));

    Map<String, String> run = YamlConfigLoader.load(file, "run").orElseThrow();
    assertEquals("/data/beacon", run.get("stateDir"));
    assertEquals("barora_cd,lodna_vd", run.get("channels"));
    assertEquals("25", run.get("ackBatchSize"));

    assertEquals("/ignored", YamlConfigLoader.load(file, "status").orElseThrow().get("stateDir"));
  }

  @Test
  void missingAndEmptyFiles() throws Exception {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "run").isPresent());
    Path empty = Files.writeString(tempDir.resolve("empty.yaml"), "");
    assertTrue(YamlConfigLoader.load(empty, "run").orElseThrow().isEmpty());
  }

  @Test
  void rejectsMalformedDocuments() throws Exception {
    Path scalar = Files.writeString(tempDir.resolve("scalar.yaml"), "just text\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "run"));

    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "run: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "run"));

    Path nested = Files.writeString(tempDir.resolve("nested.yaml"), "run:\n  channels:\n    - [a, b]\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nested, "run"));
  }

  @Test
  void bundledExampleParses() throws Exception {
    Path example = Path.of("src/main/resources/beacon.yaml");
    Map<String, String> run = YamlConfigLoader.load(example, "run").orElseThrow();
    assertEquals("barora_cd,barora_vd", run.get("channels"));
    FeedConfig config = FeedConfig.fromMap(run);
    assertEquals(2, config.channels().size());
  }
}
