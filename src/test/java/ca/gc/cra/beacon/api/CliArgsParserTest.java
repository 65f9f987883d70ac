package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map =
        CliArgsParser.toMap(new String[] {"serverUrl=ws://feed:2222/ws", " channels=barora_cd,lodna_vd "});
    assertEquals(List.of("serverUrl", "channels"), List.copyOf(map.keySet()));
    assertEquals("ws://feed:2222/ws", map.get("serverUrl"));
    assertEquals("barora_cd,lodna_vd", map.get("channels"));
  }

  @Test
  void laterDuplicatesWinAndBlanksAreSkipped() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"workers=2", "", "workers=6", null});
    assertEquals(Map.of("workers", "6"), map);
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsBareTokens() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"barora_cd"}));
    assertTrue(ex.getMessage().contains("key=value"));
  }

  @Test
  void rejectsMalformedKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=yes"}));
  }

  @Test
  void rejectsOverlongValues() {
    String value = "x".repeat(4_097);
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"stateDir=" + value}));
  }
}
