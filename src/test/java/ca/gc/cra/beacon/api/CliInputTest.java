package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesSettingsFromSwitches() {
    CliInput input = CliInput.parse(
        new String[] {"serverUrl=ws://feed:2222/ws", "--DRY-RUN", " channels=barora_cd ", "-v"});

    assertArrayEquals(new String[] {"serverUrl=ws://feed:2222/ws", "channels=barora_cd"}, input.settingArgs());
    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.unrecognizedFlags().isEmpty());
  }

  @Test
  void aliasesMapToOneSwitch() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-H"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).has(CliInput.Switch.VERBOSE));
    assertEquals("--dry-run", CliInput.Switch.DRY_RUN.flag());
  }

  @Test
  void unknownFlagsAreReportedNotTreatedAsSettings() {
    CliInput input = CliInput.parse(new String[] {"--Replay", "--replay", "-x", "--mode=fast"});

    assertEquals(Set.of("--replay", "-x"), input.unrecognizedFlags());
    assertEquals(List.of("--mode=fast"), List.of(input.settingArgs()));
  }

  @Test
  void nullAndBlankArgumentsAreSkipped() {
    CliInput empty = CliInput.parse(null);
    assertEquals(0, empty.settingArgs().length);
    assertFalse(empty.verbose());

    CliInput sparse = CliInput.parse(new String[] {null, "  ", "workers=2"});
    assertArrayEquals(new String[] {"workers=2"}, sparse.settingArgs());
  }

  @Test
  void settingArgsReturnsACopy() {
    CliInput input = CliInput.parse(new String[] {"workers=2"});
    input.settingArgs()[0] = "workers=9";
    assertEquals("workers=2", input.settingArgs()[0]);
  }
}
