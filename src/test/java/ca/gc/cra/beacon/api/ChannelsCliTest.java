package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.event.ChannelCatalog;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChannelsCliTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void listsEveryChannelWithoutFilter() {
    List<String> lines = ChannelsCli.render("");
    assertEquals(ChannelCatalog.areas().size() * ChannelCatalog.eventTypes().size(), lines.size());
  }

  @Test
  void areaFilterKeepsOnlyThatArea() {
    assertEquals(ExitCode.SUCCESS, ChannelsCli.run(new String[] {"area=barora"}));

    String out = buffer.toString();
    assertTrue(out.contains("barora_cd"));
    assertTrue(out.contains("Barora - Crowd Detection"));
    assertFalse(out.contains("lodna_"));
    assertEquals(ChannelCatalog.eventTypes().size(), ChannelsCli.render("barora").size());
  }

  @Test
  void unknownAreaIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ChannelsCli.run(new String[] {"area=atlantis"}));
    assertEquals("", buffer.toString());
  }

  @Test
  void bareArgumentPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, ChannelsCli.run(new String[] {"barora"}));
    assertTrue(buffer.toString().contains("usage: channels"));
  }
}
