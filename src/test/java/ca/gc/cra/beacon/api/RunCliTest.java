package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsPlanWithoutConnecting() {
    Path state = tempDir.resolve("state");

    ExitCode code = RunCli.run(new String[] {
        "--dry-run", "stateDir=" + state, "channels=BARORA_CD,barora_cd", "serverUrl=ws://feed.example:2222/ws"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.startsWith("Run dry-run: no connection will be opened."));
    assertTrue(out.contains("serverUrl=ws://feed.example:2222/ws"));
    assertTrue(out.contains("channels=[barora_cd]"));
    assertTrue(out.contains("Re-run without --dry-run to connect."));
    assertFalse(Files.exists(state));
  }

  @Test
  void yamlValuesFeedTheDryRun() throws IOException {
    Path yaml = tempDir.resolve("beacon.yaml");
    Files.writeString(yaml, "run:\n  channels:\n    - lodna_vd\n  workers: 3\n");

    ExitCode code = RunCli.run(new String[] {"--dry-run", "config=" + yaml, "stateDir=" + tempDir});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("channels=[lodna_vd]"));
  }

  @Test
  void outOfRangeValueIsInvalidArgs() {
    ExitCode code = RunCli.run(new String[] {"--dry-run", "ackBatchSize=0", "stateDir=" + tempDir});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: run"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("ackBatchSize")));
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = RunCli.run(new String[] {"--dry-run", "config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("config file not found")));
  }

  @Test
  void bareArgumentIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {"barora_cd"}));
    assertTrue(buffer.toString().contains("usage: run"));
  }
}
