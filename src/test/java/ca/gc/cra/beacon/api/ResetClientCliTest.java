package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.sync.ClientIdProvider;
import ca.gc.cra.beacon.infrastructure.persistence.FileStateStore;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResetClientCliTest {
  @TempDir Path stateDir;

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
  void removesStoredClientId() throws IOException {
    ClientIdProvider ids = new ClientIdProvider(new FileStateStore(stateDir), () -> "ops-host");
    String clientId = ids.getOrCreate();

    assertEquals(ExitCode.SUCCESS, ResetClientCli.run(new String[] {"stateDir=" + stateDir}));

    assertTrue(buffer.toString().contains("Client id " + clientId + " removed"));
    assertFalse(ids.exists());
  }

  @Test
  void reportsWhenNothingIsStored() {
    assertEquals(ExitCode.SUCCESS, ResetClientCli.run(new String[] {"stateDir=" + stateDir}));
    assertTrue(buffer.toString().contains("No client id stored under"));
  }
}
