package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.sync.ClientIdProvider;
import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.infrastructure.persistence.FileStateStore;
import ca.gc.cra.beacon.infrastructure.subscription.StateStoreSubscriptionRegistry;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatusCliTest {
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
  void emptyStateDirectoryReportsNothingStored() {
    assertEquals(ExitCode.SUCCESS, StatusCli.run(new String[] {"stateDir=" + stateDir}));

    String out = buffer.toString();
    assertTrue(out.contains("State directory : "));
    assertTrue(out.contains("Client id       : <none>"));
    assertTrue(out.contains("Subscriptions   : 0"));
    assertTrue(out.contains("Stored events   : 0"));
  }

  @Test
  void reportsStoredClientIdAndSubscriptions() throws IOException {
    FileStateStore store = new FileStateStore(stateDir);
    String clientId = new ClientIdProvider(store, () -> "ops-host").getOrCreate();
    StateStoreSubscriptionRegistry registry = new StateStoreSubscriptionRegistry(store);
    registry.subscribe(ChannelId.parse("barora_cd"));
    registry.setMuted("barora_cd", true);

    assertEquals(ExitCode.SUCCESS, StatusCli.run(new String[] {"stateDir=" + stateDir}));

    String out = buffer.toString();
    assertTrue(out.contains("Client id       : " + clientId));
    assertTrue(out.contains("Subscriptions   : 1"));
    assertTrue(out.contains("  barora_cd  Barora - Crowd Detection muted"));
  }

  @Test
  void bareArgumentPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, StatusCli.run(new String[] {"everything"}));
    assertTrue(buffer.toString().contains("usage: status"));
  }
}
