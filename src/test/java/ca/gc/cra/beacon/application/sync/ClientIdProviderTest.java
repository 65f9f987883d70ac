package ca.gc.cra.beacon.application.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.testing.InMemoryStateStore;
import org.junit.jupiter.api.Test;

class ClientIdProviderTest {

  @Test
  void createsIdOnceAndReusesIt() throws Exception {
    InMemoryStateStore store = new InMemoryStateStore();
    ClientIdProvider provider = new ClientIdProvider(store, () -> "Ops-Laptop.local");

    String id = provider.getOrCreate();
    assertTrue(id.matches("java-ops-laptop-local-[0-9a-f]{8}"), id);
    assertEquals(id, provider.getOrCreate());
    assertEquals(id, new ClientIdProvider(store, () -> "other").getOrCreate());
    assertEquals(1, store.writeCount(ClientIdProvider.KEY));
  }

  @Test
  void resetForcesNewId() throws Exception {
    InMemoryStateStore store = new InMemoryStateStore();
    ClientIdProvider provider = new ClientIdProvider(store, () -> "host-a");
    String first = provider.getOrCreate();

    assertTrue(provider.reset());
    assertFalse(provider.exists());
    assertFalse(provider.reset());
    assertNotEquals(first, provider.getOrCreate());
  }

  @Test
  void hostTokenIsSanitizedAndBounded() {
    assertEquals("host", ClientIdProvider.hostToken(null));
    assertEquals("host", ClientIdProvider.hostToken("***"));
    assertEquals("a-very-long-host", ClientIdProvider.hostToken("A_Very_Long_Hostname_Indeed"));
  }
}
