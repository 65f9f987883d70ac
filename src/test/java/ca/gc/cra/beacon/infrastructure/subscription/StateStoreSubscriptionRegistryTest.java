package ca.gc.cra.beacon.infrastructure.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.domain.event.Subscription;
import ca.gc.cra.beacon.testing.InMemoryStateStore;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StateStoreSubscriptionRegistryTest {
  private InMemoryStateStore store;
  private StateStoreSubscriptionRegistry registry;
  private List<String> events;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryStateStore();
    registry = new StateStoreSubscriptionRegistry(store);
    registry.load();
    events = new CopyOnWriteArrayList<>();
    registry.addListener(new StateStoreSubscriptionRegistry.Listener() {
      @Override
      public void onSubscribed(Subscription subscription) {
        events.add("+" + subscription.channelKey());
      }

      @Override
      public void onUnsubscribed(String channelKey) {
        events.add("-" + channelKey);
      }
    });
  }

  @Test
  void subscribeAttachesCatalogNamesAndPersists() throws Exception {
    assertTrue(registry.subscribe(ChannelId.parse("barora_cd")));
    assertFalse(registry.subscribe(ChannelId.parse("barora_cd")));

    Subscription stored = registry.find("barora_cd").orElseThrow();
    assertEquals("Barora", stored.areaDisplay());
    assertEquals(List.of("+barora_cd"), events);
    assertEquals(1, store.writeCount(StateStoreSubscriptionRegistry.KEY));
  }

  @Test
  void stateSurvivesReload() throws Exception {
    registry.subscribe(ChannelId.parse("barora_cd"));
    registry.subscribe(ChannelId.parse("lodna_vd"));
    registry.setMuted("lodna_vd", true);
    registry.setPinned("barora_cd", true);

    StateStoreSubscriptionRegistry reloaded = new StateStoreSubscriptionRegistry(store);
    assertEquals(2, reloaded.load());
    assertEquals(List.of("barora_cd", "lodna_vd"), reloaded.channelKeys());
    assertTrue(reloaded.isMuted("lodna_vd"));
    assertTrue(reloaded.find("barora_cd").orElseThrow().pinned());
  }

  @Test
  void unsubscribeNotifiesOnlyForKnownChannels() throws Exception {
    registry.subscribe(ChannelId.parse("barora_cd"));
    assertTrue(registry.unsubscribe("barora_cd"));
    assertFalse(registry.unsubscribe("barora_cd"));
    assertFalse(registry.setMuted("barora_cd", true));

    assertEquals(List.of("+barora_cd", "-barora_cd"), events);
    assertFalse(registry.isSubscribed("barora_cd"));
  }

  @Test
  void invalidStoredEntriesAreSkipped() throws Exception {
    store.put(StateStoreSubscriptionRegistry.KEY,
        "[{\"area\":\"barora\",\"type\":\"cd\",\"muted\":true},{\"area\":\"Bad Area\",\"type\":\"cd\"},{}]");
    assertEquals(1, registry.load());
    assertTrue(registry.isMuted("barora_cd"));

    store.put(StateStoreSubscriptionRegistry.KEY, "not json");
    assertEquals(0, registry.load());
  }
}
