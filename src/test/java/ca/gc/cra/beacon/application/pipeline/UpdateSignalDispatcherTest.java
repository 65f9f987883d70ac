package ca.gc.cra.beacon.application.pipeline;

import static ca.gc.cra.beacon.testing.TestEvents.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.domain.event.Subscription;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.beacon.testing.MapSubscriptionRegistry;
import ca.gc.cra.beacon.testing.RecordingMetrics;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UpdateSignalDispatcherTest {
  private static final String LIVE = "barora_cd";
  private static final String CATCHING_UP = "lodna_cd";

  private ScheduledExecutorService scheduler;
  private MapSubscriptionRegistry registry;
  private Set<String> catchingUp;
  private List<String> signals;
  private List<String> presented;
  private RecordingMetrics metrics;
  private UpdateSignalDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    scheduler = ExecutorFactories.newScheduler(1, "signal-test", null);
    registry = MapSubscriptionRegistry.of(LIVE, CATCHING_UP);
    catchingUp = ConcurrentHashMap.newKeySet();
    catchingUp.add(CATCHING_UP);
    signals = new CopyOnWriteArrayList<>();
    presented = new CopyOnWriteArrayList<>();
    metrics = new RecordingMetrics();
    dispatcher = new UpdateSignalDispatcher(
        Runnable::run,
        scheduler,
        catchingUp::contains,
        registry,
        (event, subscription) -> presented.add(event.id()),
        metrics,
        Duration.ofHours(1));
    dispatcher.addListener((channel, latest) -> signals.add(channel + ":" + latest.id()));
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void liveChannelSignalsImmediately() {
    dispatcher.publish(event("e1", LIVE, 100, 1));
    dispatcher.publish(event("e2", LIVE, 101, 2));

    assertEquals(List.of(LIVE + ":e1", LIVE + ":e2"), signals);
    assertEquals(List.of("e1", "e2"), presented);
  }

  @Test
  void catchingUpChannelCoalescesToNewestEvent() {
    dispatcher.publish(event("old", CATCHING_UP, 100, 1));
    dispatcher.publish(event("newest", CATCHING_UP, 300, 3));
    dispatcher.publish(event("middle", CATCHING_UP, 200, 2));
    assertTrue(signals.isEmpty());

    assertEquals(1, dispatcher.flushBatched());
    assertEquals(List.of(CATCHING_UP + ":newest"), signals);
    assertEquals(3, metrics.count("feed.signal.coalesced"));
  }

  @Test
  void mutedChannelSignalsWithoutPresenting() {
    registry.add(Subscription.of(ChannelId.parse(LIVE)).withMuted(true));
    dispatcher.publish(event("e1", LIVE, 100, 1));

    assertEquals(List.of(LIVE + ":e1"), signals);
    assertTrue(presented.isEmpty());
  }

  @Test
  void failingListenerDoesNotBlockOthers() {
    dispatcher.addListener((channel, latest) -> {
      throw new IllegalStateException("listener broke");
    });
    List<String> second = new CopyOnWriteArrayList<>();
    dispatcher.addListener((channel, latest) -> second.add(latest.id()));

    dispatcher.publish(event("e1", LIVE, 100, 1));

    assertEquals(List.of("e1"), second);
    assertEquals(1, metrics.count("feed.signal.listener.error"));
    assertEquals(List.of("e1"), presented);
  }

  @Test
  void closeFlushesPendingSignals() {
    dispatcher.publish(event("e1", CATCHING_UP, 100, 1));
    dispatcher.close();
    assertEquals(List.of(CATCHING_UP + ":e1"), signals);
  }
}
