package ca.gc.cra.beacon.application.pipeline;

import static ca.gc.cra.beacon.testing.TestEvents.frame;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.sync.AckBatcher;
import ca.gc.cra.beacon.application.sync.EventStore;
import ca.gc.cra.beacon.application.sync.SequenceTracker;
import ca.gc.cra.beacon.domain.event.IngestOutcome;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.beacon.testing.InMemoryStateStore;
import ca.gc.cra.beacon.testing.ManualClock;
import ca.gc.cra.beacon.testing.MapSubscriptionRegistry;
import ca.gc.cra.beacon.testing.RecordingMetrics;
import ca.gc.cra.beacon.testing.RecordingTransport;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FeedMessageProcessorTest {
  private static final String CHANNEL = "barora_cd";
  private static final long NOW_SECONDS = 1_700_000_000L;

  private ScheduledExecutorService scheduler;
  private RecordingMetrics metrics;
  private SequenceTracker tracker;
  private EventStore store;
  private AckBatcher acks;
  private MapSubscriptionRegistry registry;
  private List<String> signalled;
  private List<String> cameras;
  private FeedStats stats;
  private FeedMessageProcessor processor;

  @BeforeEach
  void setUp() {
    scheduler = ExecutorFactories.newScheduler(1, "processor-test", null);
    metrics = new RecordingMetrics();
    InMemoryStateStore backing = new InMemoryStateStore();
    ManualClock clock = new ManualClock(NOW_SECONDS * 1_000L);
    tracker = new SequenceTracker(backing, scheduler, clock, metrics, Duration.ofSeconds(10));
    store = new EventStore(backing, scheduler, clock, metrics, new EventStore.Settings(
        Duration.ofDays(7), Duration.ofMinutes(5), Duration.ofMillis(50), Duration.ofSeconds(30), 50, 500),
        tracker::anyInCatchUp);
    RecordingTransport transport = new RecordingTransport();
    acks = new AckBatcher(transport, "client-1", task -> {}, metrics, 1_000);
    registry = MapSubscriptionRegistry.of(CHANNEL);
    signalled = new CopyOnWriteArrayList<>();
    UpdateSignalDispatcher signals = new UpdateSignalDispatcher(
        Runnable::run, scheduler, tracker::isInCatchUpMode, registry, null, metrics, Duration.ofMillis(50));
    signals.addListener((channel, latest) -> signalled.add(latest.id()));
    cameras = new CopyOnWriteArrayList<>();
    stats = new FeedStats();
    processor = new FeedMessageProcessor(
        new FeedContext(tracker, store, acks, registry, signals, cameras::add, metrics), stats);
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void storesSignalsAndAcksNewEvent() {
    assertEquals(IngestOutcome.ACCEPTED, processor.process(frame("e1", CHANNEL, NOW_SECONDS, 1)));

    assertEquals(1, store.eventCount(CHANNEL));
    assertEquals(List.of("e1"), signalled);
    assertEquals(1, acks.pendingCount());
    assertEquals(1, metrics.count("feed.ingest.accepted"));
  }

  @Test
  void redeliveryIsAckedButNotStoredTwice() {
    String frame = frame("e1", CHANNEL, NOW_SECONDS, 1);
    processor.process(frame);
    assertEquals(IngestOutcome.DUPLICATE, processor.process(frame));

    assertEquals(1, store.eventCount(CHANNEL));
    assertEquals(1, signalled.size());
    assertEquals(2, acks.pendingCount());
  }

  @Test
  void unsequencedDuplicateIsCaughtByStore() {
    processor.process(frame("e1", CHANNEL, NOW_SECONDS, 0));
    assertEquals(IngestOutcome.DUPLICATE, processor.process(frame("e1", CHANNEL, NOW_SECONDS, 0)));
    assertEquals(1, store.eventCount(CHANNEL));
  }

  @Test
  void looseTimestampAndSeqAreStoredAndAcked() {
    String frame = "{\"id\":\"e7\",\"timestamp\":\"" + NOW_SECONDS + "\",\"area\":\"barora\",\"type\":\"cd\","
        + "\"data\":{\"_seq\":\"n/a\",\"_requireAck\":true}}";

    assertEquals(IngestOutcome.ACCEPTED, processor.process(frame));
    assertEquals(NOW_SECONDS, store.events(CHANNEL).get(0).timestamp());
    assertEquals(1, acks.pendingCount());
    assertEquals(IngestOutcome.DUPLICATE, processor.process(frame));
  }

  @Test
  void unsubscribedEventIsAckedWithoutTouchingSyncState() {
    String other = "lodna_cd";
    assertEquals(IngestOutcome.DROPPED_UNSUBSCRIBED, processor.process(frame("x1", other, NOW_SECONDS, 9)));

    assertEquals(0, store.eventCount(other));
    assertEquals(0L, tracker.highestSeq(other));
    assertTrue(tracker.syncInfo(other).isEmpty());
    assertEquals(1, acks.pendingCount());
  }

  @Test
  void eventWithoutAckRequestIsNotAcked() {
    processor.process(frame("e1", CHANNEL, NOW_SECONDS, 1, false));
    assertEquals(0, acks.pendingCount());
  }

  @Test
  void classifiesControlAndBrokenFrames() {
    assertEquals(IngestOutcome.CONTROL, processor.process("{\"status\":\"subscribed\"}"));
    assertEquals(IngestOutcome.SERVER_ERROR, processor.process("{\"error\":\"bad filter\"}"));
    assertEquals(IngestOutcome.MALFORMED, processor.process("not json"));
    assertEquals(IngestOutcome.MALFORMED, processor.process("{\"timestamp\":1,\"area\":\"barora\",\"type\":\"cd\"}"));

    FeedStats.Snapshot snapshot = stats.snapshot();
    assertEquals(4, snapshot.received());
    assertEquals(3, snapshot.errors());
    assertEquals(0, acks.pendingCount());
  }

  @Test
  void cameraInventoryGoesToSink() {
    String raw = "[{\\\"id\\\":\\\"cam-1\\\"}]";
    IngestOutcome outcome =
        processor.process("{\"type\":\"camera-list\",\"data\":{\"_raw_camera_json\":\"" + raw + "\"}}");

    assertEquals(IngestOutcome.CONTROL, outcome);
    assertEquals(List.of("[{\"id\":\"cam-1\"}]"), cameras);
  }

  @Test
  void failingCameraSinkDoesNotEscape() {
    FeedMessageProcessor failing = new FeedMessageProcessor(new FeedContext(
        tracker, store, acks, registry,
        new UpdateSignalDispatcher(Runnable::run, scheduler, c -> false, registry, null, metrics, Duration.ZERO),
        raw -> {
          throw new IllegalStateException("boom");
        },
        metrics), stats);

    assertEquals(IngestOutcome.CONTROL,
        failing.process("{\"type\":\"camera-list\",\"data\":{\"_raw_camera_json\":\"[]\"}}"));
    assertEquals(1, metrics.count("feed.camera.error"));
    assertFalse(cameras.contains("[]"));
  }
}
