package ca.gc.cra.beacon.application.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.wire.FeedJson;
import ca.gc.cra.beacon.testing.RecordingMetrics;
import ca.gc.cra.beacon.testing.RecordingTransport;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AckBatcherTest {
  private static final Executor DIRECT = Runnable::run;
  private static final Executor NEVER = task -> {};

  private RecordingTransport transport;
  private RecordingMetrics metrics;

  @BeforeEach
  void setUp() {
    transport = new RecordingTransport();
    transport.setOpen(true);
    metrics = new RecordingMetrics();
  }

  @Test
  void sizeTriggerFlushesFullBatchAndTimerSendsRemainder() {
    AckBatcher acks = new AckBatcher(transport, "client-1", DIRECT, metrics, 50);
    for (int i = 1; i <= 60; i++) {
      acks.enqueue("e" + i);
    }
    assertEquals(1, transport.sent().size());
    assertEquals(50, ids(transport.sent().get(0)).size());
    assertEquals(10, acks.pendingCount());

    acks.flushIfConnected();
    assertEquals(2, transport.sent().size());
    JsonNode remainder = FeedJson.parse(transport.sent().get(1));
    assertEquals("batch_ack", remainder.path("type").asText());
    assertEquals(10, remainder.path("eventIds").size());
    assertEquals("e51", remainder.path("eventIds").get(0).asText());
    assertEquals(0, acks.pendingCount());
  }

  @Test
  void flushSplitsIntoBatchSizedMessages() {
    AckBatcher acks = new AckBatcher(transport, "client-1", NEVER, metrics, 30);
    for (int i = 0; i < 100; i++) {
      acks.enqueue("e" + i);
    }
    assertEquals(4, acks.flush());
    assertEquals(4, transport.sent().size());
    assertEquals(10, ids(transport.sent().get(3)).size());
  }

  @Test
  void messagesNeverExceedOneHundredIds() {
    AckBatcher acks = new AckBatcher(transport, "client-1", NEVER, metrics, 500);
    for (int i = 0; i < 250; i++) {
      acks.enqueue("e" + i);
    }
    assertEquals(3, acks.flush());
    assertEquals(100, ids(transport.sent().get(0)).size());
    assertEquals(50, ids(transport.sent().get(2)).size());
  }

  @Test
  void singleAckUsesAckShape() {
    AckBatcher acks = new AckBatcher(transport, "client-1", NEVER, metrics, 50);
    acks.enqueue("only");
    acks.flush();

    JsonNode message = FeedJson.parse(transport.sent().get(0));
    assertEquals("ack", message.path("type").asText());
    assertEquals("only", message.path("eventId").asText());
    assertEquals("client-1", message.path("clientId").asText());
    assertFalse(message.has("eventIds"));
  }

  @Test
  void failedSendKeepsAcksQueued() {
    AckBatcher acks = new AckBatcher(transport, "client-1", NEVER, metrics, 50);
    acks.enqueue("a");
    acks.enqueue("b");
    transport.setOpen(false);

    assertEquals(0, acks.flush());
    assertEquals(2, acks.pendingCount());
    assertEquals(1, metrics.count("feed.ack.requeued"));

    transport.setOpen(true);
    acks.close();
    assertEquals(0, acks.pendingCount());
    assertEquals(2, ids(transport.sent().get(0)).size());
  }

  @Test
  void timerFlushSkippedWhileDisconnected() {
    AckBatcher acks = new AckBatcher(transport, "client-1", NEVER, metrics, 50);
    acks.enqueue("a");
    transport.setOpen(false);
    acks.flushIfConnected();

    assertTrue(transport.sent().isEmpty());
    assertEquals(0, metrics.count("feed.ack.requeued"));
    assertEquals(1, acks.pendingCount());
  }

  private static JsonNode ids(String message) {
    return FeedJson.parse(message).path("eventIds");
  }
}
