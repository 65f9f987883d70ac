package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.wire.InboundMessage;
import ca.gc.cra.beacon.application.wire.InboundMessageParser;
import ca.gc.cra.beacon.domain.event.AlertEvent;
import ca.gc.cra.beacon.domain.event.IngestOutcome;
import ca.gc.cra.beacon.logging.Logs;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Processes one raw frame taken off the ingestion queue.
 * <p><strong>Why:</strong> Dedup has two layers: the sequence tracker decides whether an event is new for its
 * channel, the event store guarantees an id is stored once. Every event the server asked to be acknowledged is
 * acknowledged, whether stored, duplicate, or dropped, so the server stops redelivering it.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from counters; called concurrently by every worker.</p>
 * <p><strong>Observability:</strong> Emits {@code feed.ingest.*} counters per {@link IngestOutcome}.</p>
 *
 * @since BEACON 0.1
 */
public final class FeedMessageProcessor {
  private static final Logger log = LoggerFactory.getLogger(FeedMessageProcessor.class);
  private static final int LOGGED_FRAME_CHARS = 256;

  private final FeedContext context;
  private final InboundMessageParser parser = new InboundMessageParser();
  private final FeedStats stats;

  /**
   * Creates a processor.
   *
   * @param context shared collaborators
   * @param stats counters updated per frame
   */
  public FeedMessageProcessor(FeedContext context, FeedStats stats) {
    this.context = Objects.requireNonNull(context, "context");
    this.stats = Objects.requireNonNull(stats, "stats");
  }

  /**
   * Worker entry point.
   *
   * @param frame raw frame text
   */
  public void accept(String frame) {
    process(frame);
  }

  /**
   * Classifies and processes one frame.
   *
   * @param frame raw frame text
   * @return outcome
   */
  public IngestOutcome process(String frame) {
    stats.frameReceived();
    InboundMessage message = parser.parse(frame);
    IngestOutcome outcome = switch (message.kind()) {
      case SUBSCRIBED -> {
        log.info("Server confirmed subscription");
        yield IngestOutcome.CONTROL;
      }
      case ERROR -> {
        log.warn("Server error: {}", Logs.truncate(message.detail(), LOGGED_FRAME_CHARS));
        yield IngestOutcome.SERVER_ERROR;
      }
      case CAMERA_LIST -> {
        deliverCameras(message.detail());
        yield IngestOutcome.CONTROL;
      }
      case MALFORMED -> {
        log.warn("Dropping malformed frame ({}): {}", message.detail(), Logs.truncate(frame, LOGGED_FRAME_CHARS));
        yield IngestOutcome.MALFORMED;
      }
      case EVENT -> processEvent(message.event());
    };
    stats.record(outcome);
    context.metrics().increment("feed.ingest." + outcome.name().toLowerCase(Locale.ROOT));
    return outcome;
  }

  private IngestOutcome processEvent(AlertEvent event) {
    String channel = event.channelKey();
    IngestOutcome outcome;
    if (!context.registry().isSubscribed(channel)) {
      log.debug("Dropping event {} for unsubscribed channel {}", event.id(), channel);
      outcome = IngestOutcome.DROPPED_UNSUBSCRIBED;
    } else if (event.sequence() == 0 && context.store().contains(channel, event.id())) {
      outcome = IngestOutcome.DUPLICATE;
    } else if (!context.tracker().recordEventReceived(
        channel, event.id(), event.timestamp(), event.sequence())) {
      outcome = IngestOutcome.DUPLICATE;
    } else if (context.store().addEvent(event)) {
      context.signals().publish(event);
      outcome = IngestOutcome.ACCEPTED;
    } else {
      outcome = IngestOutcome.DUPLICATE;
    }
    if (event.requiresAck()) {
      context.acks().enqueue(event.id());
      stats.ackQueued();
    }
    return outcome;
  }

  private void deliverCameras(String rawCameraJson) {
    try {
      context.cameras().onCameraInventory(rawCameraJson);
    } catch (RuntimeException ex) {
      context.metrics().increment("feed.camera.error");
      log.warn("Camera inventory sink failed", ex);
    }
  }
}
