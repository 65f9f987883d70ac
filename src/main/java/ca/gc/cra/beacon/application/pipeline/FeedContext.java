package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.CameraInventorySink;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.port.SubscriptionRegistry;
import ca.gc.cra.beacon.application.sync.AckBatcher;
import ca.gc.cra.beacon.application.sync.EventStore;
import ca.gc.cra.beacon.application.sync.SequenceTracker;
import java.util.Objects;

/**
 * Collaborators shared by every ingestion worker.
 *
 * @param tracker per-channel dedup state
 * @param store event store
 * @param acks acknowledgement batcher
 * @param registry subscription lookup
 * @param signals UI update dispatcher
 * @param cameras camera inventory sink
 * @param metrics metrics sink
 * @since BEACON 0.1
 */
public record FeedContext(
    SequenceTracker tracker,
    EventStore store,
    AckBatcher acks,
    SubscriptionRegistry registry,
    UpdateSignalDispatcher signals,
    CameraInventorySink cameras,
    MetricsPort metrics) {

  public FeedContext {
    Objects.requireNonNull(tracker, "tracker");
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(acks, "acks");
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(signals, "signals");
    Objects.requireNonNull(cameras, "cameras");
    metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }
}
