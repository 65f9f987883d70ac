/**
 * Feed domain model: alert events, channel coordinates, per-channel sync snapshots, and subscriptions.
 * <p><strong>Concurrency:</strong> Every type here is immutable.</p>
 */
package ca.gc.cra.beacon.domain.event;
