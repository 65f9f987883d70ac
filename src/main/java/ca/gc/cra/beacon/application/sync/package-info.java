/**
 * Client-side synchronization state: per-channel sequence tracking, the event store, ack batching, catch-up
 * completion, liveness detection, and the client identity.
 * <p><strong>Concurrency:</strong> Tracker and store methods are called from every ingestion worker; each documents
 * its locking.</p>
 */
package ca.gc.cra.beacon.application.sync;
