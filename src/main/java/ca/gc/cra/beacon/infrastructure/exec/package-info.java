/**
 * Executor factories for ingestion workers, timers, and the UI dispatch thread.
 * <p><strong>Concurrency:</strong> Returned executors are owned and shut down by the feed client.</p>
 */
package ca.gc.cra.beacon.infrastructure.exec;
