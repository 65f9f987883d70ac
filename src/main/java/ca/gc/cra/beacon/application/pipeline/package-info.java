/**
 * Feed ingestion pipeline: socket supervision, the frame queue and worker pool, per-frame processing, UI signal
 * dispatch, and the client lifecycle that ties them together.
 * <p><strong>Threads:</strong> socket callbacks only enqueue; workers do all parsing and state updates; timers run on
 * one shared scheduler; UI signals run on a single dispatch thread.</p>
 */
package ca.gc.cra.beacon.application.pipeline;
