/**
 * Ports between the feed pipeline and its adapters: transport, state storage, subscriptions, UI signals,
 * metrics, and time.
 * <p><strong>Concurrency:</strong> Each port documents which threads call it; adapters must be thread-safe unless
 * stated otherwise.</p>
 */
package ca.gc.cra.beacon.application.port;
