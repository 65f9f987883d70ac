/**
 * WebSocket transport adapter for the feed server.
 */
package ca.gc.cra.beacon.infrastructure.transport;
