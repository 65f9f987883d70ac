/**
 * File-backed state storage for sync state, events, subscriptions, the client id, and the liveness marker.
 */
package ca.gc.cra.beacon.infrastructure.persistence;
