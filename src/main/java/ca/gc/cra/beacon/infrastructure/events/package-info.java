/**
 * Logging sinks for alerts and camera inventory broadcasts.
 */
package ca.gc.cra.beacon.infrastructure.events;
