/**
 * Persistent channel subscription registry.
 */
package ca.gc.cra.beacon.infrastructure.subscription;
