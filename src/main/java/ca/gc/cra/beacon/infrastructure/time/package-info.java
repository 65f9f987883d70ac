/**
 * Time source adapters.
 */
package ca.gc.cra.beacon.infrastructure.time;
