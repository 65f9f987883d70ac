/**
 * JSON wire formats of the alert socket: inbound frame classification, event decoding, subscription requests,
 * and acknowledgements.
 */
package ca.gc.cra.beacon.application.wire;
