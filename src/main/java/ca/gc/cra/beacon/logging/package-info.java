/**
 * Logging utilities that tune verbosity and sanitize feed payloads before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 */
package ca.gc.cra.beacon.logging;
