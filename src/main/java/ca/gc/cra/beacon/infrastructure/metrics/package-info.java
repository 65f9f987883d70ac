/**
 * OpenTelemetry metrics adapter for {@link ca.gc.cra.beacon.application.port.MetricsPort}.
 */
package ca.gc.cra.beacon.infrastructure.metrics;
