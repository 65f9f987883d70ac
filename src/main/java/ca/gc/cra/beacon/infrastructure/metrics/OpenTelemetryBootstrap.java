package ca.gc.cra.beacon.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the feed client.
 *
 * <p>The exporter comes from the {@code metricsExporter} setting and falls back to {@code OTEL_METRICS_EXPORTER};
 * the endpoint comes from {@code otelEndpoint} and falls back to {@code OTEL_EXPORTER_OTLP_ENDPOINT}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.beacon";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long PROVIDER_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize(String exporter, String endpoint) {
    String selected = setting(exporter, "OTEL_METRICS_EXPORTER", "none").toLowerCase(Locale.ROOT);
    if (!selected.equals("otlp")) {
      if (!selected.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; metrics export disabled", selected);
      }
      log.debug("Feed metrics stay in process");
      return BootstrapResult.noop();
    }
    String target = setting(endpoint, "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(target).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.info("Exporting feed metrics over OTLP to {} every {} s", target, EXPORT_INTERVAL.toSeconds());
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("OTLP metrics exporter for {} could not be created; continuing without export", target, ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = serviceVersion();
    Attributes service = Attributes.of(
        AttributeKey.stringKey("service.name"), "beacon",
        AttributeKey.stringKey("service.version"), version);
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(Resource.create(service)))
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  private static String serviceVersion() {
    String version = OpenTelemetryBootstrap.class.getPackage().getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  private static String setting(String configured, String envVar, String fallback) {
    if (configured != null && !configured.isBlank()) {
      return configured.trim();
    }
    String env = System.getenv(envVar);
    return env == null || env.isBlank() ? fallback : env.trim();
  }

  /**
   * Meter plus the SDK provider behind it; the provider is {@code null} when metrics are not exported.
   */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await("flush", provider::forceFlush);
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await("shutdown", provider::shutdown);
      }
    }

    private static void await(String action, Supplier<CompletableResultCode> call) {
      try {
        CompletableResultCode result = call.get().join(PROVIDER_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
          log.warn("Metrics provider {} did not complete within {} s", action, PROVIDER_TIMEOUT_SECONDS);
        }
      } catch (RuntimeException ex) {
        log.warn("Metrics provider {} failed", action, ex);
      }
    }
  }
}
