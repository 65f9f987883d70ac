package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Port abstracting BEACON metrics emission.
 * <p><strong>Why:</strong> Lets the ingestion, ack, and persistence paths count outcomes without binding to a vendor
 * SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from every worker thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code feed.ingest.accepted},
 * {@code feed.ack.sent}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since BEACON 0.1
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code feed.ingest.duplicate}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., queue depth, batch size, milliseconds)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
