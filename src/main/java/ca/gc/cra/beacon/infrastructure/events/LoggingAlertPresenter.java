package ca.gc.cra.beacon.infrastructure.events;

import ca.gc.cra.beacon.application.port.AlertPresenter;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.domain.event.AlertEvent;
import ca.gc.cra.beacon.domain.event.ChannelCatalog;
import ca.gc.cra.beacon.domain.event.Subscription;
import ca.gc.cra.beacon.domain.event.VehicleInfo;
import java.time.Instant;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Presents alerts as structured log lines and counts them.
 *
 * @since BEACON 0.1
 */
public final class LoggingAlertPresenter implements AlertPresenter {
  private static final Logger log = LoggerFactory.getLogger(LoggingAlertPresenter.class);

  private final MetricsPort metrics;

  /**
   * Creates a presenter.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingAlertPresenter(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void present(AlertEvent event, Subscription subscription) {
    Objects.requireNonNull(event, "event");
    metrics.increment("feed.alert.presented");
    log.info("ALERT {}", describe(event, subscription));
  }

  static String describe(AlertEvent event, Subscription subscription) {
    StringJoiner joiner = new StringJoiner(", ");
    String title = subscription != null
        ? subscription.typeDisplay() + " @ " + subscription.areaDisplay()
        : ChannelCatalog.description(event.channel()).orElse(event.channelKey());
    joiner.add(title);
    joiner.add("id=" + event.id());
    joiner.add("time=" + Instant.ofEpochSecond(event.timestamp()));
    if (event.payload().location() != null) {
      joiner.add("location=" + event.payload().location());
    }
    VehicleInfo vehicle = event.payload().vehicle();
    if (vehicle != null && !vehicle.isEmpty()) {
      if (vehicle.number() != null) {
        joiner.add("vehicle=" + vehicle.number());
      }
      if (vehicle.transporter() != null) {
        joiner.add("transporter=" + vehicle.transporter());
      }
    }
    if (event.source() != null) {
      joiner.add("source=" + event.source());
    }
    return joiner.toString();
  }
}
