package ca.gc.cra.beacon.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.beacon.application.wire.AlertEventCodec;
import ca.gc.cra.beacon.application.wire.FeedJson;
import ca.gc.cra.beacon.domain.event.AlertEvent;
import ca.gc.cra.beacon.domain.event.ChannelCatalog;
import ca.gc.cra.beacon.testing.RecordingMetrics;
import org.junit.jupiter.api.Test;

class LoggingAlertPresenterTest {

  @Test
  void describesEventWithSubscriptionNames() {
    AlertEvent event = AlertEventCodec.decode(FeedJson.parse("{\"id\":\"e1\",\"timestamp\":0,\"area\":\"barora\","
        + "\"type\":\"cd\",\"source\":\"gate\",\"data\":{\"location\":\"Pit 4\",\"vehicleNumber\":\"OD-1\"}}"));
    var subscription = ChannelCatalog.describe(event.channel());

    String line = LoggingAlertPresenter.describe(event, subscription);

    assertEquals(subscription.typeDisplay() + " @ Barora, id=e1, time=1970-01-01T00:00:00Z, location=Pit 4, "
        + "vehicle=OD-1, source=gate", line);
  }

  @Test
  void presentCountsAlerts() {
    RecordingMetrics metrics = new RecordingMetrics();
    AlertEvent event = AlertEventCodec.decode(
        FeedJson.parse("{\"id\":\"e1\",\"timestamp\":0,\"area\":\"nowhere\",\"type\":\"zz\"}"));

    new LoggingAlertPresenter(metrics).present(event, null);

    assertEquals(1, metrics.count("feed.alert.presented"));
    assertEquals("nowhere_zz, id=e1, time=1970-01-01T00:00:00Z", LoggingAlertPresenter.describe(event, null));
  }
}
