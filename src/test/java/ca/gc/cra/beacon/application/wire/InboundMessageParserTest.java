package ca.gc.cra.beacon.application.wire;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.event.AlertEvent;
import org.junit.jupiter.api.Test;

class InboundMessageParserTest {
  private final InboundMessageParser parser = new InboundMessageParser();

  @Test
  void decodesEventWithPayloadFields() {
    InboundMessage message = parser.parse("{\"id\":\"e1\",\"timestamp\":1700000000,\"area\":\"barora\","
        + "\"type\":\"cd\",\"source\":\"gate-3\",\"data\":{\"_seq\":\"42\",\"_requireAck\":false,"
        + "\"location\":\"North gate\",\"vehicleNumber\":\"OD-02-1234\",\"speed\":37}}");

    assertEquals(InboundMessage.Kind.EVENT, message.kind());
    AlertEvent event = message.event();
    assertEquals("barora_cd", event.channelKey());
    assertEquals(42L, event.sequence());
    assertFalse(event.requiresAck());
    assertEquals("North gate", event.payload().location());
    assertEquals("OD-02-1234", event.payload().vehicle().number());
    assertEquals(37, event.payload().extras().get("speed"));
    assertFalse(event.payload().extras().containsKey("location"));
  }

  @Test
  void missingAckFlagMeansAckRequired() {
    InboundMessage message =
        parser.parse("{\"id\":\"e1\",\"timestamp\":1,\"area\":\"barora\",\"type\":\"cd\"}");
    assertTrue(message.event().requiresAck());
    assertEquals(0L, message.event().sequence());
  }

  @Test
  void classifiesControlFrames() {
    assertEquals(InboundMessage.Kind.SUBSCRIBED, parser.parse("{\"status\":\"subscribed\"}").kind());

    InboundMessage error = parser.parse("{\"error\":{\"code\":7}}");
    assertEquals(InboundMessage.Kind.ERROR, error.kind());
    assertEquals("{\"code\":7}", error.detail());

    InboundMessage cameras =
        parser.parse("{\"type\":\"camera-list\",\"data\":{\"_raw_camera_json\":\"[1,2]\"}}");
    assertEquals(InboundMessage.Kind.CAMERA_LIST, cameras.kind());
    assertEquals("[1,2]", cameras.detail());
  }

  @Test
  void reportsBrokenFramesAsMalformed() {
    assertMalformed(null);
    assertMalformed("   ");
    assertMalformed("{not json");
    assertMalformed("[1,2,3]");
    assertMalformed("{\"type\":\"camera-list\",\"data\":{}}");
    assertMalformed("{\"timestamp\":1,\"area\":\"barora\",\"type\":\"cd\"}");
    assertMalformed("{\"id\":\"e1\",\"timestamp\":1,\"type\":\"cd\"}");
  }

  @Test
  void eventsWithLooseTimestampOrSeqAreStillEvents() {
    InboundMessage noTimestamp = parser.parse("{\"id\":\"e1\",\"area\":\"barora\",\"type\":\"cd\"}");
    InboundMessage textTimestamp =
        parser.parse("{\"id\":\"e2\",\"timestamp\":\"1700000000\",\"area\":\"barora\",\"type\":\"cd\"}");
    InboundMessage textSeq = parser.parse(
        "{\"id\":\"e3\",\"timestamp\":1,\"area\":\"barora\",\"type\":\"cd\",\"data\":{\"_seq\":\"n/a\"}}");

    assertEquals(InboundMessage.Kind.EVENT, noTimestamp.kind());
    assertEquals(0L, noTimestamp.event().timestamp());
    assertEquals(InboundMessage.Kind.EVENT, textTimestamp.kind());
    assertEquals(1_700_000_000L, textTimestamp.event().timestamp());
    assertEquals(InboundMessage.Kind.EVENT, textSeq.kind());
    assertEquals(0L, textSeq.event().sequence());
  }

  private void assertMalformed(String frame) {
    InboundMessage message = parser.parse(frame);
    assertEquals(InboundMessage.Kind.MALFORMED, message.kind(), String.valueOf(frame));
    assertNull(message.event());
  }
}
