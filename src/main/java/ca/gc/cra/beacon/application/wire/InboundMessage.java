package ca.gc.cra.beacon.application.wire;

import ca.gc.cra.beacon.domain.event.AlertEvent;
import java.util.Objects;

/**
 * Classified inbound frame.
 *
 * @param kind frame category
 * @param event decoded event when {@code kind == EVENT}; otherwise {@code null}
 * @param detail error text, raw camera document, or parse failure reason depending on {@code kind}
 */
public record InboundMessage(Kind kind, AlertEvent event, String detail) {

  /** Frame categories recognized on the alert socket. */
  public enum Kind {
    /** {@code {"status":"subscribed"}} acknowledgement. */
    SUBSCRIBED,
    /** {@code {"error":"..."}} server error frame. */
    ERROR,
    /** Camera inventory envelope. */
    CAMERA_LIST,
    /** Domain alert event. */
    EVENT,
    /** Unparseable frame or event missing required fields. */
    MALFORMED
  }

  /**
   * Validates the kind/payload pairing.
   */
  public InboundMessage {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.EVENT && event == null) {
      throw new IllegalArgumentException("EVENT messages must carry an event");
    }
  }

  static InboundMessage subscribed() {
    return new InboundMessage(Kind.SUBSCRIBED, null, null);
  }

  static InboundMessage error(String text) {
    return new InboundMessage(Kind.ERROR, null, text);
  }

  static InboundMessage cameraList(String rawCameraJson) {
    return new InboundMessage(Kind.CAMERA_LIST, null, rawCameraJson);
  }

  static InboundMessage event(AlertEvent event) {
    return new InboundMessage(Kind.EVENT, event, null);
  }

  static InboundMessage malformed(String reason) {
    return new InboundMessage(Kind.MALFORMED, null, reason);
  }
}
