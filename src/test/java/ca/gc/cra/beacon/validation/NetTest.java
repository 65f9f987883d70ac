package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsWebSocketEndpoints() {
    URI uri = Net.validateWebSocketUri("serverUrl", "wss://alerts.example.org:8443/ws");
    assertEquals("alerts.example.org", uri.getHost());
    assertEquals(8443, uri.getPort());
    assertEquals("ws", Net.validateWebSocketUri("serverUrl", "ws://10.0.0.5:2222/ws").getScheme());
    assertEquals("ws", Net.validateWebSocketUri("serverUrl", "ws://[::1]:2222/ws").getScheme());
  }

  @Test
  void rejectsWrongSchemeAndBadHosts() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateWebSocketUri("serverUrl", "http://host/ws"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateWebSocketUri("serverUrl", "ws:///ws"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateWebSocketUri("serverUrl", "ws://300.1.1.1/ws"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateWebSocketUri("serverUrl", "ws://-bad.host/ws"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateWebSocketUri("serverUrl", "ws://host:0/ws"));
  }

  @Test
  void httpEndpointsForMetrics() {
    assertEquals("https", Net.validateHttpUri("otelEndpoint", "https://collector:4317").getScheme());
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUri("otelEndpoint", "ws://collector"));
  }
}
