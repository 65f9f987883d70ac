package ca.gc.cra.beacon.infrastructure.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.port.FeedTransport;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.Request;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.junit.jupiter.api.Test;

class OkHttpFeedTransportTest {
  private static final URI SERVER = URI.create("ws://localhost:9/ws");

  @Test
  void sendBeforeOpenReportsFailure() {
    OkHttpFeedTransport transport = new OkHttpFeedTransport(SERVER, Duration.ofSeconds(10));
    try {
      assertFalse(transport.isOpen());
      assertFalse(transport.send("{}"));
      transport.close(1000, "unused");
    } finally {
      transport.shutdown();
    }
  }

  @Test
  void callbacksDeliveredBeforeNewWebSocketReturnsAreNotDropped() {
    FakeSocket socket = new FakeSocket();
    OkHttpFeedTransport transport = new OkHttpFeedTransport((request, listener) -> {
      listener.onOpen(socket, null);
      listener.onMessage(socket, "{\"status\":\"subscribed\"}");
      return socket;
    }, SERVER, () -> { });
    RecordingListener events = new RecordingListener();

    transport.open(events);

    assertEquals(List.of("open", "message:{\"status\":\"subscribed\"}"), events.calls);
    assertTrue(transport.isOpen());
    assertTrue(transport.send("hello"));
    assertEquals(List.of("hello"), socket.sent);
  }

  @Test
  void replacedSocketCallbacksAreIgnored() {
    AtomicReference<WebSocketListener> firstListener = new AtomicReference<>();
    FakeSocket first = new FakeSocket();
    FakeSocket second = new FakeSocket();
    List<FakeSocket> queued = new CopyOnWriteArrayList<>(List.of(first, second));
    OkHttpFeedTransport transport = new OkHttpFeedTransport((request, listener) -> {
      FakeSocket next = queued.remove(0);
      if (next == first) {
        firstListener.set(listener);
      }
      return next;
    }, SERVER, () -> { });
    RecordingListener events = new RecordingListener();

    transport.open(events);
    transport.open(events);
    firstListener.get().onMessage(first, "stale");
    firstListener.get().onFailure(first, new IllegalStateException("gone"), null);

    assertTrue(first.cancelled);
    assertTrue(events.calls.isEmpty());
  }

  @Test
  void onlyFirstTerminalCallbackIsReported() {
    AtomicReference<WebSocketListener> bridge = new AtomicReference<>();
    FakeSocket socket = new FakeSocket();
    OkHttpFeedTransport transport = new OkHttpFeedTransport((request, listener) -> {
      bridge.set(listener);
      return socket;
    }, SERVER, () -> { });
    RecordingListener events = new RecordingListener();

    transport.open(events);
    bridge.get().onOpen(socket, null);
    bridge.get().onFailure(socket, new IllegalStateException("reset"), null);
    bridge.get().onClosed(socket, 1006, "abnormal");

    assertEquals(List.of("open", "failure:reset"), events.calls);
    assertFalse(transport.isOpen());
    assertFalse(transport.send("late"));
  }

  private static final class RecordingListener implements FeedTransport.Listener {
    private final List<String> calls = new CopyOnWriteArrayList<>();

    @Override
    public void onOpen() {
      calls.add("open");
    }

    @Override
    public void onMessage(String text) {
      calls.add("message:" + text);
    }

    @Override
    public void onClosed(int code, String reason) {
      calls.add("closed:" + code);
    }

    @Override
    public void onFailure(Throwable error) {
      calls.add("failure:" + error.getMessage());
    }
  }

  private static final class FakeSocket implements WebSocket {
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    @Override
    public Request request() {
      return new Request.Builder().url("http://localhost:9/ws").build();
    }

    @Override
    public long queueSize() {
      return 0;
    }

    @Override
    public boolean send(String text) {
      sent.add(text);
      return true;
    }

    @Override
    public boolean send(ByteString bytes) {
      return false;
    }

    @Override
    public boolean close(int code, String reason) {
      return true;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }
  }
}
