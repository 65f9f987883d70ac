package ca.gc.cra.beacon.infrastructure.transport;

import ca.gc.cra.beacon.application.port.FeedTransport;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FeedTransport} over an OkHttp WebSocket.
 *
 * <p>Reads never time out; liveness comes from OkHttp's ping interval, which fails the socket when a pong is
 * missed. Callbacks from a socket that has since been replaced or closed are ignored.</p>
 *
 * @since BEACON 0.1
 */
public final class OkHttpFeedTransport implements FeedTransport {
  private static final Logger log = LoggerFactory.getLogger(OkHttpFeedTransport.class);

  private final WebSocket.Factory sockets;
  private final Runnable releaser;
  private final URI serverUri;
  private final AtomicLong generation = new AtomicLong();
  private final AtomicReference<WebSocket> current = new AtomicReference<>();
  private volatile boolean open;

  /**
   * Creates a transport with its own client.
   *
   * @param serverUri {@code ws://} or {@code wss://} feed endpoint
   * @param pingInterval WebSocket ping interval
   */
  public OkHttpFeedTransport(URI serverUri, Duration pingInterval) {
    this(new OkHttpClient.Builder()
        .readTimeout(0, TimeUnit.MILLISECONDS)
        .connectTimeout(15, TimeUnit.SECONDS)
        .pingInterval(pingInterval.toMillis(), TimeUnit.MILLISECONDS)
        .build(), serverUri);
  }

  private OkHttpFeedTransport(OkHttpClient client, URI serverUri) {
    this(client, serverUri, () -> {
      client.dispatcher().executorService().shutdown();
      client.connectionPool().evictAll();
    });
  }

  OkHttpFeedTransport(WebSocket.Factory sockets, URI serverUri, Runnable releaser) {
    this.sockets = Objects.requireNonNull(sockets, "sockets");
    this.serverUri = Objects.requireNonNull(serverUri, "serverUri");
    this.releaser = Objects.requireNonNull(releaser, "releaser");
  }

  /**
   * Opens a new socket, cancelling any previous one.
   *
   * <p>The generation is bumped before the socket exists, so callbacks that OkHttp delivers before
   * {@code newWebSocket} returns are already recognised as current.</p>
   */
  @Override
  public void open(Listener listener) {
    Objects.requireNonNull(listener, "listener");
    Request request = new Request.Builder().url(serverUri.toString()).build();
    long mine = generation.incrementAndGet();
    open = false;
    WebSocket previous = current.getAndSet(null);
    if (previous != null) {
      previous.cancel();
    }
    WebSocket socket = sockets.newWebSocket(request, new Bridge(listener, mine));
    current.compareAndSet(null, socket);
    if (generation.get() != mine) {
      current.compareAndSet(socket, null);
    }
    log.debug("Opening WebSocket to {}", serverUri);
  }

  @Override
  public boolean send(String text) {
    WebSocket socket = current.get();
    return open && socket != null && socket.send(text);
  }

  @Override
  public boolean isOpen() {
    return open && current.get() != null;
  }

  @Override
  public void close(int code, String reason) {
    generation.incrementAndGet();
    WebSocket socket = current.getAndSet(null);
    open = false;
    if (socket != null && !socket.close(code, reason)) {
      socket.cancel();
    }
  }

  /**
   * Releases the client's dispatcher and connection pool.
   */
  public void shutdown() {
    close(1000, "Client stopped");
    releaser.run();
  }

  private final class Bridge extends WebSocketListener {
    private final Listener listener;
    private final long generationAtOpen;

    Bridge(Listener listener, long generationAtOpen) {
      this.listener = listener;
      this.generationAtOpen = generationAtOpen;
    }

    private boolean isCurrent() {
      return generation.get() == generationAtOpen;
    }

    /** Ends this socket's generation; only the first terminal callback wins. */
    private boolean retire(WebSocket webSocket) {
      if (!generation.compareAndSet(generationAtOpen, generationAtOpen + 1)) {
        return false;
      }
      current.compareAndSet(webSocket, null);
      open = false;
      return true;
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
      if (!isCurrent()) {
        webSocket.cancel();
        return;
      }
      current.set(webSocket);
      open = true;
      listener.onOpen();
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
      if (isCurrent()) {
        listener.onMessage(text);
      }
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
      webSocket.close(code, reason);
    }

    @Override
    public void onClosed(WebSocket webSocket, int code, String reason) {
      if (retire(webSocket)) {
        listener.onClosed(code, reason);
      }
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
      if (retire(webSocket)) {
        listener.onFailure(t);
      }
    }
  }
}
