package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Message-passing boundary to the feed server's WebSocket.
 * <p><strong>Why:</strong> The connection supervisor only exchanges text frames and lifecycle signals; keeping the
 * socket library behind this port lets tests drive reconnects with a scripted transport.</p>
 * <p><strong>Thread-safety:</strong> {@link #send(String)} may be called from the ack flusher and the supervisor
 * concurrently. Listener callbacks arrive on the transport's own thread and must not block.</p>
 *
 * @since BEACON 0.1
 * @see ca.gc.cra.beacon.infrastructure.transport.OkHttpFeedTransport
 */
public interface FeedTransport {

  /**
   * Opens a new socket and routes its lifecycle to {@code listener}.
   *
   * @param listener receiver of open/message/close/failure callbacks
   */
  void open(Listener listener);

  /**
   * Sends a text frame on the current socket.
   *
   * @param text serialized JSON message
   * @return {@code true} when the frame was queued for transmission; {@code false} when no socket is open
   */
  boolean send(String text);

  /**
   * Reports whether a socket is currently open.
   *
   * @return {@code true} between {@code onOpen} and the closing callback
   */
  boolean isOpen();

  /**
   * Initiates an orderly close of the current socket, if any.
   *
   * @param code WebSocket close status (1000 for a normal client stop)
   * @param reason human-readable reason
   */
  void close(int code, String reason);

  /**
   * Receives socket lifecycle callbacks.
   */
  interface Listener {
    /** Socket handshake completed. */
    void onOpen();

    /**
     * A text frame arrived.
     *
     * @param text raw frame payload
     */
    void onMessage(String text);

    /**
     * The socket closed after a close handshake.
     *
     * @param code close status
     * @param reason close reason; may be empty
     */
    void onClosed(int code, String reason);

    /**
     * The socket failed (connect error, read error, abrupt disconnect).
     *
     * @param error failure cause
     */
    void onFailure(Throwable error);
  }
}
