package ca.gc.cra.beacon.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Durable key/value store for serialized client state.
 * <p><strong>Why:</strong> Sync state, stored events, unread counters, subscriptions, the client id, and the liveness
 * marker must survive process restarts; each is persisted as one JSON document under a fixed key.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Replace a key's value atomically so readers never observe a half-written document.</li>
 *   <li>Report absent keys as {@link Optional#empty()} rather than failing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent writes to different keys; writes to
 * the same key are serialized by the caller.</p>
 *
 * @since BEACON 0.1
 * @see ca.gc.cra.beacon.infrastructure.persistence.FileStateStore
 */
public interface StateStorePort {
  /**
   * Reads the document stored under {@code key}.
   *
   * @param key storage key such as {@code sync_state}
   * @return stored document, or empty when the key has never been written
   * @throws IOException if the backing store cannot be read
   */
  Optional<String> read(String key) throws IOException;

  /**
   * Replaces the document stored under {@code key}.
   *
   * @param key storage key
   * @param document serialized JSON document
   * @throws IOException if the write fails; the previous document remains intact
   */
  void write(String key, String document) throws IOException;

  /**
   * Removes {@code key}; removing an absent key is not an error.
   *
   * @param key storage key
   * @throws IOException if the backing store cannot be updated
   */
  void delete(String key) throws IOException;
}
