package ca.gc.cra.beacon.application.sync;

import ca.gc.cra.beacon.application.port.StateStorePort;
import ca.gc.cra.beacon.application.wire.FeedJson;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies the stable client id that names this client's durable consumers on the server.
 *
 * <p>Format {@code java-{host}-{8 hex}}; created once and persisted under {@code client_id}.</p>
 *
 * @since BEACON 0.1
 */
public final class ClientIdProvider {
  private static final Logger log = LoggerFactory.getLogger(ClientIdProvider.class);
  static final String KEY = "client_id";
  private static final int MAX_HOST_TOKEN = 16;

  private final StateStorePort store;
  private final Supplier<String> hostName;

  /**
   * Creates a provider.
   *
   * @param store state store holding the id
   * @param hostName supplies the local host name used in new ids
   */
  public ClientIdProvider(StateStorePort store, Supplier<String> hostName) {
    this.store = Objects.requireNonNull(store, "store");
    this.hostName = Objects.requireNonNull(hostName, "hostName");
  }

  /**
   * Returns the persisted id, creating and persisting one on first use.
   *
   * @return client id
   * @throws IOException if the id cannot be read or persisted
   */
  public String getOrCreate() throws IOException {
    Optional<String> existing = current();
    if (existing.isPresent()) {
      return existing.get();
    }
    String id = "java-" + hostToken(hostName.get()) + '-' + UUID.randomUUID().toString().substring(0, 8);
    var doc = FeedJson.object();
    doc.put("clientId", id);
    store.write(KEY, FeedJson.write(doc));
    log.info("Created client id {}", id);
    return id;
  }

  /**
   * Returns the persisted id without creating one.
   *
   * @return client id, or empty when none was created yet
   * @throws IOException if the store cannot be read
   */
  public Optional<String> current() throws IOException {
    Optional<String> raw = store.read(KEY);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      String id = FeedJson.parse(raw.get()).path("clientId").asText("");
      return id.isBlank() ? Optional.empty() : Optional.of(id);
    } catch (IllegalArgumentException ex) {
      log.warn("Ignoring malformed client id document");
      return Optional.empty();
    }
  }

  /**
   * Reports whether an id has been persisted.
   *
   * @return {@code true} when {@link #current()} would return an id
   * @throws IOException if the store cannot be read
   */
  public boolean exists() throws IOException {
    return current().isPresent();
  }

  /**
   * Deletes the persisted id; the next {@link #getOrCreate()} creates a fresh one.
   *
   * @return {@code true} when an id existed
   * @throws IOException if the store cannot be updated
   */
  public boolean reset() throws IOException {
    boolean existed = exists();
    store.delete(KEY);
    return existed;
  }

  static String hostToken(String host) {
    String token = host == null ? "" : host.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    token = token.replaceAll("^-+|-+$", "");
    if (token.length() > MAX_HOST_TOKEN) {
      token = token.substring(0, MAX_HOST_TOKEN).replaceAll("-+$", "");
    }
    return token.isEmpty() ? "host" : token;
  }
}
