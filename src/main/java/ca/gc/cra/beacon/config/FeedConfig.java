package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.application.pipeline.ConnectionSupervisor;
import ca.gc.cra.beacon.application.pipeline.FeedClient;
import ca.gc.cra.beacon.application.sync.EventStore;
import ca.gc.cra.beacon.domain.event.ChannelId;
import ca.gc.cra.beacon.validation.Net;
import ca.gc.cra.beacon.validation.Numbers;
import ca.gc.cra.beacon.validation.Paths;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Effective feed client configuration, built from the merged key/value map.
 *
 * <p>Durations use millisecond keys ({@code *Ms}); {@code retentionDays} is in days. {@code workers=0} selects the
 * automatic worker count.</p>
 *
 * @param serverUri feed WebSocket endpoint
 * @param stateDir directory holding persisted state
 * @param channels channels to subscribe at startup in addition to stored subscriptions
 * @param settings client tuning
 * @param pingInterval WebSocket ping interval
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint; empty for the environment default
 * @param runDuration how long {@code run} keeps the client up; zero until interrupted
 * @param dryRun print the effective configuration without connecting
 * @since BEACON 0.1
 */
public record FeedConfig(
    URI serverUri,
    Path stateDir,
    List<ChannelId> channels,
    FeedClient.Settings settings,
    Duration pingInterval,
    String metricsExporter,
    String otelEndpoint,
    Duration runDuration,
    boolean dryRun) {

  private static final long MAX_DELAY_MS = Duration.ofDays(1).toMillis();

  public FeedConfig {
    Objects.requireNonNull(serverUri, "serverUri");
    Objects.requireNonNull(stateDir, "stateDir");
    channels = List.copyOf(channels);
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(pingInterval, "pingInterval");
    metricsExporter = metricsExporter == null ? "none" : metricsExporter;
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint;
    Objects.requireNonNull(runDuration, "runDuration");
  }

  /**
   * Builds a configuration from a flat key/value map, typically the merged defaults, YAML, and CLI values.
   *
   * @param map configuration entries; missing keys take their defaults
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static FeedConfig fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    Values values = new Values(map, defaults);

    URI serverUri = Net.validateWebSocketUri("serverUrl", values.text("serverUrl"));
    Path stateDir = Paths.expandHome(values.text("stateDir"));

    EventStore.Settings store = new EventStore.Settings(
        Duration.ofDays(values.number("retentionDays", 1, 3650)),
        values.millis("recentIdWindowMs", 1_000),
        values.millis("storeSaveDelayFastMs", 1),
        values.millis("storeSaveDelaySteadyMs", 1),
        (int) values.number("storeHighUnsavedThreshold", 1, 100_000),
        (int) values.number("storeForceSaveThreshold", 1, 100_000));
    ConnectionSupervisor.Settings connection = new ConnectionSupervisor.Settings(
        values.millis("reconnectBaseDelayMs", 100),
        (int) values.number("maxBackoffMultiplier", 1, 1_000),
        values.millis("settleDelayMs", 0),
        values.millis("duplicateSubscriptionWindowMs", 0),
        values.millis("heartbeatIntervalMs", 100));
    FeedClient.Settings settings = new FeedClient.Settings(
        (int) values.number("workers", 0, 256),
        values.millis("workerIdleWaitMs", 1),
        (int) values.number("ackBatchSize", 1, 10_000),
        values.millis("ackFlushIntervalMs", 10),
        values.millis("syncSaveDelayMs", 1),
        store,
        connection,
        values.millis("catchUpPollIntervalMs", 100),
        (int) values.number("catchUpQuietPolls", 1, 1_000),
        values.millis("signalBatchWindowMs", 1),
        values.millis("retentionSweepIntervalMs", 1_000),
        values.millis("killDetectionGapMs", 1_000),
        values.millis("livenessIntervalMs", 1_000));

    String otelEndpoint = values.raw("otelEndpoint");
    if (!otelEndpoint.isBlank()) {
      Net.validateHttpUri("otelEndpoint", otelEndpoint);
    }
    return new FeedConfig(
        serverUri,
        stateDir,
        parseChannels(values.raw("channels")),
        settings,
        values.millis("pingIntervalMs", 1_000),
        values.text("metricsExporter"),
        otelEndpoint.trim(),
        Duration.ofSeconds(values.number("durationSec", 0, Integer.MAX_VALUE)),
        Boolean.parseBoolean(values.raw("dryRun").trim()));
  }

  /**
   * Parses a comma-separated channel list such as {@code barora_cd,lodna_vd}.
   *
   * @param raw list text; blank yields an empty list
   * @return distinct channels in input order
   * @throws IllegalArgumentException if an entry is not a valid channel key
   */
  public static List<ChannelId> parseChannels(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    Set<ChannelId> channels = new LinkedHashSet<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        channels.add(ChannelId.parse(trimmed));
      }
    }
    return new ArrayList<>(channels);
  }

  /**
   * Returns a printable summary for {@code --dry-run}.
   *
   * @return multi-line description
   */
  public String describe() {
    FeedClient.Settings s = settings;
    return String.join(System.lineSeparator(),
        "serverUrl=" + serverUri,
        "stateDir=" + stateDir,
        "channels=" + channels,
        "workers=" + (s.workers() == 0 ? "auto" : Integer.toString(s.workers())),
        "ackBatchSize=" + s.ackBatchSize() + " ackFlushIntervalMs=" + s.ackFlushInterval().toMillis(),
        "reconnectBaseDelayMs=" + s.connection().reconnectBaseDelay().toMillis()
            + " maxBackoffMultiplier=" + s.connection().maxBackoffMultiplier(),
        "catchUpPollIntervalMs=" + s.catchUpPollInterval().toMillis()
            + " catchUpQuietPolls=" + s.catchUpQuietPolls(),
        "retentionDays=" + s.store().retention().toDays()
            + " killDetectionGapMs=" + s.killDetectionGap().toMillis(),
        "metricsExporter=" + metricsExporter);
  }

  private static final class Values {
    private final Map<String, String> map;
    private final Map<String, String> defaults;

    Values(Map<String, String> map, Map<String, String> defaults) {
      this.map = map;
      this.defaults = defaults;
    }

    String raw(String key) {
      String value = map.get(key);
      if (value == null) {
        value = defaults.getOrDefault(key, "");
      }
      return value;
    }

    String text(String key) {
      String value = raw(key).trim();
      if (value.isEmpty()) {
        value = defaults.getOrDefault(key, "").trim();
      }
      if (value.isEmpty()) {
        throw new IllegalArgumentException(key + " is required");
      }
      return value;
    }

    long number(String key, long min, long max) {
      return Numbers.parseRange(key, text(key), min, max);
    }

    Duration millis(String key, long min) {
      return Duration.ofMillis(number(key, min, MAX_DELAY_MS));
    }
  }
}
