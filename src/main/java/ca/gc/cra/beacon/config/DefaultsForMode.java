package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each BEACON CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI overrides; every key a mode reads
 * appears here.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged with the common defaults.
   *
   * @param mode CLI mode ({@code run}, {@code status}, {@code channels}, {@code reset-client})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "status", "reset-client" -> Map.of();
      case "channels" -> Map.of("area", "");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("stateDir", "~/.beacon/state");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    map.put("logLevel", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("serverUrl", "ws://localhost:2222/ws");
    map.put("channels", "");
    map.put("workers", "0");
    map.put("workerIdleWaitMs", "5");
    map.put("ackBatchSize", "50");
    map.put("ackFlushIntervalMs", "100");
    map.put("reconnectBaseDelayMs", "5000");
    map.put("maxBackoffMultiplier", "12");
    map.put("settleDelayMs", "500");
    map.put("duplicateSubscriptionWindowMs", "5000");
    map.put("heartbeatIntervalMs", "10000");
    map.put("pingIntervalMs", "30000");
    map.put("syncSaveDelayMs", "500");
    map.put("storeSaveDelayFastMs", "250");
    map.put("storeSaveDelaySteadyMs", "2000");
    map.put("storeHighUnsavedThreshold", "20");
    map.put("storeForceSaveThreshold", "50");
    map.put("retentionDays", "7");
    map.put("retentionSweepIntervalMs", Long.toString(6L * 60 * 60 * 1000));
    map.put("recentIdWindowMs", Long.toString(5L * 60 * 1000));
    map.put("killDetectionGapMs", Long.toString(2L * 60 * 1000));
    map.put("livenessIntervalMs", "60000");
    map.put("catchUpPollIntervalMs", "5000");
    map.put("catchUpQuietPolls", "3");
    map.put("signalBatchWindowMs", "500");
    map.put("durationSec", "0");
    map.put("dryRun", "false");
    return map;
  }
}
