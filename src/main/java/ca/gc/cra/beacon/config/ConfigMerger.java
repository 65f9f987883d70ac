package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {
  private static final Set<String> CLI_ONLY_KEYS = Set.of("config", "verbose", "dryRun");

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn receives a notice when a CLI key overrides a YAML key, or a key is unknown
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> notices = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.containsKey(entry.getKey())) {
        notices.accept("Ignoring unknown YAML key: " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        notices.accept("CLI overrides YAML for key: " + key);
      } else if (!defaultsCopy.containsKey(key) && !CLI_ONLY_KEYS.contains(key)) {
        notices.accept("Unknown key for " + mode + ": " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"run".equalsIgnoreCase(mode)) {
      return;
    }
    long fast = parseLong(effective.get("storeSaveDelayFastMs"));
    long steady = parseLong(effective.get("storeSaveDelaySteadyMs"));
    if (fast > 0 && steady > 0 && fast > steady) {
      throw new IllegalArgumentException("storeSaveDelayFastMs must not exceed storeSaveDelaySteadyMs");
    }
    long high = parseLong(effective.get("storeHighUnsavedThreshold"));
    long force = parseLong(effective.get("storeForceSaveThreshold"));
    if (high > 0 && force > 0 && high > force) {
      throw new IllegalArgumentException("storeHighUnsavedThreshold must not exceed storeForceSaveThreshold");
    }
  }

  private static long parseLong(String value) {
    if (value == null || value.isBlank()) {
      return -1L;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return -1L;
    }
  }
}
