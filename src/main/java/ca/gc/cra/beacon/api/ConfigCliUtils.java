package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.config.ConfigMerger;
import ca.gc.cra.beacon.config.DefaultsForMode;
import ca.gc.cra.beacon.config.YamlConfigLoader;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import ca.gc.cra.beacon.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers for combining CLI arguments with the optional YAML file and embedded defaults.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Builds the effective configuration for {@code mode}, removing {@code config=PATH} from {@code cli}.
   *
   * @param mode command name
   * @param cli parsed CLI arguments
   * @return merged configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or invalid, or merged values conflict
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli) throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Paths.expandHome(configPath);
      if (!Files.isRegularFile(path)) {
        throw new IllegalArgumentException("config file not found: " + path);
      }
      yaml = YamlConfigLoader.load(path, mode);
      log.debug("Loaded {} YAML keys for {} from {}", yaml.map(Map::size).orElse(0), mode, path);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  /**
   * Applies {@code verbose} and {@code logLevel} from the effective configuration.
   *
   * @param effective merged configuration
   * @throws IllegalArgumentException if {@code logLevel} is not a level name
   */
  static void applyLogging(Map<String, String> effective) {
    if (parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    String level = effective.getOrDefault("logLevel", "");
    if (!level.isBlank()) {
      LoggingConfigurator.applyLevel("ca.gc.cra.beacon", level);
    }
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
