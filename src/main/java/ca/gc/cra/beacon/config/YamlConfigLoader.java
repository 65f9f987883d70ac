package ca.gc.cra.beacon.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads BEACON configuration from YAML and flattens the {@code common} section plus the active mode's section into
 * one key/value map.
 *
 * <p>Nested mappings become dotted keys. A YAML list is joined with commas, so {@code channels} may be written
 * either as {@code barora_cd,lodna_vd} or as a list.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} for {@code mode}.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode whose section is merged over {@code common}
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<?, ?> sections = mapping(document, "YAML root");
    Map<String, String> values = new LinkedHashMap<>();
    mergeSection(sections, "common", values);
    mergeSection(sections, mode.trim().toLowerCase(Locale.ROOT), values);
    return Optional.of(Map.copyOf(values));
  }

  private static void mergeSection(Map<?, ?> sections, String name, Map<String, String> values) {
    sections.forEach((key, section) -> {
      if (key instanceof String label && label.trim().equalsIgnoreCase(name) && section != null) {
        addEntries(mapping(section, name + " section"), "", values);
      }
    });
  }

  private static Map<?, ?> mapping(Object node, String what) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(what + " must be a mapping");
  }

  private static void addEntries(Map<?, ?> section, String prefix, Map<String, String> values) {
    for (Map.Entry<?, ?> entry : section.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("YAML keys must be non-blank strings (under '" + prefix + "')");
      }
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        addEntries(nested, key, values);
      } else if (value instanceof Iterable<?> items) {
        List<String> parts = new ArrayList<>();
        items.forEach(item -> parts.add(scalar(key, item)));
        values.put(key, String.join(",", parts));
      } else {
        values.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static String scalar(String key, Object item) {
    if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
      throw new IllegalArgumentException("YAML list for key " + key + " must hold scalars");
    }
    return String.valueOf(item);
  }
}
