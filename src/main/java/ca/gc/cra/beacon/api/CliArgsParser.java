package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.logging.Logs;
import ca.gc.cra.beacon.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable map, split on the first {@code '='}.
 * <p>Stateless and thread-safe.</p>
 *
 * @since BEACON 0.1
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  private static final int MAX_VALUE_LENGTH = 4_096;

  private CliArgsParser() {}

  /**
   * Parses arguments such as {@code serverUrl=ws://host:2222/ws channels=barora_cd,lodna_vd}.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable map in argument order; later duplicates win
   * @throws IllegalArgumentException if an argument is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + Logs.truncate(raw, 64) + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + Logs.truncate(key, 64));
      }
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      if (value.length() > MAX_VALUE_LENGTH) {
        throw new IllegalArgumentException(key + " must be at most " + MAX_VALUE_LENGTH + " characters");
      }
      map.put(key, value);
    }
    return map;
  }
}
