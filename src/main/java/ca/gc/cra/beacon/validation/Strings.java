package ca.gc.cra.beacon.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by BEACON configuration and CLI layers.
 * <p><strong>Why:</strong> Keeps channel tokens and CLI values free of blanks and control
 * characters before they reach the wire or the state directory.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Normalize channel tokens (area and event type) to lower-case alphanumerics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since BEACON 0.1
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TOKEN_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Normalizes a channel token (an area or an event type) to lower case and validates its alphabet.
   *
   * @param name logical parameter name for diagnostics
   * @param token candidate token such as {@code "barora"} or {@code "cd"}
   * @return lower-case token of letters, digits, and hyphens
   * @throws IllegalArgumentException if the token is blank or contains other characters
   */
  public static String requireChannelToken(String name, String token) {
    String sanitized = requireNonBlank(name, token).toLowerCase(Locale.ROOT);
    if (!TOKEN_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "must only contain letters, digits, or hyphen"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
