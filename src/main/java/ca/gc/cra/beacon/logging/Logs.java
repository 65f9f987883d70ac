package ca.gc.cra.beacon.logging;

/**
 * Keeps raw feed frames and user input short enough to log.
 *
 * @since BEACON 0.1
 */
public final class Logs {
  private Logs() {}

  /**
   * Shortens {@code value} to at most {@code maxChars} characters followed by the original length.
   *
   * <p>A surrogate pair is never split at the cut point.</p>
   *
   * @param value text to shorten; {@code null} is rendered as {@code "<null>"}
   * @param maxChars characters to keep; must be positive
   * @return {@code value} itself when it already fits
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return "<null>";
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int cut = Character.isHighSurrogate(value.charAt(maxChars - 1)) ? maxChars - 1 : maxChars;
    return value.substring(0, cut) + "... (" + value.length() + " chars)";
  }
}
