package ca.gc.cra.beacon.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts BEACON runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> Operators raise verbosity while diagnosing reconnect loops or catch-up stalls without
 * editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since BEACON 0.1
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level level name such as {@code INFO} or {@code DEBUG}
   * @return {@code true} when the backend accepted the change
   * @throws IllegalArgumentException if {@code level} is not a Logback level name
   */
  public static boolean applyLevel(String loggerName, String level) {
    Level parsed = parseLevel(level);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      if (!parsed.equals(target.getLevel())) {
        target.setLevel(parsed);
      }
      return true;
    }
    log.warn("Logging level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }

  private static Level parseLevel(String level) {
    if (level == null || level.isBlank()) {
      throw new IllegalArgumentException("logLevel must not be blank");
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    Level parsed = Level.toLevel(normalized, null);
    if (parsed == null) {
      throw new IllegalArgumentException("logLevel must be one of TRACE, DEBUG, INFO, WARN, ERROR, OFF");
    }
    return parsed;
  }
}
