package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the feed pipeline.
 * <p><strong>Why:</strong> Debounce windows, retention sweeps, the recent-id cache, and kill detection all compare
 * timestamps; tests substitute a manual clock to cross those thresholds deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; workers and scheduled tasks read the clock
 * concurrently.</p>
 *
 * @since BEACON 0.1
 * @see ca.gc.cra.beacon.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current epoch time in seconds, the unit used by event timestamps.
   *
   * @return seconds since 1970-01-01T00:00:00Z
   */
  default long nowSeconds() {
    return nowMillis() / 1_000L;
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
