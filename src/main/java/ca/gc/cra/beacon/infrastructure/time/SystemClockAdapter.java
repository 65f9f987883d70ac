package ca.gc.cra.beacon.infrastructure.time;

import ca.gc.cra.beacon.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link Clock}; the system UTC clock unless one is supplied.
 *
 * @since BEACON 0.1
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over a specific clock, such as {@link Clock#fixed}.
   *
   * @param clock source of instants
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }
}
