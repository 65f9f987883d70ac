package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.event.AlertEvent;

/**
 * Receives "channel updated" signals on the UI dispatch thread.
 *
 * @since BEACON 0.1
 */
@FunctionalInterface
public interface ChannelUpdateListener {
  /**
   * Called after one or more events were stored for {@code channelKey}.
   *
   * @param channelKey {@code "{area}_{type}"} key
   * @param latest most recent event stored since the previous signal
   */
  void onChannelUpdated(String channelKey, AlertEvent latest);
}
