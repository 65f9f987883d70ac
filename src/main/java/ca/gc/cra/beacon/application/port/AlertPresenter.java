package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.event.AlertEvent;
import ca.gc.cra.beacon.domain.event.Subscription;

/**
 * Presents new alerts to the user (system notification, console line, and so on).
 *
 * <p>Only invoked for unmuted channels, on the UI dispatch thread.</p>
 *
 * @since BEACON 0.1
 */
public interface AlertPresenter {
  /**
   * Presents the latest alert of a channel.
   *
   * @param event latest stored event
   * @param subscription subscription the event was delivered for
   */
  void present(AlertEvent event, Subscription subscription);

  /** Presenter that shows nothing. */
  AlertPresenter NONE = (event, subscription) -> {};
}
