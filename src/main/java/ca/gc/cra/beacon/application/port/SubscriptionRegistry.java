package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.event.Subscription;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the user's channel subscriptions consumed by the feed pipeline.
 *
 * <p>Implementations must be safe for concurrent reads from every ingestion worker.</p>
 *
 * @since BEACON 0.1
 */
public interface SubscriptionRegistry {
  /**
   * Returns every current subscription.
   *
   * @return snapshot list in registry order
   */
  List<Subscription> subscriptions();

  /**
   * Looks up one subscription.
   *
   * @param channelKey {@code "{area}_{type}"} key
   * @return subscription, or empty when not subscribed
   */
  Optional<Subscription> find(String channelKey);

  /**
   * Reports whether events for {@code channelKey} should be stored.
   *
   * @param channelKey {@code "{area}_{type}"} key
   * @return {@code true} when subscribed
   */
  default boolean isSubscribed(String channelKey) {
    return find(channelKey).isPresent();
  }

  /**
   * Reports whether alerts for {@code channelKey} are muted.
   *
   * @param channelKey {@code "{area}_{type}"} key
   * @return {@code true} when subscribed and muted
   */
  default boolean isMuted(String channelKey) {
    return find(channelKey).map(Subscription::muted).orElse(false);
  }
}
