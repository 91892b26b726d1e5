package com.meshtopo.gateway.mqtt;

/** Opens subscriptions against a message broker. */
public interface SubscriptionTransport {

  /**
   * Connects and subscribes to {@code topicFilter}.
   *
   * @throws TransportException when the broker cannot be reached or refuses the subscription
   */
  InboundStream open(String topicFilter) throws TransportException;

  /** Human-readable broker address for logs. */
  String describe();
}
