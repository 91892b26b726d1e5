package com.meshtopo.gateway.mqtt;

/** Receives every message taken off the subscription, one at a time, in arrival order. */
@FunctionalInterface
public interface InboundHandler {
  void handle(InboundPayload payload);
}
