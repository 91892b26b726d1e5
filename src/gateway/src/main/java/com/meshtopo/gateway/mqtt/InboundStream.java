package com.meshtopo.gateway.mqtt;

import java.time.Duration;

/** An active subscription. Messages come out in broker delivery order. */
public interface InboundStream extends AutoCloseable {

  /**
   * Waits up to {@code timeout} for the next message.
   *
   * @return the next message, or {@code null} when none arrived in time
   * @throws TransportException when the connection has been lost
   */
  InboundPayload next(Duration timeout) throws TransportException, InterruptedException;

  /** Disconnects; never throws. */
  @Override
  void close();
}
