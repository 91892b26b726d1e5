package com.meshtopo.gateway.mqtt;

/** Connection-level failure of the subscription transport: connect, subscribe or a dropped link. */
public class TransportException extends Exception {
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
