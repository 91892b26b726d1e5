package com.meshtopo.gateway.message;

/** An inbound payload that cannot be decoded into a usable mesh message. */
public class MalformedMessageException extends RuntimeException {
  public MalformedMessageException(String message) {
    super(message);
  }

  public MalformedMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
