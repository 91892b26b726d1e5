package com.meshtopo.gateway.message;

import java.util.Locale;

/** Meshtastic JSON message types the gateway distinguishes. */
public enum MessageKind {
  NODEINFO("nodeinfo"),
  POSITION("position"),
  TELEMETRY("telemetry"),
  TRACEROUTE("traceroute"),
  UNRECOGNIZED("");

  private final String wireName;

  MessageKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** Maps the envelope {@code type} field; null, blank or unknown values map to {@link #UNRECOGNIZED}. */
  public static MessageKind fromType(String type) {
    if (type == null || type.isBlank()) {
      return UNRECOGNIZED;
    }
    String normalized = type.trim().toLowerCase(Locale.ROOT);
    for (MessageKind kind : values()) {
      if (kind != UNRECOGNIZED && kind.wireName.equals(normalized)) {
        return kind;
      }
    }
    return UNRECOGNIZED;
  }
}
