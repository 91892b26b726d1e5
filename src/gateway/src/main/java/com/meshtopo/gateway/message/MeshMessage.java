package com.meshtopo.gateway.message;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded Meshtastic JSON envelope.
 *
 * @param from numeric sender id, the only field identity is derived from
 * @param sender gateway-reported sender string; informational only
 * @param kind message type
 * @param rawType the {@code type} field as received (may be null)
 * @param payload the {@code payload} object, or a missing node when absent
 * @param retained whether the broker delivered this as a retained message
 */
public record MeshMessage(
  long from,
  String sender,
  MessageKind kind,
  String rawType,
  JsonNode payload,
  boolean retained
) {
  public boolean hasPayload() {
    return payload != null && payload.isObject() && payload.size() > 0;
  }
}
