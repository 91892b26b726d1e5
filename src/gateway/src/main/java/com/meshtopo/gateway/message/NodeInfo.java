package com.meshtopo.gateway.message;

import com.fasterxml.jackson.databind.JsonNode;

/** Metadata a node announces about itself. Every field may be null. */
public record NodeInfo(String id, String longName, String shortName, String hardware, String role) {

  /** @throws MalformedMessageException when the payload is missing or not an object */
  public static NodeInfo fromPayload(JsonNode payload) {
    if (payload == null || !payload.isObject() || payload.size() == 0) {
      throw new MalformedMessageException("Nodeinfo message has no payload");
    }
    return new NodeInfo(
        text(payload, "id"),
        text(payload, "longname"),
        text(payload, "shortname"),
        text(payload, "hardware"),
        text(payload, "role"));
  }

  private static String text(JsonNode payload, String field) {
    JsonNode node = payload.get(field);
    return node == null || node.isNull() || !node.isValueNode() ? null : node.asText();
  }
}
