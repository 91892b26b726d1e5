package com.meshtopo.gateway.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import org.springframework.stereotype.Component;

/**
 * Parses raw MQTT payloads into {@link MeshMessage}s.
 *
 * <p>Only the envelope is validated here; payload contents are checked by the value types that
 * read them ({@link PositionFix}, {@link NodeInfo}, {@link TelemetryReading}).
 */
@Component
public class MeshMessageDecoder {
  static final long MAX_NODE_NUMBER = 0xFFFFFFFFL;

  private final ObjectMapper objectMapper;

  public MeshMessageDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * @throws MalformedMessageException when the body is not a JSON object or {@code from} is missing,
   *     non-numeric or outside {@code 1..0xFFFFFFFF}
   */
  public MeshMessage decode(byte[] body, boolean retained) {
    if (body == null || body.length == 0) {
      throw new MalformedMessageException("Empty payload");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new MalformedMessageException("Payload is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedMessageException("Payload is not a JSON object");
    }

    long from = parseFrom(root.path("from"));
    JsonNode typeNode = root.path("type");
    String rawType = typeNode.isValueNode() && !typeNode.isNull() ? typeNode.asText() : null;
    JsonNode senderNode = root.path("sender");
    String sender = senderNode.isTextual() ? senderNode.asText() : null;
    return new MeshMessage(from, sender, MessageKind.fromType(rawType), rawType, root.path("payload"), retained);
  }

  private static long parseFrom(JsonNode node) {
    long value;
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      value = node.asLong();
    } else if (node.isTextual() && node.asText().trim().matches("\\d{1,10}")) {
      value = Long.parseLong(node.asText().trim());
    } else if (node.isMissingNode() || node.isNull()) {
      throw new MalformedMessageException("Message has no from field");
    } else {
      throw new MalformedMessageException("Message from field is not an integer");
    }
    if (value < 1 || value > MAX_NODE_NUMBER) {
      throw new MalformedMessageException("Message from field out of range: " + value);
    }
    return value;
  }
}
