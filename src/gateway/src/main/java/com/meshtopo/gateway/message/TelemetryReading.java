package com.meshtopo.gateway.message;

import com.fasterxml.jackson.databind.JsonNode;

/** Device metrics from a telemetry payload; logged only. */
public record TelemetryReading(
  Double batteryLevel,
  Double voltage,
  Long uptimeSeconds,
  Double airUtilTx,
  Double channelUtilization
) {

  /** @throws MalformedMessageException when the payload is missing or not an object */
  public static TelemetryReading fromPayload(JsonNode payload) {
    if (payload == null || !payload.isObject() || payload.size() == 0) {
      throw new MalformedMessageException("Telemetry message has no payload");
    }
    return new TelemetryReading(
        number(payload, "battery_level"),
        number(payload, "voltage"),
        payload.path("uptime_seconds").isNumber() ? payload.path("uptime_seconds").asLong() : null,
        number(payload, "air_util_tx"),
        number(payload, "channel_utilization"));
  }

  private static Double number(JsonNode payload, String field) {
    JsonNode node = payload.get(field);
    return node == null || !node.isNumber() ? null : node.asDouble();
  }
}
