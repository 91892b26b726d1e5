package com.meshtopo.gateway.message;

import com.fasterxml.jackson.databind.JsonNode;

/** Coordinates from a position payload, in decimal degrees. */
public record PositionFix(double latitude, double longitude, Integer altitude) {
  private static final double SCALE = 1e7;

  /**
   * Reads {@code latitude_i}/{@code longitude_i} (degrees times 1e7).
   *
   * @throws MalformedMessageException when either coordinate is missing, non-numeric or out of range
   */
  public static PositionFix fromPayload(JsonNode payload) {
    if (payload == null || !payload.isObject() || payload.size() == 0) {
      throw new MalformedMessageException("Position message has no payload");
    }
    JsonNode latNode = payload.path("latitude_i");
    JsonNode lonNode = payload.path("longitude_i");
    if (!latNode.isNumber() || !lonNode.isNumber()) {
      throw new MalformedMessageException("Position message has no coordinates");
    }
    double latitude = latNode.asDouble() / SCALE;
    double longitude = lonNode.asDouble() / SCALE;
    if (latitude < -90.0 || latitude > 90.0 || longitude < -180.0 || longitude > 180.0) {
      throw new MalformedMessageException(
          "Position out of range: lat=" + latitude + " lng=" + longitude);
    }
    JsonNode altitudeNode = payload.path("altitude");
    Integer altitude = altitudeNode.isIntegralNumber() ? altitudeNode.asInt() : null;
    return new PositionFix(latitude, longitude, altitude);
  }
}
