package com.meshtopo.gateway.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshtopo.gateway.caltopo.CalTopoReporter;
import com.meshtopo.gateway.identity.DeviceRegistry;
import com.meshtopo.gateway.identity.IdentityResolver;
import com.meshtopo.gateway.message.MalformedMessageException;
import com.meshtopo.gateway.message.MeshMessage;
import com.meshtopo.gateway.message.MeshMessageDecoder;
import com.meshtopo.gateway.message.NodeInfo;
import com.meshtopo.gateway.message.PositionFix;
import com.meshtopo.gateway.message.TelemetryReading;
import com.meshtopo.gateway.mqtt.InboundHandler;
import com.meshtopo.gateway.mqtt.InboundPayload;
import com.meshtopo.gateway.store.StorageUnavailableException;
import com.meshtopo.gateway.support.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes decoded mesh messages.
 *
 * <ul>
 *   <li>nodeinfo: learns the sender's hardware id and callsign</li>
 *   <li>position: resolves identity, applies the device policy and reports to CalTopo</li>
 *   <li>telemetry, traceroute: logged only</li>
 * </ul>
 *
 * <p>Faults caused by message content are logged and counted here; storage failures propagate.
 */
@Component
public class GatewayMessageHandler implements InboundHandler {
  private static final Logger log = LoggerFactory.getLogger(GatewayMessageHandler.class);

  private final MeshMessageDecoder decoder;
  private final IdentityResolver identityResolver;
  private final DeviceRegistry deviceRegistry;
  private final CalTopoReporter reporter;
  private final GatewayStatistics statistics;

  public GatewayMessageHandler(
      MeshMessageDecoder decoder,
      IdentityResolver identityResolver,
      DeviceRegistry deviceRegistry,
      CalTopoReporter reporter,
      GatewayStatistics statistics) {
    this.decoder = decoder;
    this.identityResolver = identityResolver;
    this.deviceRegistry = deviceRegistry;
    this.reporter = reporter;
    this.statistics = statistics;
  }

  @Override
  public void handle(InboundPayload inbound) {
    statistics.messageReceived();
    MeshMessage message;
    try {
      message = decoder.decode(inbound.payload(), inbound.retained());
    } catch (MalformedMessageException ex) {
      statistics.malformedMessage();
      log.warn("Dropping malformed message on {}: {}", LogSanitizer.sanitize(inbound.topic()), ex.getMessage());
      return;
    }

    try {
      if (route(message)) {
        statistics.messageProcessed();
      }
    } catch (MalformedMessageException ex) {
      statistics.malformedMessage();
      log.warn(
          "Dropping {} message from {}: {}",
          message.kind().wireName(),
          message.from(),
          LogSanitizer.sanitize(ex.getMessage()));
    } catch (StorageUnavailableException ex) {
      statistics.error();
      throw ex;
    } catch (RuntimeException ex) {
      statistics.error();
      log.error("Error processing {} message from {}", message.kind().wireName(), message.from(), ex);
    }
  }

  /** @return false for message kinds the gateway does not handle */
  private boolean route(MeshMessage message) {
    switch (message.kind()) {
      case NODEINFO:
        onNodeInfo(message);
        return true;
      case POSITION:
        onPosition(message);
        return true;
      case TELEMETRY:
        onTelemetry(message);
        return true;
      case TRACEROUTE:
        onTraceroute(message);
        return true;
      default:
        if (message.rawType() == null || message.rawType().isBlank()) {
          log.debug("Message with empty type from {}, skipping", message.from());
        } else {
          log.debug(
              "Unsupported message type from {}: {}",
              message.from(),
              LogSanitizer.sanitize(message.rawType()));
        }
        return false;
    }
  }

  private void onNodeInfo(MeshMessage message) {
    NodeInfo info = NodeInfo.fromPayload(message.payload());
    String callsign = identityResolver.onMetadata(message.from(), info.id(), info.longName(), info.shortName());
    log.info(
        "Node info from {}: id={} name={} ({}) hardware={} role={} -> callsign {}",
        message.from(),
        LogSanitizer.sanitize(info.id()),
        LogSanitizer.sanitize(info.longName()),
        LogSanitizer.sanitize(info.shortName()),
        LogSanitizer.sanitize(info.hardware()),
        LogSanitizer.sanitize(info.role()),
        LogSanitizer.sanitize(callsign));
  }

  private void onPosition(MeshMessage message) {
    if (message.retained()) {
      log.debug("Skipping retained position from {}", message.from());
      return;
    }
    PositionFix fix = PositionFix.fromPayload(message.payload());
    String candidate = identityResolver.peekHardwareId(message.from());
    if (!deviceRegistry.allowsReporting(candidate)) {
      statistics.policyRejection();
      log.info("Ignoring position from unregistered device {} (unknown devices are not allowed)", candidate);
      return;
    }
    String hardwareId = identityResolver.resolveHardwareId(message.from());

    String callsign = identityResolver.getOrCreateCallsign(hardwareId);
    String group = reporter.hasGroupDestination() ? deviceRegistry.groupFor(hardwareId).orElse(null) : null;
    log.debug(
        "Position from {} ({}): {}, {}",
        hardwareId,
        LogSanitizer.sanitize(callsign),
        fix.latitude(),
        fix.longitude());
    boolean delivered = reporter.sendPositionUpdate(callsign, fix.latitude(), fix.longitude(), group);
    statistics.positionUpdate(delivered);
  }

  private void onTelemetry(MeshMessage message) {
    TelemetryReading reading = TelemetryReading.fromPayload(message.payload());
    log.info(
        "Telemetry from {}: battery={}% voltage={}V uptime={}s airUtilTx={} channelUtil={}%",
        message.from(),
        reading.batteryLevel(),
        reading.voltage(),
        reading.uptimeSeconds(),
        reading.airUtilTx(),
        reading.channelUtilization());
  }

  private void onTraceroute(MeshMessage message) {
    if (!message.hasPayload()) {
      throw new MalformedMessageException("Traceroute message has no payload");
    }
    JsonNode route = message.payload().path("route");
    log.info(
        "Traceroute from {}: route={}",
        message.from(),
        route.isMissingNode() ? "[]" : LogSanitizer.sanitize(route));
  }
}
