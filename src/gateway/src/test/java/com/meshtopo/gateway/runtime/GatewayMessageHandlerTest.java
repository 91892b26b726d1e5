package com.meshtopo.gateway.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshtopo.gateway.caltopo.CalTopoReporter;
import com.meshtopo.gateway.config.GatewayProperties;
import com.meshtopo.gateway.identity.DeviceRegistry;
import com.meshtopo.gateway.identity.IdentityResolver;
import com.meshtopo.gateway.message.MeshMessageDecoder;
import com.meshtopo.gateway.mqtt.InboundPayload;
import com.meshtopo.gateway.store.SqliteKeyValueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GatewayMessageHandlerTest {
  @TempDir
  Path tempDir;

  private SqliteKeyValueStore nodeIds;
  private SqliteKeyValueStore callsigns;
  private CalTopoReporter reporter;
  private GatewayStatistics statistics;

  private GatewayMessageHandler handler(GatewayProperties properties) {
    Path db = tempDir.resolve("state.sqlite");
    nodeIds = SqliteKeyValueStore.open(db, IdentityResolver.NODE_ID_NAMESPACE);
    callsigns = SqliteKeyValueStore.open(db, IdentityResolver.CALLSIGN_NAMESPACE);
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    DeviceRegistry registry = new DeviceRegistry(properties);
    reporter = mock(CalTopoReporter.class);
    when(reporter.sendPositionUpdate(anyString(), anyDouble(), anyDouble(), any())).thenReturn(true);
    when(reporter.hasGroupDestination()).thenReturn(properties.getCaltopo().hasGroup());
    statistics = new GatewayStatistics(meterRegistry);
    return new GatewayMessageHandler(
        new MeshMessageDecoder(new ObjectMapper()),
        new IdentityResolver(nodeIds, callsigns, registry, meterRegistry),
        registry,
        reporter,
        statistics);
  }

  @AfterEach
  void closeStores() {
    if (nodeIds != null) {
      nodeIds.close();
      callsigns.close();
    }
  }

  private static InboundPayload inbound(String json) {
    return inbound(json, false);
  }

  private static InboundPayload inbound(String json, boolean retained) {
    return new InboundPayload("msh/US/2/json/LongFast/!deadbeef", json.getBytes(StandardCharsets.UTF_8), retained);
  }

  @Test
  void positionFromUnknownNodeUsesDerivedHardwareIdAsCallsign() {
    GatewayMessageHandler handler = handler(new GatewayProperties());

    handler.handle(inbound("""
        {"from": 305419896, "type": "position", "payload": {"latitude_i": 612188460, "longitude_i": -1499001320}}
        """));

    verify(reporter).sendPositionUpdate(eq("!1234abcd"), eq(61.218846), eq(-149.900132), isNull());
    assertThat(nodeIds.get("305419896", String.class)).hasValue("!1234abcd");
    GatewayStatistics.Snapshot snapshot = statistics.snapshot();
    assertThat(snapshot.messagesProcessed()).isEqualTo(1);
    assertThat(snapshot.positionUpdatesSent()).isEqualTo(1);
  }

  @Test
  void nodeInfoNamesLaterPositions() {
    GatewayMessageHandler handler = handler(new GatewayProperties());

    handler.handle(inbound("""
        {"from": 862485920, "type": "nodeinfo",
         "payload": {"id": "!33687da0", "longname": "AMRG3-Heltec", "shortname": "AMR3"}}
        """));
    handler.handle(inbound("""
        {"from": 862485920, "type": "position", "payload": {"latitude_i": 100000000, "longitude_i": 200000000}}
        """));

    verify(reporter).sendPositionUpdate(eq("AMRG3-Heltec"), eq(10.0), eq(20.0), isNull());
  }

  @Test
  void groupComesFromDeviceOverrideWhenGroupDestinationExists() {
    GatewayProperties properties = new GatewayProperties();
    properties.getCaltopo().setGroup("TEAM_ALPHA");
    properties.getNodes().put("!1234abcd", new GatewayProperties.Node("TEAM-LEAD", "SARTEAM_B"));
    GatewayMessageHandler handler = handler(properties);

    handler.handle(inbound("""
        {"from": 305419896, "type": "position", "payload": {"latitude_i": 1, "longitude_i": 2}}
        """));
    handler.handle(inbound("""
        {"from": 305419897, "type": "position", "payload": {"latitude_i": 1, "longitude_i": 2}}
        """));

    verify(reporter).sendPositionUpdate(eq("TEAM-LEAD"), anyDouble(), anyDouble(), eq("SARTEAM_B"));
    verify(reporter).sendPositionUpdate(eq("!1234abce"), anyDouble(), anyDouble(), eq("TEAM_ALPHA"));
  }

  @Test
  void unregisteredDeviceIsRejectedWhenPolicyForbidsUnknownDevices() {
    GatewayProperties properties = new GatewayProperties();
    properties.getDevices().setAllowUnknownDevices(false);
    GatewayMessageHandler handler = handler(properties);

    handler.handle(inbound("""
        {"from": 862485920, "type": "nodeinfo", "payload": {"id": "!33687da0", "longname": "Stranger"}}
        """));
    handler.handle(inbound("""
        {"from": 862485920, "type": "position", "payload": {"latitude_i": 1, "longitude_i": 2}}
        """));

    verify(reporter, never()).sendPositionUpdate(anyString(), anyDouble(), anyDouble(), any());
    assertThat(statistics.snapshot().policyRejections()).isEqualTo(1);
    // metadata is still learned
    assertThat(callsigns.get("!33687da0", String.class)).hasValue("Stranger");
  }

  @Test
  void rejectedUnknownDeviceLeavesNoNodeIdMapping() {
    GatewayProperties properties = new GatewayProperties();
    properties.getDevices().setAllowUnknownDevices(false);
    properties.getNodes().put("!1234abcd", new GatewayProperties.Node("TEAM-LEAD", null));
    GatewayMessageHandler handler = handler(properties);

    handler.handle(inbound("""
        {"from": 305419897, "type": "position", "payload": {"latitude_i": 1, "longitude_i": 2}}
        """));
    handler.handle(inbound("""
        {"from": 305419896, "type": "position", "payload": {"latitude_i": 1, "longitude_i": 2}}
        """));

    assertThat(nodeIds.containsKey("305419897")).isFalse();
    assertThat(nodeIds.get("305419896", String.class)).hasValue("!1234abcd");
    verify(reporter).sendPositionUpdate(eq("TEAM-LEAD"), anyDouble(), anyDouble(), isNull());
    assertThat(statistics.snapshot().policyRejections()).isEqualTo(1);
  }

  @Test
  void malformedMessagesAreCountedAndDropped() {
    GatewayMessageHandler handler = handler(new GatewayProperties());

    handler.handle(inbound("{broken"));
    handler.handle(inbound("{\"type\": \"position\"}"));
    handler.handle(inbound("{\"from\": 1, \"type\": \"position\", \"payload\": {\"latitude_i\": 5}}"));

    verify(reporter, never()).sendPositionUpdate(anyString(), anyDouble(), anyDouble(), any());
    GatewayStatistics.Snapshot snapshot = statistics.snapshot();
    assertThat(snapshot.messagesReceived()).isEqualTo(3);
    assertThat(snapshot.malformedMessages()).isEqualTo(3);
    assertThat(snapshot.messagesProcessed()).isZero();
  }

  @Test
  void retainedPositionsAreNotReported() {
    GatewayMessageHandler handler = handler(new GatewayProperties());

    handler.handle(inbound("""
        {"from": 305419896, "type": "position", "payload": {"latitude_i": 1, "longitude_i": 2}}
        """, true));

    verify(reporter, never()).sendPositionUpdate(anyString(), anyDouble(), anyDouble(), any());
  }

  @Test
  void telemetryTracerouteAndUnknownTypesHaveNoSideEffects() {
    GatewayMessageHandler handler = handler(new GatewayProperties());

    handler.handle(inbound("{\"from\": 1, \"type\": \"telemetry\", \"payload\": {\"battery_level\": 80}}"));
    handler.handle(inbound("{\"from\": 1, \"type\": \"traceroute\", \"payload\": {\"route\": [1, 2]}}"));
    handler.handle(inbound("{\"from\": 1, \"type\": \"range_test\", \"payload\": {}}"));
    handler.handle(inbound("{\"from\": 1, \"type\": \"\"}"));

    verify(reporter, never()).sendPositionUpdate(anyString(), anyDouble(), anyDouble(), any());
    assertThat(nodeIds.size()).isZero();
    assertThat(statistics.snapshot().messagesProcessed()).isEqualTo(2);
  }

  @Test
  void failedDeliveryIsCounted() {
    GatewayMessageHandler handler = handler(new GatewayProperties());
    when(reporter.sendPositionUpdate(anyString(), anyDouble(), anyDouble(), any())).thenReturn(false);

    handler.handle(inbound("{\"from\": 7, \"type\": \"position\", \"payload\": {\"latitude_i\": 1, \"longitude_i\": 2}}"));

    assertThat(statistics.snapshot().positionUpdatesFailed()).isEqualTo(1);
  }
}
