package com.meshtopo.gateway.identity;

import com.meshtopo.gateway.config.GatewayProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Read-only view of the per-device configuration: callsign overrides, group overrides and the
 * reporting policy for devices that are not listed.
 *
 * <p>Nothing here touches learned state; the precedence between configured and learned values is
 * expressed once, in {@link #chooseCallsign}.
 */
@Component
public class DeviceRegistry {
  private final Map<String, GatewayProperties.Node> nodes;
  private final boolean allowUnknownDevices;
  private final String defaultGroup;

  public DeviceRegistry(GatewayProperties properties) {
    Map<String, GatewayProperties.Node> normalized = new LinkedHashMap<>();
    properties.getNodes().forEach((id, node) -> {
      if (id != null && node != null) {
        normalized.put(id.trim().toLowerCase(Locale.ROOT), node);
      }
    });
    this.nodes = Collections.unmodifiableMap(normalized);
    this.allowUnknownDevices = properties.getDevices().isAllowUnknownDevices();
    this.defaultGroup = properties.getCaltopo().hasGroup() ? properties.getCaltopo().getGroup().trim() : null;
  }

  /**
   * Picks the callsign for a device: configured override, then long name, then short name, then
   * the hardware id.
   *
   * @return the first non-blank candidate (trimmed), or {@code hardwareId} when all are blank
   */
  public static String chooseCallsign(String override, String longName, String shortName, String hardwareId) {
    for (String candidate : new String[] {override, longName, shortName}) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return hardwareId;
  }

  public Optional<String> configuredCallsign(String hardwareId) {
    return node(hardwareId)
        .map(GatewayProperties.Node::getDeviceId)
        .filter(id -> !id.isBlank())
        .map(String::trim);
  }

  /** Per-device group, else the default group; empty when no group destination is configured. */
  public Optional<String> groupFor(String hardwareId) {
    Optional<String> perDevice = node(hardwareId)
        .map(GatewayProperties.Node::getGroup)
        .filter(group -> !group.isBlank())
        .map(String::trim);
    if (perDevice.isPresent()) {
      return perDevice;
    }
    return Optional.ofNullable(defaultGroup);
  }

  public boolean isRegistered(String hardwareId) {
    return node(hardwareId).isPresent();
  }

  public boolean allowsReporting(String hardwareId) {
    return allowUnknownDevices || isRegistered(hardwareId);
  }

  public boolean allowUnknownDevices() {
    return allowUnknownDevices;
  }

  public Set<String> registeredHardwareIds() {
    return nodes.keySet();
  }

  /** Group identifiers from per-device overrides; they are secrets for log redaction. */
  public Set<String> configuredGroups() {
    Set<String> groups = new LinkedHashSet<>();
    for (GatewayProperties.Node node : nodes.values()) {
      if (node.getGroup() != null && !node.getGroup().isBlank()) {
        groups.add(node.getGroup().trim());
      }
    }
    return groups;
  }

  private Optional<GatewayProperties.Node> node(String hardwareId) {
    if (hardwareId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(nodes.get(hardwareId.trim().toLowerCase(Locale.ROOT)));
  }
}
