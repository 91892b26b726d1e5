package com.meshtopo.gateway.identity;

import static org.assertj.core.api.Assertions.assertThat;

import com.meshtopo.gateway.config.GatewayProperties;
import org.junit.jupiter.api.Test;

class DeviceRegistryTest {

  @Test
  void callsignPrecedenceIsOverrideThenLongThenShortThenHardwareId() {
    assertThat(DeviceRegistry.chooseCallsign("TEAM-LEAD", "Long", "S", "!00000001")).isEqualTo("TEAM-LEAD");
    assertThat(DeviceRegistry.chooseCallsign(null, " Long ", "S", "!00000001")).isEqualTo("Long");
    assertThat(DeviceRegistry.chooseCallsign("", "  ", "S", "!00000001")).isEqualTo("S");
    assertThat(DeviceRegistry.chooseCallsign(null, null, null, "!00000001")).isEqualTo("!00000001");
  }

  @Test
  void resolvesOverridesAndGroupsCaseInsensitively() {
    GatewayProperties properties = new GatewayProperties();
    properties.getCaltopo().setGroup(" TEAM_ALPHA ");
    properties.getNodes().put("!823A4EDC", new GatewayProperties.Node("TEAM-LEAD", "SARTEAM_B"));
    properties.getNodes().put("!00000002", new GatewayProperties.Node(null, null));

    DeviceRegistry registry = new DeviceRegistry(properties);

    assertThat(registry.configuredCallsign("!823a4edc")).hasValue("TEAM-LEAD");
    assertThat(registry.groupFor("!823a4edc")).hasValue("SARTEAM_B");
    assertThat(registry.configuredCallsign("!00000002")).isEmpty();
    assertThat(registry.groupFor("!00000002")).hasValue("TEAM_ALPHA");
    assertThat(registry.groupFor("!ffffffff")).hasValue("TEAM_ALPHA");
    assertThat(registry.configuredGroups()).containsExactly("SARTEAM_B");
  }

  @Test
  void unknownDevicesAreRejectedOnlyWhenPolicyForbidsThem() {
    GatewayProperties properties = new GatewayProperties();
    properties.getNodes().put("!823a4edc", new GatewayProperties.Node("TEAM-LEAD", null));

    assertThat(new DeviceRegistry(properties).allowsReporting("!ffffffff")).isTrue();

    properties.getDevices().setAllowUnknownDevices(false);
    DeviceRegistry strict = new DeviceRegistry(properties);
    assertThat(strict.allowsReporting("!ffffffff")).isFalse();
    assertThat(strict.allowsReporting("!823a4edc")).isTrue();
    assertThat(strict.groupFor("!823a4edc")).isEmpty();
  }
}
