package com.meshtopo.gateway.config;

import com.meshtopo.gateway.caltopo.CalTopoReporter;
import com.meshtopo.gateway.identity.DeviceRegistry;
import com.meshtopo.gateway.identity.IdentityResolver;
import com.meshtopo.gateway.mqtt.MqttIngestLoop;
import com.meshtopo.gateway.mqtt.PahoSubscriptionTransport;
import com.meshtopo.gateway.mqtt.SubscriptionTransport;
import com.meshtopo.gateway.runtime.GatewayMessageHandler;
import com.meshtopo.gateway.store.KeyValueStore;
import com.meshtopo.gateway.store.SqliteKeyValueStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(GatewayProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(properties.getCaltopo().getTimeoutMs()))
        .build();
  }

  // Both namespaces live in the same SQLite file.
  @Bean(destroyMethod = "close")
  public KeyValueStore nodeIdStore(GatewayProperties properties) {
    return SqliteKeyValueStore.open(Path.of(properties.getStorage().getDbPath()), IdentityResolver.NODE_ID_NAMESPACE);
  }

  @Bean(destroyMethod = "close")
  public KeyValueStore callsignStore(GatewayProperties properties) {
    return SqliteKeyValueStore.open(Path.of(properties.getStorage().getDbPath()), IdentityResolver.CALLSIGN_NAMESPACE);
  }

  @Bean
  public IdentityResolver identityResolver(
      @Qualifier("nodeIdStore") KeyValueStore nodeIdStore,
      @Qualifier("callsignStore") KeyValueStore callsignStore,
      DeviceRegistry deviceRegistry,
      MeterRegistry meterRegistry) {
    return new IdentityResolver(nodeIdStore, callsignStore, deviceRegistry, meterRegistry);
  }

  @Bean(destroyMethod = "close")
  public CalTopoReporter calTopoReporter(
      GatewayProperties properties,
      DeviceRegistry deviceRegistry,
      MeterRegistry meterRegistry,
      HttpClient httpClient) {
    return new CalTopoReporter(properties, deviceRegistry, meterRegistry, httpClient);
  }

  @Bean
  public SubscriptionTransport subscriptionTransport(GatewayProperties properties) {
    return new PahoSubscriptionTransport(properties.getMqtt());
  }

  @Bean
  public MqttIngestLoop mqttIngestLoop(
      SubscriptionTransport subscriptionTransport,
      GatewayMessageHandler messageHandler,
      GatewayProperties properties,
      MeterRegistry meterRegistry) {
    return new MqttIngestLoop(subscriptionTransport, messageHandler, properties.getMqtt(), meterRegistry);
  }
}
