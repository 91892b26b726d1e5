package com.meshtopo.gateway.mqtt;

import com.meshtopo.gateway.config.GatewayProperties;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SubscriptionTransport} backed by the Eclipse Paho MQTT v3 client.
 *
 * <p>Paho's own automatic reconnect stays off: the ingest loop owns reconnection so that backoff
 * and resubscription follow one policy.
 */
public class PahoSubscriptionTransport implements SubscriptionTransport {
  private static final Logger log = LoggerFactory.getLogger(PahoSubscriptionTransport.class);

  private final GatewayProperties.Mqtt properties;

  public PahoSubscriptionTransport(GatewayProperties.Mqtt properties) {
    this.properties = properties;
  }

  @Override
  public InboundStream open(String topicFilter) throws TransportException {
    MqttClient client;
    try {
      client = new MqttClient(serverUri(), properties.getClientId(), new MemoryPersistence());
    } catch (MqttException ex) {
      throw new TransportException("Cannot create MQTT client for " + describe(), ex);
    }

    PahoStream stream = new PahoStream(client);
    client.setCallback(stream);
    try {
      client.connect(connectOptions());
      client.subscribe(topicFilter, properties.getQos());
    } catch (MqttException ex) {
      stream.close();
      throw new TransportException("MQTT connect/subscribe to " + describe() + " failed", ex);
    }
    return stream;
  }

  @Override
  public String describe() {
    return properties.getBroker() + ":" + properties.getPort();
  }

  String serverUri() {
    return "tcp://" + properties.getBroker() + ":" + properties.getPort();
  }

  MqttConnectOptions connectOptions() {
    MqttConnectOptions options = new MqttConnectOptions();
    options.setCleanSession(true);
    options.setAutomaticReconnect(false);
    options.setKeepAliveInterval(properties.getKeepaliveSeconds());
    if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
      options.setUserName(properties.getUsername());
      String password = properties.getPassword() == null ? "" : properties.getPassword();
      options.setPassword(password.toCharArray());
    }
    return options;
  }

  static final class PahoStream implements InboundStream, MqttCallback {
    private static final InboundPayload CONNECTION_LOST = new InboundPayload("", new byte[0], false);

    private final MqttClient client;
    private final BlockingQueue<InboundPayload> queue = new LinkedBlockingQueue<>();
    private volatile Throwable lostCause;

    PahoStream(MqttClient client) {
      this.client = client;
    }

    @Override
    public InboundPayload next(Duration timeout) throws TransportException, InterruptedException {
      InboundPayload payload = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (payload == CONNECTION_LOST) {
        throw new TransportException("MQTT connection lost", lostCause);
      }
      return payload;
    }

    @Override
    public void connectionLost(Throwable cause) {
      lostCause = cause;
      queue.offer(CONNECTION_LOST);
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
      queue.offer(new InboundPayload(topic, message.getPayload(), message.isRetained()));
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
      // Subscribe-only client.
    }

    @Override
    public void close() {
      try {
        if (client.isConnected()) {
          client.disconnect();
        }
      } catch (MqttException ex) {
        log.debug("MQTT disconnect failed", ex);
      }
      try {
        client.close();
      } catch (MqttException ex) {
        log.debug("MQTT client close failed", ex);
      }
    }
  }
}
