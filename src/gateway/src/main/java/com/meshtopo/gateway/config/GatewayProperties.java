package com.meshtopo.gateway.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the gateway.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code gateway.*} prefix. Node keys contain a leading {@code !}, so YAML maps must use the
 * bracket form ({@code "[!823a4edc]"}) to keep the character through relaxed binding.
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {
  private final Mqtt mqtt = new Mqtt();
  private final CalTopo caltopo = new CalTopo();
  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final Devices devices = new Devices();
  private final Storage storage = new Storage();
  private final Stats stats = new Stats();

  public Mqtt getMqtt() {
    return mqtt;
  }

  public CalTopo getCaltopo() {
    return caltopo;
  }

  public Map<String, Node> getNodes() {
    return nodes;
  }

  public Devices getDevices() {
    return devices;
  }

  public Storage getStorage() {
    return storage;
  }

  public Stats getStats() {
    return stats;
  }

  /** MQTT broker connection and subscription settings. */
  public static class Mqtt {
    private String broker = "localhost";
    private int port = 1883;
    private String username = "";
    private String password = "";
    private String topic = "msh/US/2/json/+/+";
    private String clientId = "meshtopo-gateway";
    private int keepaliveSeconds = 60;
    private int qos = 0;
    private long pollTimeoutMs = 1000;
    private final Reconnect reconnect = new Reconnect();

    public String getBroker() {
      return broker;
    }

    public void setBroker(String broker) {
      this.broker = broker;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(String topic) {
      this.topic = topic;
    }

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public int getKeepaliveSeconds() {
      return keepaliveSeconds;
    }

    public void setKeepaliveSeconds(int keepaliveSeconds) {
      this.keepaliveSeconds = keepaliveSeconds;
    }

    public int getQos() {
      return qos;
    }

    public void setQos(int qos) {
      this.qos = qos;
    }

    public long getPollTimeoutMs() {
      return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
    }

    public Reconnect getReconnect() {
      return reconnect;
    }
  }

  /** Reconnect backoff for the MQTT subscription. */
  public static class Reconnect {
    private long initialDelayMs = 1000;
    private long maxDelayMs = 60000;

    public long getInitialDelayMs() {
      return initialDelayMs;
    }

    public void setInitialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  /** CalTopo position-report destinations and delivery tuning. */
  public static class CalTopo {
    private String connectKey;
    private String group;
    private String baseUrl = "https://caltopo.com/api/v1/position/report";
    private List<String> allowedUrlPatterns = new ArrayList<>();
    private long timeoutMs = 10000;
    private final Retry retry = new Retry();

    public String getConnectKey() {
      return connectKey;
    }

    public void setConnectKey(String connectKey) {
      this.connectKey = connectKey;
    }

    public String getGroup() {
      return group;
    }

    public void setGroup(String group) {
      this.group = group;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public List<String> getAllowedUrlPatterns() {
      return allowedUrlPatterns;
    }

    public void setAllowedUrlPatterns(List<String> allowedUrlPatterns) {
      this.allowedUrlPatterns = allowedUrlPatterns;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public Retry getRetry() {
      return retry;
    }

    public boolean hasConnectKey() {
      return connectKey != null && !connectKey.isBlank();
    }

    public boolean hasGroup() {
      return group != null && !group.isBlank();
    }
  }

  /** Bounded exponential backoff for retryable CalTopo responses. */
  public static class Retry {
    private int maxAttempts = 4;
    private long baseDelayMs = 1000;
    private long maxDelayMs = 30000;
    private long jitterMs = 500;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }

    public long getJitterMs() {
      return jitterMs;
    }

    public void setJitterMs(long jitterMs) {
      this.jitterMs = jitterMs;
    }
  }

  /** Per-device overrides keyed by hardware id. */
  public static class Node {
    private String deviceId;
    private String group;

    public Node() {}

    public Node(String deviceId, String group) {
      this.deviceId = deviceId;
      this.group = group;
    }

    public String getDeviceId() {
      return deviceId;
    }

    public void setDeviceId(String deviceId) {
      this.deviceId = deviceId;
    }

    public String getGroup() {
      return group;
    }

    public void setGroup(String group) {
      this.group = group;
    }
  }

  /** Reporting policy for devices that are not listed under {@code nodes}. */
  public static class Devices {
    private boolean allowUnknownDevices = true;

    public boolean isAllowUnknownDevices() {
      return allowUnknownDevices;
    }

    public void setAllowUnknownDevices(boolean allowUnknownDevices) {
      this.allowUnknownDevices = allowUnknownDevices;
    }
  }

  /** Location of the identity-mapping database. */
  public static class Storage {
    private String dbPath = "meshtopo_state.sqlite";

    public String getDbPath() {
      return dbPath;
    }

    public void setDbPath(String dbPath) {
      this.dbPath = dbPath;
    }
  }

  public static class Stats {
    private long logIntervalMs = 60000;

    public long getLogIntervalMs() {
      return logIntervalMs;
    }

    public void setLogIntervalMs(long logIntervalMs) {
      this.logIntervalMs = logIntervalMs;
    }
  }
}
