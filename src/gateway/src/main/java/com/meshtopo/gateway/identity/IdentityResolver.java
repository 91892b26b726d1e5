package com.meshtopo.gateway.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshtopo.gateway.store.KeyValueStore;
import com.meshtopo.gateway.support.LogSanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves numeric node numbers to hardware ids and hardware ids to callsigns.
 *
 * <p>Two persistent mappings back the resolution:
 * <ul>
 *   <li>{@code node_id_mapping}: numeric node number (decimal string) to hardware id</li>
 *   <li>{@code callsign_mapping}: hardware id to callsign</li>
 * </ul>
 *
 * <p>Both are mirrored in memory so the position path does not hit SQLite on every packet. All
 * mutation goes through this class. Resolution never fails: a sender with no metadata resolves to
 * the hardware id derived from its node number, and that id doubles as its callsign.
 */
public class IdentityResolver {
  public static final String NODE_ID_NAMESPACE = "node_id_mapping";
  public static final String CALLSIGN_NAMESPACE = "callsign_mapping";

  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

  private final KeyValueStore nodeIdStore;
  private final KeyValueStore callsignStore;
  private final DeviceRegistry deviceRegistry;
  private final Map<String, String> nodeIdCache = new ConcurrentHashMap<>();
  private final Map<String, String> callsignCache = new ConcurrentHashMap<>();
  private final Counter derivedCounter;
  private final Counter learnedCounter;

  public IdentityResolver(
      KeyValueStore nodeIdStore,
      KeyValueStore callsignStore,
      DeviceRegistry deviceRegistry,
      MeterRegistry meterRegistry) {
    this.nodeIdStore = nodeIdStore;
    this.callsignStore = callsignStore;
    this.deviceRegistry = deviceRegistry;
    this.derivedCounter = meterRegistry.counter("gateway.identity.derived.total");
    this.learnedCounter = meterRegistry.counter("gateway.identity.learned.total");

    warm(nodeIdStore, nodeIdCache, true);
    warm(callsignStore, callsignCache, false);
    log.info(
        "Loaded {} node id mappings and {} callsign mappings",
        nodeIdCache.size(),
        callsignCache.size());
  }

  /**
   * Records what a nodeinfo packet says about a sender.
   *
   * <p>The reported hardware id wins over any derived one. When the packet carries no usable id the
   * sender's current (possibly derived) hardware id is used instead. The callsign is stored with the
   * usual precedence; when neither an override nor a name is available nothing is stored and the
   * hardware id keeps serving as callsign.
   *
   * @return the callsign now in effect for the sender
   */
  public String onMetadata(long numericId, String hardwareId, String longName, String shortName) {
    String key = Long.toString(numericId);
    String resolvedHardwareId = HardwareIds.normalize(hardwareId).orElse(null);
    if (resolvedHardwareId == null) {
      if (hardwareId != null && !hardwareId.isBlank()) {
        log.warn(
            "Ignoring malformed hardware id {} from node {}",
            LogSanitizer.sanitize(hardwareId),
            numericId);
      }
      resolvedHardwareId = resolveHardwareId(numericId);
    } else {
      persistNodeId(key, resolvedHardwareId);
    }

    String learned = DeviceRegistry.chooseCallsign(
        deviceRegistry.configuredCallsign(resolvedHardwareId).orElse(null), longName, shortName, null);
    if (learned != null) {
      if (persistCallsign(resolvedHardwareId, learned)) {
        learnedCounter.increment();
      }
    }
    log.debug(
        "Mapped node {} to {} ({})",
        numericId,
        resolvedHardwareId,
        LogSanitizer.sanitize(learned));
    return resolveCallsign(resolvedHardwareId);
  }

  /**
   * Returns the hardware id for a numeric node number: memory, then SQLite, then derivation.
   * A derived id is cached and persisted, so derivation happens once per node number.
   */
  public String resolveHardwareId(long numericId) {
    Optional<String> known = knownHardwareId(numericId);
    if (known.isPresent()) {
      return known.get();
    }

    String derived = HardwareIds.fromNumericId(numericId);
    persistNodeId(Long.toString(numericId), derived);
    derivedCounter.increment();
    log.debug("No metadata for node {}; derived hardware id {}", numericId, derived);
    return derived;
  }

  /** Same lookup as {@link #resolveHardwareId} but a derived id is neither cached nor persisted. */
  public String peekHardwareId(long numericId) {
    return knownHardwareId(numericId).orElseGet(() -> HardwareIds.fromNumericId(numericId));
  }

  /** Configured override, else the learned callsign, else the hardware id itself. */
  public String resolveCallsign(String hardwareId) {
    Optional<String> configured = deviceRegistry.configuredCallsign(hardwareId);
    if (configured.isPresent()) {
      return configured.get();
    }
    return learnedCallsign(hardwareId).orElse(hardwareId);
  }

  /**
   * Callsign lookup used on the position path. Same precedence as {@link #resolveCallsign}, with a
   * log line when an unconfigured device falls back to its hardware id.
   */
  public String getOrCreateCallsign(String hardwareId) {
    Optional<String> configured = deviceRegistry.configuredCallsign(hardwareId);
    if (configured.isPresent()) {
      return configured.get();
    }
    Optional<String> learned = learnedCallsign(hardwareId);
    if (learned.isPresent()) {
      return learned.get();
    }
    if (!deviceRegistry.isRegistered(hardwareId)) {
      log.info("No callsign known for device {}; using hardware id as callsign", hardwareId);
    } else {
      log.warn("Registered device {} has no device-id; using hardware id as callsign", hardwareId);
    }
    return hardwareId;
  }

  public IdentityState state(long numericId) {
    String key = Long.toString(numericId);
    String hardwareId = nodeIdCache.get(key);
    if (hardwareId == null) {
      hardwareId = nodeIdStore.get(key, String.class).flatMap(HardwareIds::normalize).orElse(null);
    }
    if (hardwareId == null) {
      return IdentityState.UNKNOWN;
    }
    if (deviceRegistry.configuredCallsign(hardwareId).isPresent() || learnedCallsign(hardwareId).isPresent()) {
      return IdentityState.CALLSIGN_KNOWN;
    }
    return IdentityState.HARDWARE_ID_KNOWN;
  }

  public int knownNodeCount() {
    return nodeIdCache.size();
  }

  private Optional<String> knownHardwareId(long numericId) {
    String key = Long.toString(numericId);
    String cached = nodeIdCache.get(key);
    if (cached != null) {
      return Optional.of(cached);
    }
    Optional<String> stored = nodeIdStore.get(key, String.class).flatMap(HardwareIds::normalize);
    stored.ifPresent(hardwareId -> nodeIdCache.put(key, hardwareId));
    return stored;
  }

  private Optional<String> learnedCallsign(String hardwareId) {
    if (hardwareId == null) {
      return Optional.empty();
    }
    String cached = callsignCache.get(hardwareId);
    if (cached != null) {
      return Optional.of(cached);
    }
    Optional<String> stored = callsignStore.get(hardwareId, String.class).filter(value -> !value.isBlank());
    stored.ifPresent(value -> callsignCache.put(hardwareId, value));
    return stored;
  }

  private void persistNodeId(String key, String hardwareId) {
    if (hardwareId.equals(nodeIdCache.get(key))) {
      return;
    }
    nodeIdCache.put(key, hardwareId);
    nodeIdStore.set(key, hardwareId);
  }

  private boolean persistCallsign(String hardwareId, String callsign) {
    if (callsign.equals(callsignCache.get(hardwareId))) {
      return false;
    }
    callsignCache.put(hardwareId, callsign);
    callsignStore.set(hardwareId, callsign);
    return true;
  }

  private static void warm(KeyValueStore store, Map<String, String> cache, boolean hardwareIds) {
    for (Map.Entry<String, JsonNode> entry : store.entries().entrySet()) {
      JsonNode value = entry.getValue();
      if (value == null || !value.isTextual() || value.asText().isBlank()) {
        continue;
      }
      if (hardwareIds) {
        HardwareIds.normalize(value.asText()).ifPresent(id -> cache.put(entry.getKey(), id));
      } else {
        cache.put(entry.getKey(), value.asText());
      }
    }
  }
}
