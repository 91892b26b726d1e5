package com.meshtopo.gateway.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable string-keyed store whose values are JSON documents.
 *
 * <p>Values are always written as JSON text and read back as Jackson trees or simple bound types,
 * never as arbitrary serialized objects.
 */
public interface KeyValueStore extends AutoCloseable {
  /**
   * Returns the stored value for a key.
   *
   * @param key lookup key
   * @return the decoded JSON value, or empty when the key is absent
   */
  Optional<JsonNode> get(String key);

  /**
   * Returns the stored value for a key bound to {@code type}.
   *
   * @param key lookup key
   * @param type target type (String, Number wrappers, Boolean, Map, List or a plain record)
   * @return the bound value, or empty when the key is absent or cannot be bound
   */
  <T> Optional<T> get(String key, Class<T> type);

  /**
   * Stores a value, replacing any previous value for the key.
   *
   * @throws IllegalArgumentException when the value cannot be represented as JSON
   */
  void set(String key, Object value);

  boolean remove(String key);

  boolean containsKey(String key);

  Set<String> keys();

  int size();

  /** Returns every readable entry; rows that do not decode are skipped. */
  Map<String, JsonNode> entries();

  /** Commits pending writes of a store opened without autocommit. */
  void commit();

  /** Releases the underlying connection. Calling it more than once is a no-op. */
  @Override
  void close();
}
