package com.meshtopo.gateway.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite implementation of {@link KeyValueStore}.
 *
 * <p>Each instance owns one table (the namespace) inside a shared database file. The file runs in
 * WAL mode with {@code synchronous=NORMAL}: readers never wait on an in-flight write, and an OS
 * crash may lose the most recent commits without corrupting the file.
 */
public class SqliteKeyValueStore implements KeyValueStore {
  private static final Logger log = LoggerFactory.getLogger(SqliteKeyValueStore.class);
  private static final Pattern NAMESPACE = Pattern.compile("^[A-Za-z0-9_]+$");
  private static final int BUSY_TIMEOUT_MS = 5000;

  private final Path path;
  private final String namespace;
  private final boolean autocommit;
  private final ObjectMapper objectMapper;
  private Connection connection;

  private SqliteKeyValueStore(
      Path path, String namespace, boolean autocommit, ObjectMapper objectMapper, Connection connection) {
    this.path = path;
    this.namespace = namespace;
    this.autocommit = autocommit;
    this.objectMapper = objectMapper;
    this.connection = connection;
  }

  /**
   * Opens (creating if absent) an autocommitting namespace inside the database at {@code path}.
   *
   * @throws StorageUnavailableException when the file cannot be created or opened
   */
  public static SqliteKeyValueStore open(Path path, String namespace) {
    return open(path, namespace, true);
  }

  /**
   * Opens (creating if absent) a namespace inside the database at {@code path}.
   *
   * @param autocommit when false, writes stay pending until {@link #commit()}
   * @throws IllegalArgumentException when the namespace is not {@code [A-Za-z0-9_]+}
   * @throws StorageUnavailableException when the file cannot be created or opened
   */
  public static SqliteKeyValueStore open(Path path, String namespace, boolean autocommit) {
    if (namespace == null || !NAMESPACE.matcher(namespace).matches()) {
      throw new IllegalArgumentException("Namespace must be alphanumeric or underscore: " + namespace);
    }

    Connection connection = null;
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      connection = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
      applyPragmas(connection);
      try (Statement st = connection.createStatement()) {
        // Namespace is validated above; it cannot carry SQL.
        st.execute("CREATE TABLE IF NOT EXISTS " + namespace + " (key TEXT PRIMARY KEY, value TEXT)");
      }
      connection.setAutoCommit(autocommit);
      return new SqliteKeyValueStore(path, namespace, autocommit, new ObjectMapper(), connection);
    } catch (IOException | SQLException | RuntimeException ex) {
      closeQuietly(connection);
      throw new StorageUnavailableException(
          "Failed to open SQLite store " + path + " (namespace " + namespace + ")", ex);
    }
  }

  @Override
  public synchronized Optional<JsonNode> get(String key) {
    Optional<String> raw = readRaw(key);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(raw.get()));
    } catch (JsonProcessingException ex) {
      log.error("Stored value for key {} in {} is not valid JSON; treating it as absent", key, namespace);
      return Optional.empty();
    }
  }

  @Override
  public synchronized <T> Optional<T> get(String key, Class<T> type) {
    Optional<JsonNode> node = get(key);
    if (node.isEmpty() || node.get().isNull()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.treeToValue(node.get(), type));
    } catch (JsonProcessingException ex) {
      log.error("Stored value for key {} in {} does not bind to {}", key, namespace, type.getSimpleName());
      return Optional.empty();
    }
  }

  @Override
  public synchronized void set(String key, Object value) {
    requireKey(key);
    String serialized;
    try {
      JsonNode tree = value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
      if (containsNonFiniteNumber(tree)) {
        throw new IllegalArgumentException(
            "Value for key " + key + " holds a NaN or infinite number, which JSON cannot represent");
      }
      serialized = objectMapper.writeValueAsString(tree);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(
          "Value for key " + key + " is not JSON-serializable: " + typeName(value), ex);
    }

    Connection conn = requireOpen();
    try (PreparedStatement stmt =
        conn.prepareStatement("INSERT OR REPLACE INTO " + namespace + " (key, value) VALUES (?, ?)")) {
      stmt.setString(1, key);
      stmt.setString(2, serialized);
      stmt.executeUpdate();
    } catch (SQLException ex) {
      throw new StorageUnavailableException("Failed to write key " + key + " to " + namespace, ex);
    }
  }

  @Override
  public synchronized boolean remove(String key) {
    requireKey(key);
    Connection conn = requireOpen();
    try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM " + namespace + " WHERE key = ?")) {
      stmt.setString(1, key);
      return stmt.executeUpdate() > 0;
    } catch (SQLException ex) {
      throw new StorageUnavailableException("Failed to delete key " + key + " from " + namespace, ex);
    }
  }

  @Override
  public synchronized boolean containsKey(String key) {
    return readRaw(key).isPresent();
  }

  @Override
  public synchronized Set<String> keys() {
    Set<String> keys = new LinkedHashSet<>();
    Connection conn = requireOpen();
    try (PreparedStatement stmt = conn.prepareStatement("SELECT key FROM " + namespace);
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        keys.add(rs.getString(1));
      }
    } catch (SQLException ex) {
      throw new StorageUnavailableException("Failed to list keys of " + namespace, ex);
    }
    return keys;
  }

  @Override
  public synchronized int size() {
    Connection conn = requireOpen();
    try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM " + namespace);
         ResultSet rs = stmt.executeQuery()) {
      return rs.next() ? rs.getInt(1) : 0;
    } catch (SQLException ex) {
      throw new StorageUnavailableException("Failed to count rows of " + namespace, ex);
    }
  }

  @Override
  public synchronized Map<String, JsonNode> entries() {
    Map<String, JsonNode> entries = new LinkedHashMap<>();
    Connection conn = requireOpen();
    try (PreparedStatement stmt = conn.prepareStatement("SELECT key, value FROM " + namespace);
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        String key = rs.getString(1);
        try {
          entries.put(key, objectMapper.readTree(rs.getString(2)));
        } catch (JsonProcessingException ex) {
          log.error("Skipping undecodable value for key {} in {}", key, namespace);
        }
      }
    } catch (SQLException ex) {
      throw new StorageUnavailableException("Failed to read entries of " + namespace, ex);
    }
    return entries;
  }

  @Override
  public synchronized void commit() {
    if (autocommit) {
      return;
    }
    try {
      requireOpen().commit();
    } catch (SQLException ex) {
      throw new StorageUnavailableException("Failed to commit " + namespace, ex);
    }
  }

  @Override
  public synchronized void close() {
    if (connection == null) {
      return;
    }
    if (!autocommit) {
      try {
        connection.commit();
      } catch (SQLException ex) {
        log.warn("Failed to flush pending writes of {} on close", namespace, ex);
      }
    }
    closeQuietly(connection);
    connection = null;
  }

  public Path path() {
    return path;
  }

  public String namespace() {
    return namespace;
  }

  private Optional<String> readRaw(String key) {
    requireKey(key);
    Connection conn = requireOpen();
    try (PreparedStatement stmt = conn.prepareStatement("SELECT value FROM " + namespace + " WHERE key = ?")) {
      stmt.setString(1, key);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.ofNullable(rs.getString(1));
      }
    } catch (SQLException ex) {
      throw new StorageUnavailableException("Failed to read key " + key + " from " + namespace, ex);
    }
  }

  private Connection requireOpen() {
    if (connection == null) {
      throw new IllegalStateException("Store " + namespace + " is closed");
    }
    return connection;
  }

  private static void requireKey(String key) {
    if (key == null) {
      throw new IllegalArgumentException("Key must not be null");
    }
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }

  private static boolean containsNonFiniteNumber(JsonNode node) {
    if (node.isFloatingPointNumber()) {
      double number = node.doubleValue();
      return Double.isNaN(number) || Double.isInfinite(number);
    }
    for (JsonNode child : node) {
      if (containsNonFiniteNumber(child)) {
        return true;
      }
    }
    return false;
  }

  private static void applyPragmas(Connection connection) throws SQLException {
    try (Statement st = connection.createStatement()) {
      st.execute("PRAGMA journal_mode=WAL");
      st.execute("PRAGMA synchronous=NORMAL");
      st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
      try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
        String mode = rs.next() ? rs.getString(1) : null;
        if (!"wal".equalsIgnoreCase(mode)) {
          throw new SQLException("Expected journal_mode=wal but database reports " + mode);
        }
      }
    }
  }

  private static void closeQuietly(Connection connection) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (SQLException ex) {
      log.debug("Ignoring failure while closing SQLite connection", ex);
    }
  }
}
