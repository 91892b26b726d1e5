package com.meshtopo.gateway.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteKeyValueStoreTest {
  @TempDir
  Path tempDir;

  @Test
  void missingKeyIsEmpty() {
    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(tempDir.resolve("state.sqlite"), "mapping")) {
      assertThat(store.get("nope")).isEmpty();
      assertThat(store.get("nope", String.class)).isEmpty();
      assertThat(store.containsKey("nope")).isFalse();
      assertThat(store.size()).isZero();
    }
  }

  @Test
  void valuesSurviveReopen() {
    Path db = tempDir.resolve("nested/dir/state.sqlite");
    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(db, "node_id_mapping")) {
      store.set("305419896", "!1234abcd");
      store.set("counts", Map.of("a", 1));
      store.set("list", List.of(1, 2, 3));
    }

    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(db, "node_id_mapping")) {
      assertThat(store.get("305419896", String.class)).hasValue("!1234abcd");
      assertThat(store.get("counts").orElseThrow().path("a").asInt()).isEqualTo(1);
      assertThat(store.get("list").orElseThrow().size()).isEqualTo(3);
      assertThat(store.keys()).containsExactlyInAnyOrder("305419896", "counts", "list");
    }
  }

  @Test
  void lastWriteWins() {
    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(tempDir.resolve("state.sqlite"), "mapping")) {
      store.set("!33687da0", "first");
      store.set("!33687da0", "AMRG3-Heltec");
      assertThat(store.get("!33687da0", String.class)).hasValue("AMRG3-Heltec");
      assertThat(store.size()).isEqualTo(1);
    }
  }

  @Test
  void namespacesInOneFileAreIndependent() {
    Path db = tempDir.resolve("state.sqlite");
    try (SqliteKeyValueStore ids = SqliteKeyValueStore.open(db, "node_id_mapping");
         SqliteKeyValueStore callsigns = SqliteKeyValueStore.open(db, "callsign_mapping")) {
      ids.set("k", "id");
      callsigns.set("k", "callsign");
      assertThat(ids.get("k", String.class)).hasValue("id");
      assertThat(callsigns.get("k", String.class)).hasValue("callsign");
      assertThat(ids.remove("k")).isTrue();
      assertThat(ids.remove("k")).isFalse();
      assertThat(callsigns.containsKey("k")).isTrue();
    }
  }

  @Test
  void rejectsNamespaceThatIsNotAnIdentifier() {
    assertThatThrownBy(() -> SqliteKeyValueStore.open(tempDir.resolve("state.sqlite"), "x; DROP TABLE y"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsValuesThatAreNotJson() {
    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(tempDir.resolve("state.sqlite"), "mapping")) {
      assertThatThrownBy(() -> store.set("k", new Object()))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> store.set("k", Double.NaN))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> store.set("k", Double.POSITIVE_INFINITY))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> store.set("k", Map.of("lat", Float.NEGATIVE_INFINITY)))
          .isInstanceOf(IllegalArgumentException.class);
      assertThat(store.containsKey("k")).isFalse();
    }
  }

  @Test
  void unusablePathIsReportedAsStorageUnavailable() throws Exception {
    Path directory = Files.createDirectory(tempDir.resolve("not-a-file"));
    assertThatThrownBy(() -> SqliteKeyValueStore.open(directory, "mapping"))
        .isInstanceOf(StorageUnavailableException.class);
  }

  @Test
  void corruptRowIsTreatedAsAbsent() throws Exception {
    Path db = tempDir.resolve("state.sqlite");
    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(db, "mapping")) {
      store.set("good", "value");
    }
    try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
         Statement st = connection.createStatement()) {
      st.execute("INSERT INTO mapping (key, value) VALUES ('bad', '{not json')");
    }

    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(db, "mapping")) {
      assertThat(store.get("bad")).isEmpty();
      assertThat(store.entries()).containsOnlyKeys("good");
    }
  }

  @Test
  void batchedWritesAreVisibleAfterCommitAndClose() {
    Path db = tempDir.resolve("state.sqlite");
    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(db, "mapping", false)) {
      store.set("a", "1");
      store.commit();
      store.set("b", "2");
    }
    try (SqliteKeyValueStore store = SqliteKeyValueStore.open(db, "mapping")) {
      assertThat(store.keys()).containsExactlyInAnyOrder("a", "b");
    }
  }

  @Test
  void closeIsIdempotentAndLaterUseFails() {
    SqliteKeyValueStore store = SqliteKeyValueStore.open(tempDir.resolve("state.sqlite"), "mapping");
    store.close();
    store.close();
    assertThatThrownBy(() -> store.get("k")).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> store.set("k", "v")).isInstanceOf(IllegalStateException.class);
  }
}
