package io.intellixity.polydb.jdbc.sqlite;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RelationshipType;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.model.StorageUnit;
import io.intellixity.polydb.query.WhereConditions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SqlitePluginTest {

  @TempDir
  Path dir;

  private final SqlitePlugin plugin = new SqlitePlugin();
  private PluginConfig config;
  private Path file;

  @BeforeEach
  void setUp() throws SQLException {
    file = dir.resolve("polydb.db");
    config = PluginConfig.of(new Credentials(DatabaseType.SQLITE, null, null, null, null, file.toString()))
        .withTimeout(Duration.ofSeconds(5));
    exec("CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT)",
        "INSERT INTO users VALUES (1, 'Alice'), (2, 'Bob')");
  }

  private void exec(String... statements) throws SQLException {
    try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + file);
         Statement st = c.createStatement()) {
      for (String s : statements) st.execute(s);
    }
  }

  @Test
  void filtersRowsByEquality() {
    RowsResult r = plugin.getRows(config, "main", "users", WhereConditions.eq("name", "Bob"), 10, 0);
    assertEquals(List.of(List.of("2", "Bob")), r.rows());
    assertEquals(List.of("id", "name"), r.columnNames());
    assertEquals("INTEGER", r.columns().get(0).type());
  }

  @Test
  void fileIsTheOnlyDatabaseAndMainTheOnlySchema() {
    List<String> dbs = plugin.getDatabases(config);
    assertEquals(1, dbs.size());
    assertTrue(dbs.get(0).endsWith("polydb.db"), dbs.get(0));
    assertEquals(List.of("main"), plugin.getAllSchemas(config));

    assertEquals(plugin.getStorageUnits(config, "main"), plugin.getStorageUnits(config, null));
    EngineException ex = assertThrows(EngineException.class, () -> plugin.getStorageUnits(config, "public"));
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
    assertEquals("getStorageUnits", ex.operation());
  }

  @Test
  void missingFilePathIsMalformedInput() {
    PluginConfig noFile = PluginConfig.of(new Credentials(DatabaseType.SQLITE, null, null, null, null, " "));
    EngineException ex = assertThrows(EngineException.class, () -> plugin.getAllSchemas(noFile));
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
    assertFalse(plugin.isAvailable(noFile));
    assertTrue(plugin.isAvailable(config));
  }

  @Test
  void filePathCannotCarryDriverOptions() {
    PluginConfig withOptions = PluginConfig.of(
        new Credentials(DatabaseType.SQLITE, null, null, null, null, "app.db?open_mode=1"));
    EngineException ex = assertThrows(EngineException.class, () -> plugin.getAllSchemas(withOptions));
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
  }

  @Test
  void pagesCoverEveryRowExactlyOnce() throws SQLException {
    for (int i = 3; i <= 11; i++) exec("INSERT INTO users VALUES (" + i + ", 'u" + i + "')");
    List<List<String>> all = new ArrayList<>();
    for (int offset = 0; ; offset += 4) {
      RowsResult page = plugin.getRows(config, "main", "users", null, 4, offset);
      if (page.rows().isEmpty()) break;
      assertTrue(page.rows().size() <= 4);
      all.addAll(page.rows());
    }
    assertEquals(11, all.size());
    assertEquals(plugin.getRows(config, "main", "users", null, 100, 0).rows(), all);
  }

  @Test
  void typedValuesRoundTripAndFilter() throws SQLException {
    exec("CREATE TABLE events (id INTEGER PRIMARY KEY, flag BOOLEAN, at DATETIME, score REAL)");
    assertTrue(plugin.addRow(config, "main", "events", List.of(
        Record.of("id", "1"), Record.of("flag", "true"), Record.of("at", "2024-01-02T03:04:05"), Record.of("score", "1.5"))));
    assertTrue(plugin.addRow(config, "main", "events", List.of(
        Record.of("id", "2"), Record.of("flag", "no"), Record.of("at", "2023-06-30 12:00:00"), Record.of("score", ""))));

    RowsResult flagged = plugin.getRows(config, "main", "events", WhereConditions.eq("flag", "yes"), 10, 0);
    assertEquals(List.of(List.of("1", "true", "2024-01-02 03:04:05", "1.5")), flagged.rows());

    RowsResult recent = plugin.getRows(config, "main", "events", WhereConditions.ge("at", "2024-01-01"), 10, 0);
    assertEquals(1, recent.rows().size());
    assertEquals("1", recent.rows().get(0).get(0));

    RowsResult noScore = plugin.getRows(config, "main", "events", WhereConditions.isNull("score"), 10, 0);
    assertEquals(List.of(Arrays.asList("2", "false", "2023-06-30 12:00:00", null)), noScore.rows());

    RowsResult in = plugin.getRows(config, "main", "events", WhereConditions.in("id", List.of("2", "3")), 10, 0);
    assertEquals(1, in.rows().size());
  }

  @Test
  void likeMatchesAndLeavesInputUninterpreted() {
    assertEquals(1, plugin.getRows(config, "main", "users", WhereConditions.like("name", "Al%"), 10, 0).rows().size());
    assertEquals(0, plugin.getRows(config, "main", "users",
        WhereConditions.eq("name", "x' OR '1'='1"), 10, 0).rows().size());
  }

  @Test
  void createdUnitAcceptsRowsAndEdits() {
    assertTrue(plugin.addStorageUnit(config, "main", "notes", List.of(
        new Record("id", "INTEGER", Map.of(Record.PRIMARY, "true")),
        new Record("body", "TEXT", Map.of(Record.NULLABLE, "false")))));
    StorageUnit notes = plugin.getStorageUnits(config, "main").stream()
        .filter(u -> u.name().equals("notes")).findFirst().orElseThrow();
    assertEquals("TEXT", notes.attribute("body"));

    assertTrue(plugin.addRow(config, "main", "notes", List.of(Record.of("id", "7"), Record.of("body", "hello"))));
    assertTrue(plugin.updateStorageUnit(config, "main", "notes", Map.of("id", "7", "body", "bye"), List.of("body")));
    assertEquals(List.of(List.of("7", "bye")), plugin.getRows(config, "main", "notes", null, 10, 0).rows());

    assertThrows(EngineException.class, () -> plugin.deleteRow(config, "main", "notes", Map.of()));
    assertTrue(plugin.deleteRow(config, "main", "notes", Map.of("id", "7")));
    assertFalse(plugin.deleteRow(config, "main", "notes", Map.of("id", "7")));
    assertTrue(plugin.getRows(config, "main", "notes", null, 10, 0).rows().isEmpty());
  }

  @Test
  void rawExecuteRollsBackOnFailure() {
    RowsResult update = plugin.rawExecute(config, "UPDATE users SET name = 'x' WHERE id = 1");
    assertEquals(List.of(List.of("1")), update.rows());

    EngineException ex = assertThrows(EngineException.class, () -> plugin.rawExecute(config, "SELEC nonsense"));
    assertEquals(ErrorKind.EXECUTION_FAILURE, ex.kind());
    assertEquals(DatabaseType.SQLITE, ex.type());

    RowsResult select = plugin.rawExecute(config, "SELECT name FROM users ORDER BY id");
    assertTrue(select.disableUpdate());
    assertEquals(List.of(List.of("x"), List.of("Bob")), select.rows());
  }

  @Test
  void classifiesRelationships() throws SQLException {
    exec("CREATE TABLE profiles (id INTEGER PRIMARY KEY, user_id INTEGER UNIQUE REFERENCES users(id))",
        "CREATE TABLE orders (id INTEGER PRIMARY KEY, user_id INTEGER REFERENCES users(id))",
        "CREATE TABLE roles (id INTEGER PRIMARY KEY, label TEXT)",
        "CREATE TABLE user_roles (user_id INTEGER REFERENCES users(id), role_id INTEGER REFERENCES roles)");

    Map<String, GraphUnit> byName = new HashMap<>();
    for (GraphUnit u : plugin.getGraph(config, "main")) byName.put(u.name(), u);

    assertFalse(byName.containsKey("user_roles"));
    assertEquals(RelationshipType.ONE_TO_ONE, byName.get("profiles").relationTo("users"));
    assertEquals(RelationshipType.ONE_TO_ONE, byName.get("users").relationTo("profiles"));
    assertEquals(RelationshipType.MANY_TO_ONE, byName.get("orders").relationTo("users"));
    assertEquals(RelationshipType.ONE_TO_MANY, byName.get("users").relationTo("orders"));
    assertEquals(RelationshipType.MANY_TO_MANY, byName.get("users").relationTo("roles"));
    assertNull(byName.get("roles").relationTo("orders"));
  }
}
