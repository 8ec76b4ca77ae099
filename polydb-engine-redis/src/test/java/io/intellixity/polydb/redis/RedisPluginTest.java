package io.intellixity.polydb.redis;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.model.StorageUnit;
import io.intellixity.polydb.query.WhereConditions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.ZAddParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.resps.Tuple;

import java.util.AbstractMap.SimpleEntry;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

final class RedisPluginTest {

  private final PluginConfig config = PluginConfig.of(new Credentials(DatabaseType.REDIS, null, null, null, null, null));

  private Jedis jedis;
  private RedisPlugin plugin;

  @BeforeEach
  void setUp() {
    jedis = mock(Jedis.class);
    when(jedis.type(anyString())).thenReturn("none");
    plugin = new RedisPlugin(cfg -> jedis);
  }

  @Test
  void listsKeysSortedWithTypeAndSize() {
    when(jedis.scan(eq("0"), any(ScanParams.class))).thenReturn(new ScanResult<>("0", List.of("user:2", "user:1")));
    when(jedis.type("user:1")).thenReturn("hash");
    when(jedis.type("user:2")).thenReturn("string");
    when(jedis.hlen("user:1")).thenReturn(3L);
    when(jedis.strlen("user:2")).thenReturn(11L);

    List<StorageUnit> units = plugin.getStorageUnits(config, "0");

    assertEquals(List.of("user:1", "user:2"), units.stream().map(StorageUnit::name).toList());
    assertEquals("hash", units.get(0).attribute("Type"));
    assertEquals("3", units.get(0).attribute("Size"));
    assertEquals("11", units.get(1).attribute("Size"));
    verify(jedis, never()).select(anyInt());
    verify(jedis).close();
  }

  @Test
  void keyScanStopsAtScanLimit() {
    when(jedis.scan(eq("0"), any(ScanParams.class))).thenReturn(new ScanResult<>("17", List.of("c", "b", "a")));
    when(jedis.type(anyString())).thenReturn("set");

    List<StorageUnit> units = plugin.getStorageUnits(config.withOption(RedisPlugin.OPTION_SCAN_LIMIT, "2"), null);

    assertEquals(List.of("b", "c"), units.stream().map(StorageUnit::name).toList());
  }

  @Test
  void schemaSelectsLogicalDatabase() {
    when(jedis.scan(eq("0"), any(ScanParams.class))).thenReturn(new ScanResult<>("0", List.of()));

    assertTrue(plugin.getStorageUnits(config, "3").isEmpty());
    verify(jedis).select(3);
  }

  @Test
  void nonNumericSchemaIsMalformedInput() {
    EngineException e = assertThrows(EngineException.class, () -> plugin.getStorageUnits(config, "public"));
    assertEquals(ErrorKind.MALFORMED_INPUT, e.kind());
    assertEquals(DatabaseType.REDIS, e.type());
  }

  @Test
  void hashRowsAreSortedFilteredAndPaged() {
    when(jedis.type("h")).thenReturn("hash");
    when(jedis.hscan(eq("h"), eq("0"), any(ScanParams.class))).thenReturn(new ScanResult<>("0", List.<Map.Entry<String, String>>of(
        new SimpleEntry<>("c", "3"), new SimpleEntry<>("a", "1"), new SimpleEntry<>("b", "2"))));

    RowsResult all = plugin.getRows(config, "0", "h", null, 10, 0);
    assertEquals(List.of("field", "value"), all.columnNames());
    assertEquals(List.of(List.of("a", "1"), List.of("b", "2"), List.of("c", "3")), all.rows());

    RowsResult page = plugin.getRows(config, "0", "h", WhereConditions.ne("field", "b"), 1, 1);
    assertEquals(List.of(List.of("c", "3")), page.rows());
    assertFalse(page.disableUpdate());
  }

  @Test
  void listIndexFiltersNumerically() {
    when(jedis.type("jobs")).thenReturn("list");
    when(jedis.lrange("jobs", 0, 9_999)).thenReturn(List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k"));

    RowsResult r = plugin.getRows(config, "0", "jobs", WhereConditions.ge("index", "9"), 10, 0);

    assertEquals(List.of("index", "value"), r.columnNames());
    assertEquals(List.of(List.of("9", "j"), List.of("10", "k")), r.rows());
  }

  @Test
  void zsetRowsCarryScores() {
    when(jedis.type("board")).thenReturn("zset");
    when(jedis.zrangeWithScores("board", 0, 9_999)).thenReturn(List.of(new Tuple("ann", 1.5), new Tuple("bob", 7.0)));

    RowsResult r = plugin.getRows(config, "0", "board", WhereConditions.gt("score", "2"), 10, 0);

    assertEquals(List.of("member", "score"), r.columnNames());
    assertEquals(List.of(List.of("bob", "7.0")), r.rows());
  }

  @Test
  void filterOnUnknownColumnIsMalformed() {
    when(jedis.type("name")).thenReturn("string");
    when(jedis.get("name")).thenReturn("polydb");

    EngineException e = assertThrows(EngineException.class,
        () -> plugin.getRows(config, "0", "name", WhereConditions.eq("field", "x"), 10, 0));
    assertEquals(ErrorKind.MALFORMED_FILTER, e.kind());
  }

  @Test
  void missingKeyIsMalformedInput() {
    EngineException e = assertThrows(EngineException.class, () -> plugin.getRows(config, "0", "ghost", null, 10, 0));
    assertEquals(ErrorKind.MALFORMED_INPUT, e.kind());
    assertEquals("ghost", e.subject());
  }

  @Test
  void createsHashKeyWithFirstRow() {
    when(jedis.exists("cfg")).thenReturn(false);
    when(jedis.hsetnx("cfg", "mode", "fast")).thenReturn(1L);

    assertTrue(plugin.addStorageUnit(config, "0", "cfg",
        List.of(Record.of("Type", "hash"), Record.of("field", "mode"), Record.of("value", "fast"))));
  }

  @Test
  void creatingNonStringKeyWithoutRowIsRejected() {
    EngineException e = assertThrows(EngineException.class,
        () -> plugin.addStorageUnit(config, "0", "tags", List.of(Record.of("Type", "set"))));
    assertEquals(ErrorKind.MALFORMED_INPUT, e.kind());
  }

  @Test
  void addsZsetMemberOnlyWhenAbsent() {
    when(jedis.type("board")).thenReturn("zset");
    when(jedis.zadd(eq("board"), eq(4.0), eq("cid"), any(ZAddParams.class))).thenReturn(1L);

    assertTrue(plugin.addRow(config, "0", "board", List.of(Record.of("member", "cid"), Record.of("score", "4"))));

    EngineException e = assertThrows(EngineException.class,
        () -> plugin.addRow(config, "0", "board", List.of(Record.of("member", "cid"), Record.of("score", "high"))));
    assertEquals(ErrorKind.MALFORMED_INPUT, e.kind());
  }

  @Test
  void updatesExistingHashFieldOnly() {
    when(jedis.type("h")).thenReturn("hash");
    when(jedis.hexists("h", "a")).thenReturn(true);
    when(jedis.hexists("h", "zz")).thenReturn(false);

    assertTrue(plugin.updateStorageUnit(config, "0", "h", Map.of("field", "a", "value", "9"), List.of("value")));
    verify(jedis).hset("h", "a", "9");

    assertFalse(plugin.updateStorageUnit(config, "0", "h", Map.of("field", "zz", "value", "9"), List.of("value")));
  }

  @Test
  void setMembersCannotBeUpdated() {
    when(jedis.type("tags")).thenReturn("set");

    EngineException e = assertThrows(EngineException.class,
        () -> plugin.updateStorageUnit(config, "0", "tags", Map.of("value", "x"), List.of("value")));
    assertEquals(ErrorKind.MALFORMED_INPUT, e.kind());
  }

  @Test
  void deletesListElementByValue() {
    when(jedis.type("jobs")).thenReturn("list");
    when(jedis.lrem("jobs", 1, "b")).thenReturn(1L);

    assertTrue(plugin.deleteRow(config, "0", "jobs", Map.of("index", "1", "value", "b")));
  }

  @Test
  void databasesComeFromServerConfig() {
    when(jedis.configGet("databases")).thenReturn(Map.of("databases", "4"));

    assertEquals(List.of("0", "1", "2", "3"), plugin.getDatabases(config));
  }

  @Test
  void databasesFallBackWhenConfigIsDisabled() {
    when(jedis.configGet("databases")).thenThrow(new JedisDataException("ERR unknown command 'CONFIG'"));

    assertEquals(16, plugin.getAllSchemas(config).size());
  }

  @Test
  void lostConnectionIsUnavailable() {
    when(jedis.type("k")).thenThrow(new JedisConnectionException("Connection reset"));

    EngineException e = assertThrows(EngineException.class, () -> plugin.getRows(config, "0", "k", null, 10, 0));
    assertEquals(ErrorKind.UNAVAILABLE, e.kind());
    assertEquals("getRows", e.operation());
    verify(jedis).close();
  }

  @Test
  void unreachableServerIsNotAvailable() {
    RedisPlugin down = new RedisPlugin(cfg -> {
      throw new JedisConnectionException("Failed to connect to any host resolved for DNS name.");
    });

    assertFalse(down.isAvailable(config));
    EngineException e = assertThrows(EngineException.class, () -> down.getDatabases(config));
    assertEquals(ErrorKind.UNAVAILABLE, e.kind());
  }

  @Test
  void graphAndRawExecutionAreUnsupported() {
    assertEquals(ErrorKind.UNSUPPORTED_OPERATION, assertThrows(EngineException.class, () -> plugin.getGraph(config, "0")).kind());
    assertEquals(ErrorKind.UNSUPPORTED_OPERATION, assertThrows(EngineException.class, () -> plugin.rawExecute(config, "KEYS *")).kind());
  }
}
