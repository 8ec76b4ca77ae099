package io.intellixity.polydb.redis;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.model.Column;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.model.StorageUnit;
import io.intellixity.polydb.query.OffsetPage;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.spi.exec.AbstractDatabasePlugin;
import io.intellixity.polydb.spi.exec.ConnectionScope;
import io.intellixity.polydb.spi.filter.InMemoryFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.params.ZAddParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.resps.Tuple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis adapter.
 *
 * <p>Schemas are logical database indexes and storage units are keys. Each key reads as rows shaped by
 * its type: string {@code value}, hash {@code field,value}, list {@code index,value}, set {@code value},
 * zset {@code member,score}. Redis has no predicate language, so filters are evaluated client-side on
 * rows read from the key, bounded by the {@code scanLimit} option.</p>
 */
public final class RedisPlugin extends AbstractDatabasePlugin {
  private static final Logger log = LoggerFactory.getLogger(RedisPlugin.class);

  public static final String OPTION_SCAN_LIMIT = "scanLimit";
  public static final int DEFAULT_SCAN_LIMIT = 10_000;
  public static final String TYPE = "Type";

  static final int DEFAULT_DATABASES = 16;
  private static final int SCAN_BATCH = 500;

  private final RedisConnector connector;

  public RedisPlugin(RedisConnector connector) {
    super(DatabaseType.REDIS);
    this.connector = connector == null ? DefaultRedisConnector.INSTANCE : connector;
  }

  public RedisPlugin() {
    this(null);
  }

  private <T> T withJedis(PluginConfig config, ConnectionScope.Operation<Jedis, T> op) throws Exception {
    return ConnectionScope.withConnection(config, connector::open, op);
  }

  private <T> T withDatabase(PluginConfig config, String schema, ConnectionScope.Operation<Jedis, T> op) throws Exception {
    int db = databaseIndex(config, schema);
    return withJedis(config, j -> {
      if (db != 0) j.select(db);
      return op.apply(j);
    });
  }

  @Override
  protected void probe(PluginConfig config) throws Exception {
    withJedis(config, j -> j.ping());
  }

  @Override
  protected boolean isConnectivityFailure(Exception e) {
    return super.isConnectivityFailure(e) || e instanceof JedisConnectionException;
  }

  // ---------------------------------------------------------------------------
  // Introspection
  // ---------------------------------------------------------------------------

  @Override
  public List<String> getDatabases(PluginConfig config) {
    return run("getDatabases", null, () -> withJedis(config, RedisPlugin::databaseIndexes));
  }

  @Override
  public List<String> getAllSchemas(PluginConfig config) {
    return run("getAllSchemas", null, () -> withJedis(config, RedisPlugin::databaseIndexes));
  }

  @Override
  public List<StorageUnit> getStorageUnits(PluginConfig config, String schema) {
    return run("getStorageUnits", schema, () -> {
      int limit = scanLimit(config);
      return withDatabase(config, schema, j -> {
        List<String> keys = scanKeys(j, limit);
        List<StorageUnit> out = new ArrayList<>(keys.size());
        for (String key : keys) {
          RedisKeyType t = RedisKeyType.fromRedis(key, j.type(key));
          if (t == null) continue;
          out.add(new StorageUnit(key, List.of(Record.of(TYPE, t.id()), Record.of("Size", String.valueOf(size(j, key, t))))));
        }
        return out;
      });
    });
  }

  // ---------------------------------------------------------------------------
  // Rows
  // ---------------------------------------------------------------------------

  @Override
  public RowsResult getRows(PluginConfig config, String schema, String storageUnit, WhereCondition where,
                            int pageSize, int pageOffset) {
    return run("getRows", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      checkOperators(where);
      OffsetPage page = OffsetPage.of(pageSize, pageOffset);
      int limit = scanLimit(config);
      return withDatabase(config, schema, j -> {
        RedisKeyType t = requireKey(j, storageUnit);
        InMemoryFilter filter = InMemoryFilter.forColumns(t.kinds());
        filter.validate(where);
        List<Map<String, String>> rows = filter.apply(readRows(j, storageUnit, t, limit), where);
        List<List<String>> out = new ArrayList<>();
        for (int i = page.offset(); i < rows.size() && i < page.end(); i++) {
          Map<String, String> row = rows.get(i);
          List<String> cells = new ArrayList<>(t.columns().size());
          for (Column c : t.columns()) cells.add(row.get(c.name()));
          out.add(cells);
        }
        return new RowsResult(t.columns(), out, false);
      });
    });
  }

  /** Creates a key. {@code fields} carries a {@code Type} record plus the first row; a string key may start empty. */
  @Override
  public boolean addStorageUnit(PluginConfig config, String schema, String storageUnit, List<Record> fields) {
    return run("addStorageUnit", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      Map<String, String> given = fieldsOf(fields);
      RedisKeyType t = RedisKeyType.parse(given.remove(TYPE));
      if (t != RedisKeyType.STRING && given.isEmpty()) {
        throw EngineException.malformedInput(storageUnit, "a " + t.id() + " key needs a first row");
      }
      return withDatabase(config, schema, j -> {
        if (j.exists(storageUnit)) throw EngineException.malformedInput(storageUnit, "key already exists");
        if (t == RedisKeyType.STRING) {
          String value = given.getOrDefault("value", "");
          return "OK".equals(j.set(storageUnit, value, SetParams.setParams().nx()));
        }
        return insert(j, storageUnit, t, given);
      });
    });
  }

  @Override
  public boolean addRow(PluginConfig config, String schema, String storageUnit, List<Record> values) {
    return run("addRow", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      Map<String, String> given = fieldsOf(values);
      return withDatabase(config, schema, j -> {
        RedisKeyType t = requireKey(j, storageUnit);
        if (t == RedisKeyType.STRING) {
          throw EngineException.malformedInput(storageUnit, "a string key holds a single value; update it instead");
        }
        return insert(j, storageUnit, t, given);
      });
    });
  }

  @Override
  public boolean updateStorageUnit(PluginConfig config, String schema, String storageUnit,
                                   Map<String, String> values, List<String> updatedColumns) {
    return run("updateStorageUnit", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      if (updatedColumns == null || updatedColumns.isEmpty()) {
        throw EngineException.malformedInput(storageUnit, "no updated columns given");
      }
      Map<String, String> given = values == null ? Map.of() : values;
      return withDatabase(config, schema, j -> {
        RedisKeyType t = requireKey(j, storageUnit);
        switch (t) {
          case STRING:
            onlyUpdates(updatedColumns, "value");
            return "OK".equals(j.set(storageUnit, require(given, "value"), SetParams.setParams().xx()));
          case HASH: {
            onlyUpdates(updatedColumns, "value");
            String field = require(given, "field");
            if (!j.hexists(storageUnit, field)) return false;
            j.hset(storageUnit, field, require(given, "value"));
            return true;
          }
          case LIST: {
            onlyUpdates(updatedColumns, "value");
            long index = index(require(given, "index"));
            if (index < 0 || index >= j.llen(storageUnit)) return false;
            return "OK".equals(j.lset(storageUnit, index, require(given, "value")));
          }
          case ZSET: {
            onlyUpdates(updatedColumns, "score");
            String member = require(given, "member");
            if (j.zscore(storageUnit, member) == null) return false;
            j.zadd(storageUnit, score(require(given, "score")), member, ZAddParams.zAddParams().xx());
            return true;
          }
          case SET:
          default:
            throw EngineException.malformedInput(storageUnit, "set members cannot be updated; delete and add instead");
        }
      });
    });
  }

  @Override
  public boolean deleteRow(PluginConfig config, String schema, String storageUnit, Map<String, String> values) {
    return run("deleteRow", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      Map<String, String> given = values == null ? Map.of() : values;
      return withDatabase(config, schema, j -> {
        RedisKeyType t = requireKey(j, storageUnit);
        switch (t) {
          case STRING:
            return j.del(storageUnit) > 0;
          case HASH:
            return j.hdel(storageUnit, require(given, "field")) > 0;
          case LIST:
            return j.lrem(storageUnit, 1, require(given, "value")) > 0;
          case SET:
            return j.srem(storageUnit, require(given, "value")) > 0;
          case ZSET:
          default:
            return j.zrem(storageUnit, require(given, "member")) > 0;
        }
      });
    });
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  static List<String> databaseIndexes(Jedis j) {
    int count = DEFAULT_DATABASES;
    try {
      String v = j.configGet("databases").get("databases");
      if (v != null) count = Integer.parseInt(v.trim());
    } catch (JedisDataException | NumberFormatException e) {
      // CONFIG is often disabled on managed instances.
      log.debug("polydb.redis config_unavailable databases={} error={}", count, e.toString());
    }
    List<String> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) out.add(String.valueOf(i));
    return out;
  }

  /** Blank schema falls back to the credential database, then 0. */
  static int databaseIndex(PluginConfig config, String schema) {
    String raw = schema == null || schema.isBlank() ? config.credentials().database() : schema;
    if (raw == null || raw.isBlank()) return 0;
    try {
      int db = Integer.parseInt(raw.trim());
      if (db < 0) throw EngineException.malformedInput("schema", "database index must be >= 0");
      return db;
    } catch (NumberFormatException e) {
      throw EngineException.malformedInput("schema", "expected a database index but got '" + raw + "'", e);
    }
  }

  static int scanLimit(PluginConfig config) {
    int limit = config.intOption(OPTION_SCAN_LIMIT, DEFAULT_SCAN_LIMIT);
    if (limit <= 0) throw EngineException.malformedInput(OPTION_SCAN_LIMIT, "scanLimit must be > 0");
    return limit;
  }

  private static List<String> scanKeys(Jedis j, int limit) {
    List<String> keys = new ArrayList<>();
    ScanParams params = new ScanParams().count(SCAN_BATCH);
    String cursor = ScanParams.SCAN_POINTER_START;
    do {
      ScanResult<String> page = j.scan(cursor, params);
      for (String k : page.getResult()) {
        if (keys.size() >= limit) break;
        keys.add(k);
      }
      cursor = page.getCursor();
    } while (!ScanParams.SCAN_POINTER_START.equals(cursor) && keys.size() < limit);
    if (keys.size() >= limit && !ScanParams.SCAN_POINTER_START.equals(cursor)) {
      log.warn("polydb.redis scan_truncated op=SCAN limit={}", limit);
    }
    Collections.sort(keys);
    return keys;
  }

  private static long size(Jedis j, String key, RedisKeyType t) {
    switch (t) {
      case STRING: return j.strlen(key);
      case HASH: return j.hlen(key);
      case LIST: return j.llen(key);
      case SET: return j.scard(key);
      case ZSET:
      default: return j.zcard(key);
    }
  }

  static List<Map<String, String>> readRows(Jedis j, String key, RedisKeyType t, int limit) {
    List<Map<String, String>> rows = new ArrayList<>();
    switch (t) {
      case STRING: {
        String v = j.get(key);
        if (v != null) rows.add(row("value", v));
        break;
      }
      case HASH: {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
          ScanResult<Map.Entry<String, String>> page = j.hscan(key, cursor, new ScanParams().count(SCAN_BATCH));
          entries.addAll(page.getResult());
          cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor) && entries.size() < limit);
        entries.sort(Map.Entry.comparingByKey());
        for (Map.Entry<String, String> e : truncate(entries, limit, key)) rows.add(row("field", e.getKey(), "value", e.getValue()));
        break;
      }
      case LIST: {
        List<String> items = j.lrange(key, 0, limit - 1L);
        for (int i = 0; i < items.size(); i++) rows.add(row("index", String.valueOf(i), "value", items.get(i)));
        if (items.size() >= limit && j.llen(key) > limit) warnTruncated(key, limit);
        break;
      }
      case SET: {
        List<String> members = new ArrayList<>();
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
          ScanResult<String> page = j.sscan(key, cursor, new ScanParams().count(SCAN_BATCH));
          members.addAll(page.getResult());
          cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor) && members.size() < limit);
        Collections.sort(members);
        for (String m : truncate(members, limit, key)) rows.add(row("value", m));
        break;
      }
      case ZSET:
      default: {
        List<Tuple> tuples = j.zrangeWithScores(key, 0, limit - 1L);
        for (Tuple tp : tuples) rows.add(row("member", tp.getElement(), "score", String.valueOf(tp.getScore())));
        if (tuples.size() >= limit && j.zcard(key) > limit) warnTruncated(key, limit);
        break;
      }
    }
    return rows;
  }

  private static <T> List<T> truncate(List<T> items, int limit, String key) {
    if (items.size() <= limit) return items;
    warnTruncated(key, limit);
    return items.subList(0, limit);
  }

  private static void warnTruncated(String key, int limit) {
    log.warn("polydb.redis scan_truncated key={} limit={}", key, limit);
  }

  private static boolean insert(Jedis j, String key, RedisKeyType t, Map<String, String> given) {
    switch (t) {
      case HASH:
        return j.hsetnx(key, require(given, "field"), require(given, "value")) == 1;
      case LIST:
        return j.rpush(key, require(given, "value")) > 0;
      case SET:
        return j.sadd(key, require(given, "value")) == 1;
      case ZSET:
        return j.zadd(key, score(require(given, "score")), require(given, "member"), ZAddParams.zAddParams().nx()) == 1;
      case STRING:
      default:
        return "OK".equals(j.set(key, require(given, "value"), SetParams.setParams().nx()));
    }
  }

  private static RedisKeyType requireKey(Jedis j, String key) {
    RedisKeyType t = RedisKeyType.fromRedis(key, j.type(key));
    if (t == null) throw EngineException.malformedInput(key, "key not found");
    return t;
  }

  private static Map<String, String> fieldsOf(List<Record> records) {
    Map<String, String> out = new LinkedHashMap<>();
    if (records == null) return out;
    for (Record r : records) {
      if (out.containsKey(r.key())) throw EngineException.malformedInput(r.key(), "duplicate field");
      out.put(r.key(), r.value());
    }
    return out;
  }

  private static String require(Map<String, String> values, String column) {
    String v = values.get(column);
    if (v == null) throw EngineException.malformedInput(column, column + " is required");
    return v;
  }

  private static void onlyUpdates(List<String> updatedColumns, String allowed) {
    for (String c : updatedColumns) {
      if (!allowed.equals(c)) throw EngineException.malformedInput(c, "only '" + allowed + "' can be updated");
    }
  }

  private static double score(String raw) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException e) {
      throw EngineException.malformedInput("score", "'" + raw + "' is not a valid score", e);
    }
  }

  private static long index(String raw) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw EngineException.malformedInput("index", "'" + raw + "' is not a valid list index", e);
    }
  }

  private static Map<String, String> row(String... kv) {
    Map<String, String> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
    return m;
  }
}
