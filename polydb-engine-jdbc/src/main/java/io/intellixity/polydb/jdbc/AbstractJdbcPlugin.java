package io.intellixity.polydb.jdbc;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.jdbc.connect.DriverManagerConnector;
import io.intellixity.polydb.jdbc.connect.JdbcConnector;
import io.intellixity.polydb.jdbc.connect.JdbcTarget;
import io.intellixity.polydb.jdbc.dialect.JdbcDialect;
import io.intellixity.polydb.jdbc.graph.ForeignKey;
import io.intellixity.polydb.jdbc.graph.RelationshipClassifier;
import io.intellixity.polydb.jdbc.graph.UniqueKey;
import io.intellixity.polydb.model.ChatMessage;
import io.intellixity.polydb.model.Column;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.model.StorageUnit;
import io.intellixity.polydb.query.OffsetPage;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.spi.chat.ChatModel;
import io.intellixity.polydb.spi.exec.AbstractDatabasePlugin;
import io.intellixity.polydb.spi.exec.ConnectionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Relational adapter base shared by every SQL engine.
 *
 * <p>Each operation opens one connection through {@link ConnectionScope}, renders parameterized SQL
 * through the {@link JdbcDialect} and maps results onto the uniform shapes. Concrete adapters supply the
 * JDBC URL and their catalog queries; everything else is generic.</p>
 *
 * <p>Catalog query contracts (all parameters bound positionally):</p>
 * <ul>
 *   <li>{@link #databasesQuery()}: no params, one column (name)</li>
 *   <li>{@link #schemasQuery()}: no params, one column (name)</li>
 *   <li>{@link #columnsQuery()}: param schema; columns table, column, type in ordinal order</li>
 *   <li>{@link #tableColumnsQuery()}: params schema, table; columns column, type</li>
 *   <li>{@link #foreignKeysQuery()}: param schema; columns constraint, table, column, ref_table, ref_column</li>
 *   <li>{@link #uniqueKeysQuery()}: param schema; columns constraint, table, column (primary and unique keys)</li>
 * </ul>
 */
public abstract class AbstractJdbcPlugin extends AbstractDatabasePlugin {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcPlugin.class);

  public static final String OPTION_RAW_MAX_ROWS = "rawMaxRows";

  private final JdbcDialect dialect;
  private final JdbcConnector connector;
  private final ChatModel chatModel;

  protected AbstractJdbcPlugin(DatabaseType type, JdbcDialect dialect, JdbcConnector connector, ChatModel chatModel) {
    super(type);
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.connector = connector == null ? DriverManagerConnector.INSTANCE : connector;
    this.chatModel = chatModel;
  }

  public final JdbcDialect dialect() { return dialect; }

  /** JDBC URL, login and driver properties for this call. */
  protected abstract JdbcTarget target(PluginConfig config);

  protected abstract String databasesQuery();

  protected abstract String schemasQuery();

  protected abstract String columnsQuery();

  protected abstract String tableColumnsQuery();

  /** {@code null} when the engine has no foreign keys; getGraph is then unsupported. */
  protected abstract String foreignKeysQuery();

  protected abstract String uniqueKeysQuery();

  /** False for engines whose driver cannot run raw statements inside a transaction. */
  protected boolean supportsTransactions() { return true; }

  /** Maps the caller's schema onto the engine's; engines with a fixed schema set validate it here. */
  protected String resolveSchema(String schema) { return schema; }

  /** Whether an executed mutation counts as applied; engines with asynchronous mutations override. */
  protected boolean applied(int updateCount) { return updateCount > 0; }

  // ---------------------------------------------------------------------------
  // Connection handling
  // ---------------------------------------------------------------------------

  protected final <T> T withConnection(PluginConfig config, ConnectionScope.Operation<Connection, T> op) throws Exception {
    return ConnectionScope.withConnection(config, this::connect, op);
  }

  private Connection connect(PluginConfig config) throws SQLException {
    JdbcTarget target = target(config);
    log.debug("polydb.jdbc connect type={} target={}", type(), target);
    return connector.open(target);
  }

  @Override
  protected void probe(PluginConfig config) throws Exception {
    int seconds = config.timeoutOpt().map(AbstractJdbcPlugin::seconds).orElse(5);
    Boolean valid = withConnection(config, c -> c.isValid(seconds));
    if (!valid) throw new SQLException("connection is not valid");
  }

  @Override
  protected boolean isConnectivityFailure(Exception e) {
    if (super.isConnectivityFailure(e)) return true;
    if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) return true;
    if (e instanceof SQLException se) {
      String state = se.getSQLState();
      if (state != null && state.startsWith("08")) return true;
    }
    return e.getCause() instanceof Exception cause && cause != e && isConnectivityFailure(cause);
  }

  // ---------------------------------------------------------------------------
  // Introspection
  // ---------------------------------------------------------------------------

  @Override
  public List<String> getDatabases(PluginConfig config) {
    return run("getDatabases", null, () -> withConnection(config, c -> names(c, config, databasesQuery())));
  }

  @Override
  public List<String> getAllSchemas(PluginConfig config) {
    return run("getAllSchemas", null, () -> withConnection(config, c -> names(c, config, schemasQuery())));
  }

  @Override
  public List<StorageUnit> getStorageUnits(PluginConfig config, String schema) {
    return run("getStorageUnits", schema, () -> {
      String s = resolveSchema(schema);
      return withConnection(config, c -> {
        List<StorageUnit> out = new ArrayList<>();
        for (var e : loadColumns(c, config, s).entrySet()) {
          List<Record> attrs = new ArrayList<>();
          for (Column col : e.getValue()) attrs.add(Record.of(col.name(), col.type()));
          out.add(new StorageUnit(e.getKey(), attrs));
        }
        return out;
      });
    });
  }

  @Override
  public List<GraphUnit> getGraph(PluginConfig config, String schema) {
    if (foreignKeysQuery() == null) throw unsupported("getGraph");
    return run("getGraph", schema, () -> {
      String s = resolveSchema(schema);
      return withConnection(config, c -> RelationshipClassifier.classify(
          loadColumns(c, config, s),
          loadForeignKeys(c, config, s),
          loadUniqueKeys(c, config, s)));
    });
  }

  /** Columns per table in catalog order. */
  protected Map<String, List<Column>> loadColumns(Connection c, PluginConfig config, String schema) throws SQLException {
    Map<String, List<Column>> out = new LinkedHashMap<>();
    for (List<String> row : query(c, config, columnsQuery(), schema)) {
      out.computeIfAbsent(row.get(0), k -> new ArrayList<>()).add(new Column(row.get(1), row.get(2)));
    }
    return out;
  }

  protected List<Column> loadTableColumns(Connection c, PluginConfig config, String schema, String table) throws SQLException {
    List<Column> out = new ArrayList<>();
    for (List<String> row : query(c, config, tableColumnsQuery(), schema, table)) out.add(new Column(row.get(0), row.get(1)));
    return out;
  }

  protected List<ForeignKey> loadForeignKeys(Connection c, PluginConfig config, String schema) throws SQLException {
    List<ForeignKey> out = new ArrayList<>();
    for (List<String> row : query(c, config, foreignKeysQuery(), schema)) {
      out.add(new ForeignKey(row.get(0), row.get(1), row.get(2), row.get(3), row.get(4)));
    }
    return out;
  }

  protected List<UniqueKey> loadUniqueKeys(Connection c, PluginConfig config, String schema) throws SQLException {
    List<UniqueKey> out = new ArrayList<>();
    for (List<String> row : query(c, config, uniqueKeysQuery(), schema)) out.add(new UniqueKey(row.get(0), row.get(1), row.get(2)));
    return out;
  }

  /** Primary-key columns in key order; empty when the table has none. */
  protected List<String> primaryKey(Connection c, String schema, String table) throws SQLException {
    DatabaseMetaData md = c.getMetaData();
    Map<Integer, String> bySeq = new TreeMap<>();
    try (ResultSet rs = md.getPrimaryKeys(null, blankToNull(schema), table)) {
      while (rs.next()) bySeq.put(rs.getInt("KEY_SEQ"), rs.getString("COLUMN_NAME"));
    }
    return new ArrayList<>(bySeq.values());
  }

  private Map<String, String> columnTypes(Connection c, PluginConfig config, String schema, String table) throws SQLException {
    List<Column> cols = loadTableColumns(c, config, schema, table);
    if (cols.isEmpty()) throw EngineException.malformedInput(table, "storage unit not found in schema '" + schema + "'");
    Map<String, String> out = new LinkedHashMap<>();
    for (Column col : cols) out.put(col.name(), col.type());
    return out;
  }

  // ---------------------------------------------------------------------------
  // Rows
  // ---------------------------------------------------------------------------

  @Override
  public RowsResult getRows(PluginConfig config, String requestedSchema, String storageUnit, WhereCondition where,
                            int pageSize, int pageOffset) {
    return run("getRows", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      String schema = resolveSchema(requestedSchema);
      checkOperators(where);
      OffsetPage page = OffsetPage.of(pageSize, pageOffset);
      return withConnection(config, c -> {
        List<Column> columns = loadTableColumns(c, config, schema, storageUnit);
        if (columns.isEmpty()) throw EngineException.malformedInput(storageUnit, "storage unit not found in schema '" + schema + "'");
        Map<String, String> types = new LinkedHashMap<>();
        for (Column col : columns) types.put(col.name(), col.type());
        SqlStatement ss = dialect.renderSelect(schema, storageUnit, types, where, primaryKey(c, schema, storageUnit), page);
        return executeQuery(c, config, "SELECT", ss, columns);
      });
    });
  }

  @Override
  public boolean addRow(PluginConfig config, String requestedSchema, String storageUnit, List<Record> values) {
    return run("addRow", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      String schema = resolveSchema(requestedSchema);
      return withConnection(config, c -> {
        SqlStatement ss = dialect.renderInsert(schema, storageUnit, columnTypes(c, config, schema, storageUnit), values);
        return applied(executeUpdate(c, config, "INSERT", ss));
      });
    });
  }

  @Override
  public boolean updateStorageUnit(PluginConfig config, String requestedSchema, String storageUnit,
                                   Map<String, String> values, List<String> updatedColumns) {
    return run("updateStorageUnit", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      String schema = resolveSchema(requestedSchema);
      if (values == null || values.isEmpty()) throw EngineException.malformedInput(storageUnit, "row values are required");
      if (updatedColumns == null || updatedColumns.isEmpty()) {
        throw EngineException.malformedInput(storageUnit, "no updated columns given");
      }
      Map<String, String> sets = new LinkedHashMap<>();
      for (String col : updatedColumns) {
        if (!values.containsKey(col)) throw EngineException.malformedInput(col, "updated column has no value");
        sets.put(col, values.get(col));
      }
      return withConnection(config, c -> {
        Map<String, String> types = columnTypes(c, config, schema, storageUnit);
        List<String> pk = primaryKey(c, schema, storageUnit);
        Map<String, String> where = new LinkedHashMap<>();
        boolean pkUsable = !pk.isEmpty() && values.keySet().containsAll(pk) && pk.stream().noneMatch(sets::containsKey);
        if (pkUsable) {
          for (String k : pk) where.put(k, values.get(k));
        } else {
          for (var e : values.entrySet()) {
            if (!sets.containsKey(e.getKey())) where.put(e.getKey(), e.getValue());
          }
        }
        SqlStatement ss = dialect.renderUpdate(schema, storageUnit, types, sets, where);
        return applied(executeUpdate(c, config, "UPDATE", ss));
      });
    });
  }

  @Override
  public boolean deleteRow(PluginConfig config, String requestedSchema, String storageUnit, Map<String, String> values) {
    return run("deleteRow", storageUnit, () -> {
      requireName(storageUnit, "storageUnit");
      String schema = resolveSchema(requestedSchema);
      return withConnection(config, c -> {
        Map<String, String> types = columnTypes(c, config, schema, storageUnit);
        List<String> pk = primaryKey(c, schema, storageUnit);
        Map<String, String> where = new LinkedHashMap<>();
        Map<String, String> given = values == null ? Map.of() : values;
        if (!pk.isEmpty() && given.keySet().containsAll(pk)) {
          for (String k : pk) where.put(k, given.get(k));
        } else {
          where.putAll(given);
        }
        SqlStatement ss = dialect.renderDelete(schema, storageUnit, types, where);
        return applied(executeUpdate(c, config, "DELETE", ss));
      });
    });
  }

  @Override
  public boolean addStorageUnit(PluginConfig config, String schema, String storageUnit, List<Record> fields) {
    return run("addStorageUnit", storageUnit, () -> {
      SqlStatement ss = dialect.renderCreateTable(resolveSchema(schema), storageUnit, fields);
      return withConnection(config, c -> {
        executeUpdate(c, config, "CREATE", ss);
        return true;
      });
    });
  }

  // ---------------------------------------------------------------------------
  // Raw execution and chat
  // ---------------------------------------------------------------------------

  @Override
  public RowsResult rawExecute(PluginConfig config, String query) {
    return run("rawExecute", query, () -> {
      requireName(query, "query");
      return withConnection(config, c -> supportsTransactions() ? inTransaction(c, config, query) : executeRaw(c, config, query));
    });
  }

  private RowsResult inTransaction(Connection c, PluginConfig config, String query) throws SQLException {
    boolean autoCommit = c.getAutoCommit();
    c.setAutoCommit(false);
    try {
      RowsResult out = executeRaw(c, config, query);
      c.commit();
      return out;
    } catch (SQLException | RuntimeException e) {
      try {
        c.rollback();
      } catch (SQLException re) {
        e.addSuppressed(re);
      }
      throw e;
    } finally {
      c.setAutoCommit(autoCommit);
    }
  }

  private RowsResult executeRaw(Connection c, PluginConfig config, String query) throws SQLException {
    long start = System.nanoTime();
    log.debug("polydb.jdbc op=RAW type={} sql={}", type(), query);
    try (Statement st = c.createStatement()) {
      applyTimeout(st, config);
      int maxRows = config.intOption(OPTION_RAW_MAX_ROWS, 0);
      if (maxRows > 0) st.setMaxRows(maxRows);
      RowsResult out;
      if (st.execute(query)) {
        try (ResultSet rs = st.getResultSet()) {
          out = JdbcRows.read(rs, null, true, dialect);
        }
      } else {
        out = new RowsResult(List.of(new Column("affected_rows", "int")),
            List.of(List.of(String.valueOf(st.getUpdateCount()))), true);
      }
      debugDone("RAW", out.rows().size(), System.nanoTime() - start);
      return out;
    }
  }

  @Override
  public List<ChatMessage> chat(PluginConfig config, String schema, String previousConversation, String query) {
    if (chatModel == null) throw unsupported("chat");
    return run("chat", schema, () -> {
      String s = resolveSchema(schema);
      String context = withConnection(config, c -> describe(loadColumns(c, config, s)));
      ChatModel.ChatReply reply = chatModel.complete(
          new ChatModel.ChatRequest(type(), schema, context, previousConversation, query));
      if (reply == null || reply.kind() == ChatModel.ChatReply.Kind.MESSAGE) {
        return List.of(ChatMessage.text(reply == null ? "" : reply.text()));
      }
      RowsResult rows = rawExecute(config, reply.text());
      return List.of(new ChatMessage(ChatMessage.SQL, reply.text(), rows));
    });
  }

  private static String describe(Map<String, List<Column>> tables) {
    StringBuilder sb = new StringBuilder();
    for (var e : tables.entrySet()) {
      sb.append(e.getKey()).append('(');
      List<String> cols = new ArrayList<>();
      for (Column c : e.getValue()) cols.add(c.name() + " " + c.type());
      sb.append(String.join(", ", cols)).append(")\n");
    }
    return sb.toString();
  }

  // ---------------------------------------------------------------------------
  // Statement execution
  // ---------------------------------------------------------------------------

  protected final RowsResult executeQuery(Connection c, PluginConfig config, String op, SqlStatement ss,
                                          List<Column> declared) throws SQLException {
    String jdbcSql = prepareSql(op, ss);
    long start = System.nanoTime();
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      applyTimeout(ps, config);
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        RowsResult out = JdbcRows.read(rs, declared, false, dialect);
        debugDone(op, out.rows().size(), System.nanoTime() - start);
        return out;
      }
    }
  }

  protected final int executeUpdate(Connection c, PluginConfig config, String op, SqlStatement ss) throws SQLException {
    String jdbcSql = prepareSql(op, ss);
    long start = System.nanoTime();
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      applyTimeout(ps, config);
      bindAll(ps, ss);
      int n = ps.executeUpdate();
      debugDone(op, n, System.nanoTime() - start);
      return n;
    }
  }

  /** Runs a catalog query and returns its rows as strings. */
  protected final List<List<String>> query(Connection c, PluginConfig config, String sql, String... params) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      applyTimeout(ps, config);
      for (int i = 0; i < params.length; i++) ps.setString(i + 1, params[i]);
      try (ResultSet rs = ps.executeQuery()) {
        int n = rs.getMetaData().getColumnCount();
        List<List<String>> out = new ArrayList<>();
        while (rs.next()) {
          List<String> row = new ArrayList<>(n);
          for (int i = 1; i <= n; i++) row.add(rs.getString(i));
          out.add(row);
        }
        return out;
      }
    }
  }

  private List<String> names(Connection c, PluginConfig config, String sql) throws SQLException {
    List<String> out = new ArrayList<>();
    for (List<String> row : query(c, config, sql)) out.add(row.get(0));
    return out;
  }

  private String prepareSql(String op, SqlStatement ss) {
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    int expected = SqlParamCompiler.countParams(ss.sql());
    if (expected != ss.binds().size()) {
      throw new IllegalStateException("bind count " + ss.binds().size() + " != placeholder count " + expected);
    }
    if (log.isDebugEnabled()) {
      log.debug("polydb.jdbc op={} type={} execKind={} bindCount={} sql={}",
          op, type(), ss.execKind(), ss.binds().size(), jdbcSql);
    }
    // Bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (SqlBind b : ss.binds()) {
        Object v = b.value();
        log.trace("polydb.jdbc bind index={} kind={} valueType={}", idx++, b.kind(),
            v == null ? "null" : v.getClass().getSimpleName());
      }
    }
    return jdbcSql;
  }

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) dialect.bind(ps, i + 1, ss.binds().get(i));
  }

  protected static void applyTimeout(Statement st, PluginConfig config) throws SQLException {
    if (config.timeout() != null) st.setQueryTimeout(seconds(config.timeout()));
  }

  private static int seconds(Duration d) {
    long s = (d.toMillis() + 999) / 1000;
    return (int) Math.max(1, Math.min(Integer.MAX_VALUE, s));
  }

  private void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("polydb.jdbc_done op={} type={} durationMs={} result={}", op, type(), durationNanos / 1_000_000.0, result);
  }

  protected static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}
