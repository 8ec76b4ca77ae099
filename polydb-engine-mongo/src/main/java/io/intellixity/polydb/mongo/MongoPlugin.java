package io.intellixity.polydb.mongo;

import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.MongoIterable;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.model.Column;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.model.StorageUnit;
import io.intellixity.polydb.query.OffsetPage;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.spi.exec.AbstractDatabasePlugin;
import io.intellixity.polydb.spi.exec.ConnectionScope;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB adapter.
 *
 * <p>Databases double as schemas and collections are the storage units. Rows are one {@code document}
 * column holding the document as relaxed extended JSON. Writes take the same {@code document} value;
 * updates and deletes address the document by {@code _id}.</p>
 */
public final class MongoPlugin extends AbstractDatabasePlugin {
  private static final Logger log = LoggerFactory.getLogger(MongoPlugin.class);

  public static final String DOCUMENT = "document";
  public static final String OPTION_GRAPH_SAMPLE = "graphSample";

  static final List<Column> COLUMNS = List.of(new Column(DOCUMENT, "json"));
  private static final JsonWriterSettings JSON = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

  private final MongoConnector connector;

  public MongoPlugin(MongoConnector connector) {
    super(DatabaseType.MONGODB);
    this.connector = connector == null ? DefaultMongoConnector.INSTANCE : connector;
  }

  public MongoPlugin() {
    this(null);
  }

  private <T> T withClient(PluginConfig config, ConnectionScope.Operation<MongoClient, T> op) throws Exception {
    return ConnectionScope.withConnection(config, connector::open, op);
  }

  @Override
  protected void probe(PluginConfig config) throws Exception {
    withClient(config, c -> c.getDatabase("admin").runCommand(new Document("ping", 1)));
  }

  @Override
  protected boolean isConnectivityFailure(Exception e) {
    return super.isConnectivityFailure(e)
        || e instanceof MongoTimeoutException
        || e instanceof MongoSocketException
        || e instanceof MongoSecurityException;
  }

  // ---------------------------------------------------------------------------
  // Introspection
  // ---------------------------------------------------------------------------

  @Override
  public List<String> getDatabases(PluginConfig config) {
    return run("getDatabases", null, () -> withClient(config, c -> names(c.listDatabaseNames())));
  }

  @Override
  public List<String> getAllSchemas(PluginConfig config) {
    return run("getAllSchemas", null, () -> withClient(config, c -> names(c.listDatabaseNames())));
  }

  @Override
  public List<StorageUnit> getStorageUnits(PluginConfig config, String schema) {
    return run("getStorageUnits", schema, () -> {
      requireName(schema, "schema");
      return withClient(config, c -> {
        MongoDatabase db = c.getDatabase(schema);
        List<StorageUnit> out = new ArrayList<>();
        List<Document> infos = db.listCollections().into(new ArrayList<>());
        for (Document info : infos) {
          String name = info.getString("name");
          if (name == null || name.startsWith("system.")) continue;
          String type = Objects.requireNonNullElse(info.getString("type"), "collection");
          String count = "view".equals(type) ? "" : String.valueOf(db.getCollection(name).estimatedDocumentCount());
          out.add(new StorageUnit(name, List.of(Record.of("Type", type), Record.of("Count", count))));
        }
        return out;
      });
    });
  }

  @Override
  public List<GraphUnit> getGraph(PluginConfig config, String schema) {
    return run("getGraph", schema, () -> {
      requireName(schema, "schema");
      int sample = config.intOption(OPTION_GRAPH_SAMPLE, 100);
      return withClient(config, c -> {
        MongoDatabase db = c.getDatabase(schema);
        Map<String, List<Document>> samples = new LinkedHashMap<>();
        for (String name : names(db.listCollectionNames())) {
          if (name.startsWith("system.")) continue;
          List<Document> docs = db.getCollection(name).find().limit(sample).into(new ArrayList<>());
          samples.put(name, docs);
        }
        return MongoGraphBuilder.build(samples);
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
      requireName(schema, "schema");
      requireName(storageUnit, "storageUnit");
      checkOperators(where);
      OffsetPage page = OffsetPage.of(pageSize, pageOffset);
      Document filter = MongoQueryRenderer.toBson(where);
      return withClient(config, c -> {
        MongoDatabase db = c.getDatabase(schema);
        requireCollection(db, schema, storageUnit);
        if (log.isDebugEnabled()) {
          log.debug("polydb.mongo op=FIND collection={} filter={} skip={} limit={}",
              storageUnit, filter.toJson(), page.offset(), page.limit());
        }
        FindIterable<Document> find = db.getCollection(storageUnit).find(filter)
            .sort(Sorts.ascending(MongoQueryRenderer.ID))
            .skip(page.offset())
            .limit(page.limit());
        if (config.timeout() != null) find = find.maxTime(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
        List<Document> docs = find.into(new ArrayList<>());
        return rows(docs, false);
      });
    });
  }

  @Override
  public boolean addStorageUnit(PluginConfig config, String schema, String storageUnit, List<Record> fields) {
    return run("addStorageUnit", storageUnit, () -> {
      requireName(schema, "schema");
      requireName(storageUnit, "storageUnit");
      return withClient(config, c -> {
        c.getDatabase(schema).createCollection(storageUnit);
        return true;
      });
    });
  }

  @Override
  public boolean addRow(PluginConfig config, String schema, String storageUnit, List<Record> values) {
    return run("addRow", storageUnit, () -> {
      requireName(schema, "schema");
      requireName(storageUnit, "storageUnit");
      Document doc = documentOf(values);
      return withClient(config, c -> {
        c.getDatabase(schema).getCollection(storageUnit).insertOne(doc);
        return true;
      });
    });
  }

  @Override
  public boolean updateStorageUnit(PluginConfig config, String schema, String storageUnit,
                                   Map<String, String> values, List<String> updatedColumns) {
    return run("updateStorageUnit", storageUnit, () -> {
      requireName(schema, "schema");
      requireName(storageUnit, "storageUnit");
      if (values == null || values.isEmpty()) throw EngineException.malformedInput(storageUnit, "row values are required");
      return withClient(config, c -> {
        MongoCollection<Document> col = c.getDatabase(schema).getCollection(storageUnit);
        UpdateResult r;
        if (values.containsKey(DOCUMENT)) {
          Document doc = parse(values.get(DOCUMENT));
          r = col.replaceOne(Filters.eq(MongoQueryRenderer.ID, requireId(doc.get(MongoQueryRenderer.ID))), doc);
        } else {
          if (updatedColumns == null || updatedColumns.isEmpty()) {
            throw EngineException.malformedInput(storageUnit, "no updated columns given");
          }
          Object id = requireId(idValue(values.get(MongoQueryRenderer.ID)));
          List<Bson> sets = new ArrayList<>();
          for (String field : updatedColumns) {
            if (MongoQueryRenderer.ID.equals(field)) throw EngineException.malformedInput(field, "_id cannot be updated");
            sets.add(Updates.set(field, MongoQueryRenderer.infer(field, values.get(field))));
          }
          r = col.updateOne(Filters.eq(MongoQueryRenderer.ID, id), Updates.combine(sets));
        }
        return r.getMatchedCount() > 0;
      });
    });
  }

  @Override
  public boolean deleteRow(PluginConfig config, String schema, String storageUnit, Map<String, String> values) {
    return run("deleteRow", storageUnit, () -> {
      requireName(schema, "schema");
      requireName(storageUnit, "storageUnit");
      Map<String, String> given = values == null ? Map.of() : values;
      Object id = given.containsKey(DOCUMENT)
          ? parse(given.get(DOCUMENT)).get(MongoQueryRenderer.ID)
          : idValue(given.get(MongoQueryRenderer.ID));
      Object target = requireId(id);
      return withClient(config, c -> {
        DeleteResult r = c.getDatabase(schema).getCollection(storageUnit).deleteOne(Filters.eq(MongoQueryRenderer.ID, target));
        return r.getDeletedCount() > 0;
      });
    });
  }

  // ---------------------------------------------------------------------------
  // Raw commands
  // ---------------------------------------------------------------------------

  /** Runs a JSON command document against the credential database ({@code admin} when none is set). */
  @Override
  public RowsResult rawExecute(PluginConfig config, String query) {
    return run("rawExecute", query, () -> {
      requireName(query, "query");
      Document command = parse(query);
      String dbName = config.credentials().database();
      String database = dbName == null || dbName.isBlank() ? "admin" : dbName;
      return withClient(config, c -> {
        log.debug("polydb.mongo op=COMMAND database={} command={}", database, command.keySet().stream().findFirst().orElse(""));
        Document reply = c.getDatabase(database).runCommand(command);
        Object cursor = reply.get("cursor");
        if (cursor instanceof Document cur && cur.get("firstBatch") instanceof List<?> batch) {
          List<Document> docs = new ArrayList<>();
          for (Object o : batch) {
            if (o instanceof Document d) docs.add(d);
          }
          return rows(docs, true);
        }
        return rows(List.of(reply), true);
      });
    });
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  private static void requireCollection(MongoDatabase db, String schema, String name) {
    if (!names(db.listCollectionNames()).contains(name)) {
      throw EngineException.malformedInput(name, "storage unit not found in schema '" + schema + "'");
    }
  }

  private static List<String> names(MongoIterable<String> it) {
    List<String> out = new ArrayList<>();
    it.into(out);
    return out;
  }

  static RowsResult rows(List<Document> docs, boolean disableUpdate) {
    List<List<String>> out = new ArrayList<>(docs.size());
    for (Document d : docs) out.add(List.of(d.toJson(JSON)));
    return new RowsResult(COLUMNS, out, disableUpdate);
  }

  /** A single {@code document} record holding JSON, or plain field records. */
  static Document documentOf(List<Record> values) {
    if (values == null || values.isEmpty()) throw EngineException.malformedInput(DOCUMENT, "row has no values");
    if (values.size() == 1 && DOCUMENT.equals(values.get(0).key())) return parse(values.get(0).value());
    Document doc = new Document();
    for (Record r : values) {
      if (doc.containsKey(r.key())) throw EngineException.malformedInput(r.key(), "duplicate field");
      doc.append(r.key(), MongoQueryRenderer.infer(r.key(), r.value()));
    }
    return doc;
  }

  static Document parse(String json) {
    if (json == null || json.isBlank()) throw EngineException.malformedInput(DOCUMENT, "document JSON is required");
    try {
      return Document.parse(json);
    } catch (JsonParseException | IllegalArgumentException e) {
      throw EngineException.malformedInput(DOCUMENT, "invalid document JSON: " + e.getMessage(), e);
    }
  }

  private static Object idValue(String raw) {
    return raw == null ? null : MongoQueryRenderer.infer(MongoQueryRenderer.ID, raw);
  }

  private static Object requireId(Object id) {
    if (id == null) throw EngineException.malformedInput(MongoQueryRenderer.ID, "document must carry an _id");
    return id;
  }
}
