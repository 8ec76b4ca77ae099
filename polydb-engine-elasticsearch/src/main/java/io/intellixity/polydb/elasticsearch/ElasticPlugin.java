package io.intellixity.polydb.elasticsearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.model.Column;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.model.StorageUnit;
import io.intellixity.polydb.query.OffsetPage;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import io.intellixity.polydb.spi.exec.AbstractDatabasePlugin;
import io.intellixity.polydb.spi.exec.ConnectionScope;
import org.apache.http.HttpEntity;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.util.EntityUtils;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.ResponseException;
import org.elasticsearch.client.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.NoRouteToHostException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Elasticsearch adapter over the low-level REST client.
 *
 * <p>There is no database or schema level; indices are the storage units. Rows are one {@code document}
 * column holding the hit's {@code _source} with {@code _id} merged in. Pages that end inside
 * {@code index.max_result_window} use {@code from}/{@code size}; deeper pages are served by walking a
 * scroll context from the start.</p>
 */
public final class ElasticPlugin extends AbstractDatabasePlugin {
  private static final Logger log = LoggerFactory.getLogger(ElasticPlugin.class);

  public static final String DOCUMENT = "document";
  public static final String OPTION_MAX_RESULT_WINDOW = "maxResultWindow";
  public static final int DEFAULT_MAX_RESULT_WINDOW = 10_000;

  static final List<Column> COLUMNS = List.of(new Column(DOCUMENT, "json"));
  static final int SCROLL_BATCH = 1_000;
  static final String SCROLL_KEEP_ALIVE = "1m";

  private static final ObjectMapper JSON = new ObjectMapper();
  private static final String INDEX_FORBIDDEN = "\\/*?\"<>|,#:";
  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
  private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+([eE][-+]?\\d+)?");
  private static final Set<String> FIELD_TYPES = Set.of(
      "text", "keyword", "long", "integer", "short", "byte", "double", "float", "half_float", "scaled_float",
      "boolean", "date", "date_nanos", "object", "nested", "flattened", "binary", "ip", "geo_point");

  private final ElasticConnector connector;

  public ElasticPlugin(ElasticConnector connector) {
    super(DatabaseType.ELASTICSEARCH);
    this.connector = connector == null ? DefaultElasticConnector.INSTANCE : connector;
  }

  public ElasticPlugin() {
    this(null);
  }

  private <T> T withClient(PluginConfig config, ConnectionScope.Operation<RestClient, T> op) throws Exception {
    return ConnectionScope.withConnection(config, connector::open, op);
  }

  @Override
  protected void probe(PluginConfig config) throws Exception {
    withClient(config, c -> send(c, new Request("GET", "/"), false));
  }

  @Override
  protected boolean isConnectivityFailure(Exception e) {
    return super.isConnectivityFailure(e)
        || e instanceof ConnectTimeoutException
        || e instanceof NoRouteToHostException;
  }

  @Override
  protected EngineException translate(String operation, String subject, Exception e) {
    if (e instanceof ResponseException re) {
      int status = re.getResponse().getStatusLine().getStatusCode();
      if (status == 404 || status == 400) {
        String detail = status == 404 ? "not found" : "rejected by server (HTTP 400)";
        return EngineException.malformedInput(subject, detail, e).withContext(type(), operation);
      }
    }
    return super.translate(operation, subject, e);
  }

  // ---------------------------------------------------------------------------
  // Introspection
  // ---------------------------------------------------------------------------

  @Override
  public List<String> getDatabases(PluginConfig config) {
    return run("getDatabases", null, List::of);
  }

  @Override
  public List<String> getAllSchemas(PluginConfig config) {
    return run("getAllSchemas", null, List::of);
  }

  /** Non-hidden indices; {@code schema} is ignored. */
  @Override
  public List<StorageUnit> getStorageUnits(PluginConfig config, String schema) {
    return run("getStorageUnits", schema, () -> withClient(config, c -> {
      Request r = new Request("GET", "/_cat/indices");
      r.addParameter("format", "json");
      r.addParameter("h", "index,health,docs.count,store.size");
      r.addParameter("s", "index");
      List<StorageUnit> out = new ArrayList<>();
      for (JsonNode idx : send(c, r, false)) {
        String name = idx.path("index").asText();
        if (name.isEmpty() || name.startsWith(".")) continue;
        out.add(new StorageUnit(name, List.of(
            Record.of("Health", text(idx, "health")),
            Record.of("Docs Count", text(idx, "docs.count")),
            Record.of("Store Size", text(idx, "store.size")))));
      }
      return out;
    }));
  }

  // ---------------------------------------------------------------------------
  // Rows
  // ---------------------------------------------------------------------------

  @Override
  public RowsResult getRows(PluginConfig config, String schema, String storageUnit, WhereCondition where,
                            int pageSize, int pageOffset) {
    return run("getRows", storageUnit, () -> {
      requireIndex(storageUnit);
      checkOperators(where);
      OffsetPage page = OffsetPage.of(pageSize, pageOffset);
      ObjectNode query = ElasticQueryRenderer.toQuery(where);
      int window = config.intOption(OPTION_MAX_RESULT_WINDOW, DEFAULT_MAX_RESULT_WINDOW);
      return withClient(config, c -> {
        List<JsonNode> hits = page.end() <= window
            ? search(c, storageUnit, query, page)
            : scroll(c, storageUnit, query, page);
        return rows(hits, false);
      });
    });
  }

  private List<JsonNode> search(RestClient c, String index, ObjectNode query, OffsetPage page) throws IOException {
    ObjectNode body = JSON.createObjectNode();
    body.set("query", query);
    body.put("from", page.offset());
    body.put("size", page.limit());
    body.putArray("sort").add("_doc");
    log.debug("polydb.es op=SEARCH index={} from={} size={}", index, page.offset(), page.limit());
    Request r = new Request("POST", "/" + encode(index) + "/_search");
    r.setJsonEntity(body.toString());
    return hits(send(c, r, false));
  }

  /** Reads past the result window by scrolling from the first hit and skipping {@code offset} hits. */
  private List<JsonNode> scroll(RestClient c, String index, ObjectNode query, OffsetPage page) throws IOException {
    ObjectNode body = JSON.createObjectNode();
    body.set("query", query);
    body.put("size", SCROLL_BATCH);
    body.putArray("sort").add("_doc");
    Request first = new Request("POST", "/" + encode(index) + "/_search");
    first.addParameter("scroll", SCROLL_KEEP_ALIVE);
    first.setJsonEntity(body.toString());

    List<JsonNode> out = new ArrayList<>(page.limit());
    long seen = 0;
    int batches = 0;
    String scrollId = null;
    try {
      JsonNode resp = send(c, first, false);
      while (true) {
        batches++;
        scrollId = resp.path("_scroll_id").asText(null);
        List<JsonNode> batch = hits(resp);
        if (batch.isEmpty()) break;
        for (JsonNode hit : batch) {
          if (seen++ < page.offset()) continue;
          out.add(hit);
          if (out.size() == page.limit()) break;
        }
        if (out.size() == page.limit() || scrollId == null) break;
        ObjectNode next = JSON.createObjectNode();
        next.put("scroll", SCROLL_KEEP_ALIVE);
        next.put("scroll_id", scrollId);
        Request more = new Request("POST", "/_search/scroll");
        more.setJsonEntity(next.toString());
        resp = send(c, more, false);
      }
    } finally {
      if (scrollId != null) clearScroll(c, scrollId);
    }
    log.debug("polydb.es op=SCROLL index={} offset={} size={} batches={}", index, page.offset(), page.limit(), batches);
    return out;
  }

  private static void clearScroll(RestClient c, String scrollId) {
    ObjectNode body = JSON.createObjectNode();
    body.putArray("scroll_id").add(scrollId);
    Request r = new Request("DELETE", "/_search/scroll");
    r.setJsonEntity(body.toString());
    try {
      send(c, r, true);
    } catch (IOException e) {
      // The context expires after the keep-alive anyway.
      log.warn("polydb.es scroll_clear_failed error={}", e.toString());
    }
  }

  /** Creates an index; each field record maps a field name to a mapping type or a declared column type. */
  @Override
  public boolean addStorageUnit(PluginConfig config, String schema, String storageUnit, List<Record> fields) {
    return run("addStorageUnit", storageUnit, () -> {
      requireIndex(storageUnit);
      ObjectNode body = JSON.createObjectNode();
      if (fields != null && !fields.isEmpty()) {
        ObjectNode props = body.putObject("mappings").putObject("properties");
        for (Record f : fields) {
          if (props.has(f.key())) throw EngineException.malformedInput(f.key(), "duplicate field");
          props.putObject(f.key()).put("type", mappingType(f.value()));
        }
      }
      return withClient(config, c -> {
        Request r = new Request("PUT", "/" + encode(storageUnit));
        if (body.size() > 0) r.setJsonEntity(body.toString());
        return send(c, r, false).path("acknowledged").asBoolean(false);
      });
    });
  }

  @Override
  public boolean addRow(PluginConfig config, String schema, String storageUnit, List<Record> values) {
    return run("addRow", storageUnit, () -> {
      requireIndex(storageUnit);
      ObjectNode doc = documentOf(values);
      JsonNode id = doc.remove(ElasticQueryRenderer.ID);
      return withClient(config, c -> {
        Request r = id == null
            ? new Request("POST", "/" + encode(storageUnit) + "/_doc")
            : new Request("PUT", "/" + encode(storageUnit) + "/_create/" + encode(id.asText()));
        r.addParameter("refresh", "wait_for");
        r.setJsonEntity(doc.toString());
        return "created".equals(send(c, r, false).path("result").asText());
      });
    });
  }

  /** With a {@code document} value the stored source is replaced; otherwise {@code updatedColumns} are merged by {@code _id}. */
  @Override
  public boolean updateStorageUnit(PluginConfig config, String schema, String storageUnit,
                                   Map<String, String> values, List<String> updatedColumns) {
    return run("updateStorageUnit", storageUnit, () -> {
      requireIndex(storageUnit);
      Map<String, String> given = values == null ? Map.of() : values;
      if (given.containsKey(DOCUMENT)) {
        ObjectNode doc = parseObject(given.get(DOCUMENT));
        JsonNode embedded = doc.remove(ElasticQueryRenderer.ID);
        String id = requireId(embedded != null ? embedded.asText() : given.get(ElasticQueryRenderer.ID));
        return withClient(config, c -> {
          String path = "/" + encode(storageUnit) + "/_doc/" + encode(id);
          if (send(c, new Request("HEAD", path), true) == null) return false;
          Request r = new Request("PUT", path);
          r.addParameter("refresh", "wait_for");
          r.setJsonEntity(doc.toString());
          return "updated".equals(send(c, r, false).path("result").asText());
        });
      }
      if (updatedColumns == null || updatedColumns.isEmpty()) {
        throw EngineException.malformedInput(storageUnit, "no updated columns given");
      }
      String id = requireId(given.get(ElasticQueryRenderer.ID));
      ObjectNode partial = JSON.createObjectNode();
      for (String field : updatedColumns) {
        if (ElasticQueryRenderer.ID.equals(field)) throw EngineException.malformedInput(field, "_id cannot be updated");
        partial.set(field, infer(given.get(field)));
      }
      ObjectNode body = JSON.createObjectNode();
      body.set("doc", partial);
      return withClient(config, c -> {
        Request r = new Request("POST", "/" + encode(storageUnit) + "/_update/" + encode(id));
        r.addParameter("refresh", "wait_for");
        r.setJsonEntity(body.toString());
        JsonNode resp = send(c, r, true);
        return resp != null;
      });
    });
  }

  @Override
  public boolean deleteRow(PluginConfig config, String schema, String storageUnit, Map<String, String> values) {
    return run("deleteRow", storageUnit, () -> {
      requireIndex(storageUnit);
      Map<String, String> given = values == null ? Map.of() : values;
      String id = given.containsKey(DOCUMENT)
          ? parseObject(given.get(DOCUMENT)).path(ElasticQueryRenderer.ID).asText(null)
          : given.get(ElasticQueryRenderer.ID);
      String target = requireId(id);
      return withClient(config, c -> {
        Request r = new Request("DELETE", "/" + encode(storageUnit) + "/_doc/" + encode(target));
        r.addParameter("refresh", "wait_for");
        JsonNode resp = send(c, r, true);
        return resp != null && "deleted".equals(resp.path("result").asText());
      });
    });
  }

  // ---------------------------------------------------------------------------
  // Raw requests
  // ---------------------------------------------------------------------------

  /**
   * Runs a console-syntax request. Search responses become one row per hit, {@code _cat} arrays one row per
   * entry, anything else a single row holding the response body.
   */
  @Override
  public RowsResult rawExecute(PluginConfig config, String query) {
    return run("rawExecute", query, () -> {
      ConsoleRequest console = ConsoleRequest.parse(query);
      if (console.body() != null) parse(console.body());
      return withClient(config, c -> {
        Request r = new Request(console.method(), console.path());
        r.addParameters(console.parameters());
        if (console.body() != null) r.setJsonEntity(console.body());
        log.debug("polydb.es op=RAW method={} path={}", console.method(), console.path());
        JsonNode resp = send(c, r, false);
        if (resp.isMissingNode()) return RowsResult.empty(COLUMNS, true);
        if (resp.isArray()) {
          List<List<String>> out = new ArrayList<>();
          for (JsonNode n : resp) out.add(List.of(n.toString()));
          return new RowsResult(COLUMNS, out, true);
        }
        if (resp.path("hits").path("hits").isArray()) return rows(hits(resp), true);
        return new RowsResult(COLUMNS, List.of(List.of(resp.toString())), true);
      });
    });
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  /**
   * Performs the request and reads the JSON body.
   *
   * @return the body, {@link MissingNode} when there is none, or {@code null} for a 404 when {@code missingOk}
   */
  static JsonNode send(RestClient c, Request r, boolean missingOk) throws IOException {
    Response response;
    try {
      response = c.performRequest(r);
    } catch (ResponseException e) {
      if (missingOk && e.getResponse().getStatusLine().getStatusCode() == 404) return null;
      throw e;
    }
    // HEAD answers 404 without raising.
    if (missingOk && response.getStatusLine().getStatusCode() == 404) return null;
    HttpEntity entity = response.getEntity();
    if (entity == null) return MissingNode.getInstance();
    String body = EntityUtils.toString(entity, StandardCharsets.UTF_8);
    return body.isBlank() ? MissingNode.getInstance() : JSON.readTree(body);
  }

  private static List<JsonNode> hits(JsonNode resp) {
    List<JsonNode> out = new ArrayList<>();
    for (JsonNode hit : resp.path("hits").path("hits")) out.add(hit);
    return out;
  }

  static RowsResult rows(List<JsonNode> hits, boolean disableUpdate) {
    List<List<String>> out = new ArrayList<>(hits.size());
    for (JsonNode hit : hits) {
      ObjectNode doc = JSON.createObjectNode();
      doc.put(ElasticQueryRenderer.ID, hit.path(ElasticQueryRenderer.ID).asText());
      JsonNode source = hit.get("_source");
      if (source instanceof ObjectNode src) doc.setAll(src);
      out.add(List.of(doc.toString()));
    }
    return new RowsResult(COLUMNS, out, disableUpdate);
  }

  /** A single {@code document} record holding JSON, or plain field records with inferred scalars. */
  static ObjectNode documentOf(List<Record> values) {
    if (values == null || values.isEmpty()) throw EngineException.malformedInput(DOCUMENT, "row has no values");
    if (values.size() == 1 && DOCUMENT.equals(values.get(0).key())) return parseObject(values.get(0).value());
    ObjectNode doc = JSON.createObjectNode();
    for (Record r : values) {
      if (doc.has(r.key())) throw EngineException.malformedInput(r.key(), "duplicate field");
      doc.set(r.key(), infer(r.value()));
    }
    return doc;
  }

  static JsonNode infer(String raw) {
    if (raw == null) return JSON.nullNode();
    String s = raw.trim();
    if (INTEGER.matcher(s).matches()) return JSON.getNodeFactory().numberNode(Long.parseLong(s));
    if (DECIMAL.matcher(s).matches()) return JSON.getNodeFactory().numberNode(Double.parseDouble(s));
    if ("true".equals(s) || "false".equals(s)) return JSON.getNodeFactory().booleanNode(Boolean.parseBoolean(s));
    return JSON.getNodeFactory().textNode(raw);
  }

  static String mappingType(String declared) {
    if (declared == null || declared.isBlank()) return "keyword";
    String t = declared.trim().toLowerCase(Locale.ROOT);
    if (FIELD_TYPES.contains(t)) return t;
    ColumnKind kind = ColumnKind.classify(t);
    switch (kind) {
      case INTEGER: return "long";
      case DECIMAL:
      case FLOAT: return "double";
      case BOOLEAN: return "boolean";
      case DATE:
      case TIMESTAMP: return "date";
      case JSON: return "object";
      case BINARY: return "binary";
      case UUID:
      case TIME: return "keyword";
      case TEXT:
      default: return "text";
    }
  }

  private static ObjectNode parseObject(String json) {
    JsonNode n = parse(json);
    if (!(n instanceof ObjectNode o)) throw EngineException.malformedInput(DOCUMENT, "document must be a JSON object");
    return o;
  }

  private static JsonNode parse(String json) {
    if (json == null || json.isBlank()) throw EngineException.malformedInput(DOCUMENT, "document JSON is required");
    try {
      return JSON.readTree(json);
    } catch (JsonProcessingException e) {
      throw EngineException.malformedInput(DOCUMENT, "invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Checks that a storage unit names exactly one index: lowercase, no wildcard, list, path or
   * cross-cluster characters, no leading {@code _ - +}.
   */
  static String requireIndex(String storageUnit) {
    requireName(storageUnit, "storageUnit");
    String why = null;
    if (storageUnit.equals(".") || storageUnit.equals("..")) why = "is reserved";
    else if (storageUnit.getBytes(StandardCharsets.UTF_8).length > 255) why = "is longer than 255 bytes";
    else if ("_-+".indexOf(storageUnit.charAt(0)) >= 0) why = "may not start with '" + storageUnit.charAt(0) + "'";
    else if (!storageUnit.equals(storageUnit.toLowerCase(Locale.ROOT))) why = "must be lowercase";
    else {
      for (int i = 0; i < storageUnit.length() && why == null; i++) {
        char ch = storageUnit.charAt(i);
        if (INDEX_FORBIDDEN.indexOf(ch) >= 0 || Character.isWhitespace(ch) || Character.isISOControl(ch)) {
          why = "may not contain '" + ch + "'";
        }
      }
    }
    if (why != null) throw EngineException.malformedInput(storageUnit, "index name " + why);
    return storageUnit;
  }

  private static String requireId(String id) {
    if (id == null || id.isBlank()) throw EngineException.malformedInput(ElasticQueryRenderer.ID, "document must carry an _id");
    return id;
  }

  private static String encode(String id) {
    return URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return v == null || v.isNull() ? "" : v.asText();
  }
}
