package io.intellixity.polydb.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.MongoIterable;
import com.mongodb.client.result.DeleteResult;
import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import io.intellixity.polydb.model.Credentials;
import io.intellixity.polydb.model.DatabaseType;
import io.intellixity.polydb.model.PluginConfig;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RowsResult;
import io.intellixity.polydb.query.WhereConditions;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
final class MongoPluginTest {

  private final PluginConfig config = PluginConfig.of(new Credentials(DatabaseType.MONGODB, null, null, null, null, "shop"));

  private MongoClient client;
  private MongoDatabase db;
  private MongoCollection<Document> users;
  private MongoPlugin plugin;

  @BeforeEach
  void setUp() {
    client = mock(MongoClient.class);
    db = mock(MongoDatabase.class);
    users = mock(MongoCollection.class);
    when(client.getDatabase("shop")).thenReturn(db);
    when(db.getCollection("users")).thenReturn(users);
    MongoIterable<String> names = iterable(List.of("users"));
    when(db.listCollectionNames()).thenReturn(names);
    plugin = new MongoPlugin(cfg -> client);
  }

  private static <T> MongoIterable<T> iterable(List<T> items) {
    MongoIterable<T> it = mock(MongoIterable.class);
    when(it.into(any())).thenAnswer(inv -> {
      Collection<T> target = inv.getArgument(0);
      target.addAll(items);
      return target;
    });
    return it;
  }

  private FindIterable<Document> findReturning(List<Document> docs) {
    FindIterable<Document> find = mock(FindIterable.class, RETURNS_SELF);
    when(find.into(any())).thenAnswer(inv -> {
      Collection<Document> target = inv.getArgument(0);
      target.addAll(docs);
      return target;
    });
    return find;
  }

  @Test
  void rowsAreDocumentsAsJson() {
    FindIterable<Document> find = findReturning(List.of(new Document("_id", 1).append("name", "Bob")));
    when(users.find(any(Bson.class))).thenReturn(find);

    RowsResult r = plugin.getRows(config, "shop", "users", WhereConditions.eq("name", "Bob"), 10, 20);

    assertEquals(List.of("document"), r.columnNames());
    assertEquals(List.of(List.of("{\"_id\": 1, \"name\": \"Bob\"}")), r.rows());
    ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(users).find(filter.capture());
    assertEquals(new Document("name", "Bob"), filter.getValue());
    verify(find).skip(20);
    verify(find).limit(10);
    verify(client).close();
  }

  @Test
  void unknownCollectionIsMalformedInput() {
    EngineException ex = assertThrows(EngineException.class,
        () -> plugin.getRows(config, "shop", "ghosts", null, 10, 0));
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
    assertEquals(DatabaseType.MONGODB, ex.type());
    verify(client).close();
  }

  @Test
  void unreachableServerIsUnavailable() {
    MongoPlugin down = new MongoPlugin(cfg -> {
      throw new MongoTimeoutException("Timed out after 30000 ms while waiting for a server");
    });
    assertFalse(down.isAvailable(config));
    EngineException ex = assertThrows(EngineException.class, () -> down.getDatabases(config));
    assertEquals(ErrorKind.UNAVAILABLE, ex.kind());
    assertEquals("getDatabases", ex.operation());
  }

  @Test
  void addRowInsertsParsedDocument() {
    assertTrue(plugin.addRow(config, "shop", "users", List.of(Record.of("document", "{\"name\": \"Cy\", \"age\": 30}"))));
    ArgumentCaptor<Document> doc = ArgumentCaptor.forClass(Document.class);
    verify(users).insertOne(doc.capture());
    assertEquals("Cy", doc.getValue().getString("name"));
    assertEquals(30, doc.getValue().get("age"));

    EngineException ex = assertThrows(EngineException.class,
        () -> plugin.addRow(config, "shop", "users", List.of(Record.of("document", "{not json"))));
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
  }

  @Test
  void deleteAddressesDocumentById() {
    String hex = "65a1f0c2e4b0a1b2c3d4e5f6";
    when(users.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(1));
    assertTrue(plugin.deleteRow(config, "shop", "users", Map.of("_id", hex)));
    ArgumentCaptor<Bson> filter = ArgumentCaptor.forClass(Bson.class);
    verify(users).deleteOne(filter.capture());
    assertEquals(new ObjectId(hex), filter.getValue()
        .toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry()).getObjectId("_id").getValue());

    EngineException ex = assertThrows(EngineException.class, () -> plugin.deleteRow(config, "shop", "users", Map.of()));
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
  }

  @Test
  void rawCommandReturnsCursorBatch() {
    Document reply = new Document("cursor", new Document("firstBatch", List.of(new Document("a", 1), new Document("a", 2))))
        .append("ok", 1.0);
    when(db.runCommand(any(Bson.class))).thenReturn(reply);

    RowsResult r = plugin.rawExecute(config, "{\"find\": \"users\"}");
    assertTrue(r.disableUpdate());
    assertEquals(List.of(List.of("{\"a\": 1}"), List.of("{\"a\": 2}")), r.rows());

    EngineException ex = assertThrows(EngineException.class, () -> plugin.rawExecute(config, "db.users.find()"));
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
  }

  @Test
  void chatIsUnsupported() {
    EngineException ex = assertThrows(EngineException.class, () -> plugin.chat(config, "shop", null, "hi"));
    assertEquals(ErrorKind.UNSUPPORTED_OPERATION, ex.kind());
  }
}
