package io.intellixity.polydb.mongo;

import com.mongodb.DBRef;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.RelationshipType;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoGraphBuilderTest {

  @Test
  void derivesReferencesFromFieldNamesAndDbRefs() {
    ObjectId user = new ObjectId();
    Map<String, List<Document>> samples = new LinkedHashMap<>();
    samples.put("users", List.of(new Document("_id", user).append("name", "Ann")));
    samples.put("orders", List.of(new Document("_id", new ObjectId()).append("user_id", user).append("paid", true)));
    samples.put("groups", List.of(new Document("_id", new ObjectId()).append("userIds", List.of(user))));
    samples.put("invoices", List.of(new Document("_id", new ObjectId()).append("owner", new DBRef("users", user))));
    samples.put("posts", List.of(new Document("_id", new ObjectId()).append("authorId", new ObjectId())
        .append("meta", new Document("category_id", 3))));
    samples.put("categories", List.of(new Document("_id", 3)));

    Map<String, GraphUnit> byName = new HashMap<>();
    for (GraphUnit u : MongoGraphBuilder.build(samples)) byName.put(u.name(), u);

    assertEquals(6, byName.size());
    assertEquals(RelationshipType.MANY_TO_ONE, byName.get("orders").relationTo("users"));
    assertEquals(RelationshipType.ONE_TO_MANY, byName.get("users").relationTo("orders"));
    assertEquals(RelationshipType.MANY_TO_MANY, byName.get("groups").relationTo("users"));
    assertEquals(RelationshipType.MANY_TO_MANY, byName.get("users").relationTo("groups"));
    assertEquals(RelationshipType.MANY_TO_ONE, byName.get("invoices").relationTo("users"));
    assertTrue(byName.get("posts").relations().isEmpty());
    assertTrue(byName.get("categories").relations().isEmpty());
  }

  @Test
  void pluralFormsResolve() {
    Map<String, List<Document>> samples = new LinkedHashMap<>();
    samples.put("categories", List.of(new Document("_id", 1)));
    samples.put("boxes", List.of(new Document("_id", 1)));
    samples.put("items", List.of(new Document("category_id", 1).append("boxId", 1)));

    Map<String, GraphUnit> byName = new HashMap<>();
    for (GraphUnit u : MongoGraphBuilder.build(samples)) byName.put(u.name(), u);
    assertEquals(RelationshipType.MANY_TO_ONE, byName.get("items").relationTo("categories"));
    assertEquals(RelationshipType.MANY_TO_ONE, byName.get("items").relationTo("boxes"));
  }
}
