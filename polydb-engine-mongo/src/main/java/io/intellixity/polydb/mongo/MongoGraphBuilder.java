package io.intellixity.polydb.mongo;

import com.mongodb.DBRef;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.GraphUnitRelationship;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RelationshipType;
import io.intellixity.polydb.model.StorageUnit;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives collection relationships from sampled documents.
 *
 * <p>A top-level field references another collection when it holds a {@link DBRef}, or when its name
 * is {@code <name>_id}/{@code <name>Id} ({@code _ids}/{@code Ids} for arrays) and {@code <name>} resolves
 * to a collection, singular or plural. A scalar reference is ManyToOne (inverse OneToMany); an array of
 * references is ManyToMany both ways.</p>
 */
final class MongoGraphBuilder {
  private static final Pattern SCALAR_REF = Pattern.compile("(.+?)(_id|Id)");
  private static final Pattern ARRAY_REF = Pattern.compile("(.+?)(_ids|Ids)");

  private MongoGraphBuilder() {}

  static List<GraphUnit> build(Map<String, List<Document>> samples) {
    Map<String, Map<String, RelationshipType>> edges = new LinkedHashMap<>();
    for (String name : samples.keySet()) edges.put(name, new LinkedHashMap<>());

    for (var e : samples.entrySet()) {
      String source = e.getKey();
      for (Document doc : e.getValue()) {
        for (var field : doc.entrySet()) {
          if (MongoQueryRenderer.ID.equals(field.getKey())) continue;
          Object v = field.getValue();
          String target;
          RelationshipType type;
          if (v instanceof DBRef ref) {
            target = ref.getCollectionName();
            type = RelationshipType.MANY_TO_ONE;
          } else if (v instanceof Collection<?> list && !list.isEmpty()) {
            target = arrayTarget(field.getKey(), list, samples);
            type = RelationshipType.MANY_TO_MANY;
          } else if (v != null && !(v instanceof Document)) {
            target = nameTarget(SCALAR_REF, field.getKey(), samples);
            type = RelationshipType.MANY_TO_ONE;
          } else {
            continue;
          }
          if (target == null || target.equals(source) || !samples.containsKey(target)) continue;
          link(edges, source, target, type);
        }
      }
    }

    List<GraphUnit> out = new ArrayList<>();
    for (var e : edges.entrySet()) {
      List<GraphUnitRelationship> rels = new ArrayList<>();
      e.getValue().forEach((target, type) -> rels.add(new GraphUnitRelationship(target, type)));
      out.add(new GraphUnit(new StorageUnit(e.getKey(), List.of(Record.of("Type", "collection"))), rels));
    }
    return out;
  }

  private static void link(Map<String, Map<String, RelationshipType>> edges, String source, String target,
                           RelationshipType type) {
    edges.get(source).putIfAbsent(target, type);
    edges.get(target).putIfAbsent(source, type.inverse());
  }

  private static String arrayTarget(String field, Collection<?> list, Map<String, List<Document>> samples) {
    Object first = list.iterator().next();
    if (first instanceof DBRef ref) return ref.getCollectionName();
    if (!(first instanceof ObjectId) && !(first instanceof String) && !(first instanceof Number)) return null;
    return nameTarget(ARRAY_REF, field, samples);
  }

  private static String nameTarget(Pattern pattern, String field, Map<String, List<Document>> samples) {
    Matcher m = pattern.matcher(field);
    if (!m.matches()) return null;
    String base = m.group(1);
    for (String candidate : List.of(base, base + "s", base + "es")) {
      for (String name : samples.keySet()) {
        if (name.equalsIgnoreCase(candidate)) return name;
      }
    }
    String lower = base.toLowerCase(Locale.ROOT);
    if (lower.endsWith("y")) {
      String plural = lower.substring(0, lower.length() - 1) + "ies";
      for (String name : samples.keySet()) {
        if (name.equalsIgnoreCase(plural)) return name;
      }
    }
    return null;
  }
}
