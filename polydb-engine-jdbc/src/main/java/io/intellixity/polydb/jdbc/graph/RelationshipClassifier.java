package io.intellixity.polydb.jdbc.graph;

import io.intellixity.polydb.model.Column;
import io.intellixity.polydb.model.GraphUnit;
import io.intellixity.polydb.model.GraphUnitRelationship;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.model.RelationshipType;
import io.intellixity.polydb.model.StorageUnit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies foreign keys into relationship cardinalities.
 *
 * Rules:
 * - Pure join table (exactly two columns, each a single-column FK): ManyToMany between the two
 *   referenced tables; the join table is left out of the graph
 * - FK column unique on the referencing side and referenced column unique: OneToOne on both sides
 * - FK referencing a unique column without reverse uniqueness: ManyToOne, inverse OneToMany
 * - Anything else (composite keys, non-unique targets): Unknown on both sides
 */
public final class RelationshipClassifier {
  private RelationshipClassifier() {}

  private record Constraint(String table, String refTable, List<String> columns, List<String> refColumns) {
    boolean single() { return columns.size() == 1; }
  }

  /**
   * @param tables columns per table, in catalog order
   */
  public static List<GraphUnit> classify(Map<String, List<Column>> tables,
                                         List<ForeignKey> foreignKeys,
                                         List<UniqueKey> uniqueKeys) {
    List<Constraint> constraints = group(foreignKeys);
    Set<String> singleUnique = singleColumnUnique(uniqueKeys);

    Map<String, Set<GraphUnitRelationship>> edges = new LinkedHashMap<>();
    for (String t : tables.keySet()) edges.put(t, new LinkedHashSet<>());

    Map<String, List<Constraint>> joinTables = new LinkedHashMap<>();
    for (var e : tables.entrySet()) {
      String table = e.getKey();
      List<Constraint> own = constraints.stream().filter(c -> c.table().equals(table)).toList();
      if (isJoinTable(e.getValue(), own)) joinTables.put(table, own);
    }
    Set<String> hidden = joinTables.keySet();
    for (List<Constraint> own : joinTables.values()) {
      String a = own.get(0).refTable();
      String b = own.get(1).refTable();
      addEdge(edges, hidden, a, b, RelationshipType.MANY_TO_MANY);
      addEdge(edges, hidden, b, a, RelationshipType.MANY_TO_MANY);
    }

    for (Constraint c : constraints) {
      if (joinTables.containsKey(c.table())) continue;
      RelationshipType type;
      if (!c.single() || !singleUnique.contains(key(c.refTable(), c.refColumns().get(0)))) {
        type = RelationshipType.UNKNOWN;
      } else if (singleUnique.contains(key(c.table(), c.columns().get(0)))) {
        type = RelationshipType.ONE_TO_ONE;
      } else {
        type = RelationshipType.MANY_TO_ONE;
      }
      addEdge(edges, hidden, c.table(), c.refTable(), type);
      addEdge(edges, hidden, c.refTable(), c.table(), type.inverse());
    }

    List<GraphUnit> out = new ArrayList<>();
    for (var e : tables.entrySet()) {
      if (joinTables.containsKey(e.getKey())) continue;
      List<Record> attrs = new ArrayList<>();
      for (Column col : e.getValue()) attrs.add(Record.of(col.name(), col.type()));
      out.add(new GraphUnit(new StorageUnit(e.getKey(), attrs), new ArrayList<>(edges.get(e.getKey()))));
    }
    return out;
  }

  private static boolean isJoinTable(List<Column> columns, List<Constraint> own) {
    if (columns.size() != 2 || own.size() != 2) return false;
    if (!own.get(0).single() || !own.get(1).single()) return false;
    Set<String> fkCols = Set.of(own.get(0).columns().get(0), own.get(1).columns().get(0));
    if (fkCols.size() != 2) return false;
    for (Column c : columns) {
      if (!fkCols.contains(c.name())) return false;
    }
    return true;
  }

  private static void addEdge(Map<String, Set<GraphUnitRelationship>> edges, Set<String> hidden,
                              String from, String to, RelationshipType type) {
    Set<GraphUnitRelationship> set = edges.get(from);
    // Edges towards tables outside the inspected schema or towards collapsed join tables are dropped.
    if (set == null || !edges.containsKey(to) || hidden.contains(from) || hidden.contains(to)) return;
    set.add(new GraphUnitRelationship(to, type));
  }

  private static List<Constraint> group(List<ForeignKey> foreignKeys) {
    Map<String, List<ForeignKey>> byConstraint = new LinkedHashMap<>();
    for (ForeignKey fk : foreignKeys) {
      byConstraint.computeIfAbsent(fk.table() + "\u0000" + fk.constraint(), k -> new ArrayList<>()).add(fk);
    }
    List<Constraint> out = new ArrayList<>();
    for (List<ForeignKey> parts : byConstraint.values()) {
      out.add(new Constraint(parts.get(0).table(), parts.get(0).refTable(),
          parts.stream().map(ForeignKey::column).toList(),
          parts.stream().map(ForeignKey::refColumn).toList()));
    }
    return out;
  }

  private static Set<String> singleColumnUnique(List<UniqueKey> uniqueKeys) {
    Map<String, List<UniqueKey>> byConstraint = new LinkedHashMap<>();
    for (UniqueKey uk : uniqueKeys) {
      byConstraint.computeIfAbsent(uk.table() + "\u0000" + uk.constraint(), k -> new ArrayList<>()).add(uk);
    }
    Set<String> out = new HashSet<>();
    for (List<UniqueKey> parts : byConstraint.values()) {
      if (parts.size() == 1) out.add(key(parts.get(0).table(), parts.get(0).column()));
    }
    return out;
  }

  private static String key(String table, String column) {
    return table + "." + column;
  }
}
