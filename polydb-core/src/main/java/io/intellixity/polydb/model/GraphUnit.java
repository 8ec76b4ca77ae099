package io.intellixity.polydb.model;

import java.util.List;
import java.util.Objects;

/** A storage unit and its outbound relationships, built per request from live catalog inspection. */
public record GraphUnit(StorageUnit unit, List<GraphUnitRelationship> relations) {
  public GraphUnit {
    Objects.requireNonNull(unit, "unit");
    relations = relations == null ? List.of() : List.copyOf(relations);
  }

  public String name() { return unit.name(); }

  public RelationshipType relationTo(String other) {
    for (GraphUnitRelationship r : relations) {
      if (r.name().equals(other)) return r.relationship();
    }
    return null;
  }
}
