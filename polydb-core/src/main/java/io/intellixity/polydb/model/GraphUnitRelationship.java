package io.intellixity.polydb.model;

import java.util.Objects;

public record GraphUnitRelationship(String name, RelationshipType relationship) {
  public GraphUnitRelationship {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(relationship, "relationship");
  }
}
