package io.intellixity.polydb.model;

public enum RelationshipType {
  ONE_TO_ONE("OneToOne"),
  ONE_TO_MANY("OneToMany"),
  MANY_TO_ONE("ManyToOne"),
  MANY_TO_MANY("ManyToMany"),
  UNKNOWN("Unknown");

  private final String label;

  RelationshipType(String label) { this.label = label; }

  public String label() { return label; }

  /** Cardinality seen from the other side of the edge. */
  public RelationshipType inverse() {
    return switch (this) {
      case ONE_TO_MANY -> MANY_TO_ONE;
      case MANY_TO_ONE -> ONE_TO_MANY;
      default -> this;
    };
  }
}
