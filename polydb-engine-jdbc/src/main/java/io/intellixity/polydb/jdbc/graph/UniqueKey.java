package io.intellixity.polydb.jdbc.graph;

import java.util.Objects;

/** One column of a primary-key or unique constraint. */
public record UniqueKey(String constraint, String table, String column) {
  public UniqueKey {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(column, "column");
    if (constraint == null || constraint.isBlank()) constraint = table + "_" + column + "_key";
  }
}
