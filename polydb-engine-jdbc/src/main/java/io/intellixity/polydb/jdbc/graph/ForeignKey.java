package io.intellixity.polydb.jdbc.graph;

import java.util.Objects;

/** One column pair of a foreign-key constraint; composite constraints span several rows with the same name. */
public record ForeignKey(String constraint, String table, String column, String refTable, String refColumn) {
  public ForeignKey {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(refTable, "refTable");
    Objects.requireNonNull(refColumn, "refColumn");
    if (constraint == null || constraint.isBlank()) constraint = table + "_" + column + "_fkey";
  }
}
