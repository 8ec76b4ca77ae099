package io.intellixity.polydb.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Uniform tabular result: column metadata, string rows and whether in-place editing is allowed.
 * Cells may be {@code null} for SQL NULL.
 */
public record RowsResult(List<Column> columns, List<List<String>> rows, boolean disableUpdate) {
  public RowsResult {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    List<List<String>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows != null) {
      for (List<String> row : rows) {
        if (row.size() != columns.size()) {
          throw new IllegalArgumentException("row width " + row.size() + " != column count " + columns.size());
        }
        copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
      }
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static RowsResult empty(List<Column> columns, boolean disableUpdate) {
    return new RowsResult(columns, List.of(), disableUpdate);
  }

  public List<String> columnNames() {
    return columns.stream().map(Column::name).toList();
  }
}
