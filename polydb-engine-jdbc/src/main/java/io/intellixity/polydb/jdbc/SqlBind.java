package io.intellixity.polydb.jdbc;

import io.intellixity.polydb.spi.coerce.ColumnKind;

/** A coerced parameter value plus the kind it was coerced to. */
public record SqlBind(Object value, ColumnKind kind) {
  public SqlBind {
    kind = kind == null ? ColumnKind.TEXT : kind;
  }

  public static SqlBind of(Object value, ColumnKind kind) {
    return new SqlBind(value, kind);
  }
}
