package io.intellixity.polydb.jdbc.postgres;

import io.intellixity.polydb.jdbc.SqlBind;
import io.intellixity.polydb.jdbc.SqlStatement;
import io.intellixity.polydb.query.WhereConditions;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

final class PostgresDialectTest {

  private final PostgresDialect d = new PostgresDialect();

  private static Map<String, String> types() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("id", "uuid");
    m.put("age", "integer");
    m.put("payload", "jsonb");
    return m;
  }

  @Test
  void castsNonTextColumnsForLike() {
    SqlStatement ss = d.renderSelect("public", "people", types(), WhereConditions.like("age", "4%"), List.of(), null);
    assertTrue(ss.sql().endsWith("WHERE CAST(\"age\" AS TEXT) LIKE :b1"), ss.sql());
  }

  @Test
  void coercesUuidFilterValues() {
    String id = "123e4567-e89b-12d3-a456-426614174000";
    SqlStatement ss = d.renderSelect("public", "people", types(), WhereConditions.eq("id", id), List.of("id"), null);
    assertEquals(UUID.fromString(id), ss.binds().get(0).value());
    assertTrue(ss.sql().contains("FROM \"public\".\"people\""));
  }

  @Test
  void bindsJsonAsJsonb() throws Exception {
    PreparedStatement ps = mock(PreparedStatement.class);
    d.bind(ps, 1, SqlBind.of("{\"a\":1}", ColumnKind.JSON));
    ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
    verify(ps).setObject(eq(1), captor.capture());
    PGobject obj = (PGobject) captor.getValue();
    assertEquals("jsonb", obj.getType());
    assertEquals("{\"a\":1}", obj.getValue());

    d.bind(ps, 2, SqlBind.of(null, ColumnKind.JSON));
    verify(ps).setNull(2, Types.OTHER);
  }

  @Test
  void bindsTextUntyped() throws Exception {
    PreparedStatement ps = mock(PreparedStatement.class);
    d.bind(ps, 3, SqlBind.of("happy", ColumnKind.TEXT));
    verify(ps).setObject(3, "happy", Types.OTHER);

    d.bind(ps, 4, SqlBind.of(5L, ColumnKind.INTEGER));
    verify(ps).setObject(eq(4), any(Long.class));
  }
}
