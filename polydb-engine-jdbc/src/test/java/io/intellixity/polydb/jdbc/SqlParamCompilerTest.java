package io.intellixity.polydb.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SqlParamCompilerTest {

  @Test
  void rewritesNamedParamsOutsideQuotes() {
    String sql = "SELECT \"a:b\", 'x:y', `c:d` FROM t WHERE id = :b1 AND v::text = :b2";
    assertEquals("SELECT \"a:b\", 'x:y', `c:d` FROM t WHERE id = ? AND v::text = ?", SqlParamCompiler.toJdbcSql(sql));
    assertEquals(2, SqlParamCompiler.countParams(sql));
  }

  @Test
  void handlesDoubledQuotes() {
    String sql = "SELECT 'it''s :b9' FROM \"we\"\"ird:b3\" WHERE x = :b1";
    assertEquals("SELECT 'it''s :b9' FROM \"we\"\"ird:b3\" WHERE x = ?", SqlParamCompiler.toJdbcSql(sql));
    assertEquals(1, SqlParamCompiler.countParams(sql));
  }
}
