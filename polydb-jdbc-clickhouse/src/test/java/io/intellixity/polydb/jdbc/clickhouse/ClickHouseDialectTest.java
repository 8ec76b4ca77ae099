package io.intellixity.polydb.jdbc.clickhouse;

import io.intellixity.polydb.jdbc.SqlParamCompiler;
import io.intellixity.polydb.jdbc.SqlStatement;
import io.intellixity.polydb.model.Record;
import io.intellixity.polydb.query.WhereConditions;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ClickHouseDialectTest {

  private final ClickHouseDialect d = new ClickHouseDialect();

  private static Map<String, String> types() {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("id", "UInt64");
    m.put("city", "LowCardinality(Nullable(String))");
    m.put("temp", "Nullable(Float64)");
    return m;
  }

  @Test
  void unwrapsNullableAndLowCardinality() {
    assertEquals(ColumnKind.INTEGER, d.kindOf("Nullable(Int32)"));
    assertEquals(ColumnKind.TEXT, d.kindOf("LowCardinality(Nullable(String))"));
    assertEquals(ColumnKind.TIMESTAMP, d.kindOf("Nullable(DateTime64(3))"));
    assertEquals(ColumnKind.DECIMAL, d.kindOf("Decimal(10, 2)"));
    assertEquals(ColumnKind.DATE, d.kindOf("Date32"));
    assertEquals(ColumnKind.TEXT, d.kindOf("Array(String)"));
  }

  @Test
  void rendersMutationsAsAlterTable() {
    SqlStatement update = d.renderUpdate("metrics", "readings", types(), Map.of("temp", "21.5"), Map.of("id", "3"));
    assertEquals("ALTER TABLE `metrics`.`readings` UPDATE `temp` = :b1 WHERE `id` = :b2", update.sql());
    assertEquals(21.5d, update.binds().get(0).value());
    assertEquals(3L, update.binds().get(1).value());

    SqlStatement delete = d.renderDelete("metrics", "readings", types(), Map.of("id", "3"));
    assertEquals("ALTER TABLE `metrics`.`readings` DELETE WHERE `id` = :b1", delete.sql());
  }

  @Test
  void backtickInIdentifierIsDoubledAndKeepsPlaceholdersIntact() {
    assertEquals("`we``ird`", d.quoteIdent("we`ird"));

    Map<String, String> types = Map.of("a` = :x OR `b", "String");
    SqlStatement ss = d.renderSelect("metrics", "odd", types, WhereConditions.eq("a` = :x OR `b", "v"),
        List.of("a` = :x OR `b"), null);
    String jdbc = SqlParamCompiler.toJdbcSql(ss.sql());

    assertEquals(ss.binds().size(), SqlParamCompiler.countParams(ss.sql()));
    assertTrue(jdbc.contains("`a`` = :x OR ``b`"), jdbc);
    assertEquals(ss.binds().size(), jdbc.chars().filter(ch -> ch == '?').count());
  }

  @Test
  void likeOnNumbersGoesThroughToString() {
    SqlStatement ss = d.renderSelect("metrics", "readings", types(), WhereConditions.like("id", "1%"), List.of("id"), null);
    assertTrue(ss.sql().contains("WHERE toString(`id`) LIKE :b1"), ss.sql());
  }

  @Test
  void createsMergeTreeTables() {
    SqlStatement keyed = d.renderCreateTable("metrics", "readings", List.of(
        new Record("id", "UInt64", Map.of(Record.PRIMARY, "true")),
        Record.of("city", "String")));
    assertEquals("CREATE TABLE `metrics`.`readings` (`id` UInt64, `city` Nullable(String), PRIMARY KEY (`id`)) " +
        "ENGINE = MergeTree() ORDER BY (`id`)", keyed.sql());

    SqlStatement unkeyed = d.renderCreateTable("metrics", "log", List.of(
        new Record("line", "String", Map.of(Record.NULLABLE, "false"))));
    assertEquals("CREATE TABLE `metrics`.`log` (`line` String) ENGINE = MergeTree() ORDER BY tuple()", unkeyed.sql());
  }
}
