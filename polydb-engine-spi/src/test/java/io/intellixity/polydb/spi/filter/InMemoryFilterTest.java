package io.intellixity.polydb.spi.filter;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import io.intellixity.polydb.query.WhereConditions;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryFilterTest {

  private final InMemoryFilter filter = InMemoryFilter.forColumns(Map.of(
      "member", ColumnKind.TEXT,
      "score", ColumnKind.FLOAT));

  private final List<Map<String, String>> rows = List.of(
      Map.of("member", "alice", "score", "10"),
      Map.of("member", "bob", "score", "2.5"),
      Map.of("member", "carol", "score", "100"));

  @Test
  void comparesNumbersNumerically() {
    var out = filter.apply(rows, WhereConditions.gt("score", "9"));
    assertEquals(List.of("alice", "carol"), out.stream().map(r -> r.get("member")).toList());
  }

  @Test
  void evaluatesGroupsAndLists() {
    var where = WhereConditions.or(
        WhereConditions.and(WhereConditions.like("member", "a%"), WhereConditions.lt("score", "50")),
        WhereConditions.in("member", List.of("carol", "dave")));
    var out = filter.apply(rows, where);
    assertEquals(List.of("alice", "carol"), out.stream().map(r -> r.get("member")).toList());
  }

  @Test
  void nullCellsOnlyMatchIsNull() {
    Map<String, String> row = new HashMap<>();
    row.put("member", "x");
    row.put("score", null);
    assertTrue(filter.matches(WhereConditions.isNull("score"), row));
    assertFalse(filter.matches(WhereConditions.ne("score", "1"), row));
    assertFalse(filter.matches(WhereConditions.isNotNull("score"), row));
  }

  @Test
  void likeUsesWildcardsLiterally() {
    assertTrue(InMemoryFilter.toRegex("a.b_%").matcher("a.bc-rest").matches());
    assertFalse(InMemoryFilter.toRegex("a.b_%").matcher("axbc").matches());
  }

  @Test
  void rejectsUnknownColumnsAndBadValues() {
    EngineException unknown = assertThrows(EngineException.class,
        () -> filter.apply(rows, WhereConditions.eq("nope", "1")));
    assertEquals(ErrorKind.MALFORMED_FILTER, unknown.kind());

    EngineException bad = assertThrows(EngineException.class,
        () -> filter.apply(rows, WhereConditions.gt("score", "high")));
    assertEquals(ErrorKind.MALFORMED_FILTER, bad.kind());
  }
}
