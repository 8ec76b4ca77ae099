package io.intellixity.polydb.query;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class WhereConditionsTest {
  @Test
  void operatorSymbolsAreCaseAndSpaceInsensitive() {
    assertEquals(Operator.NOT_LIKE, Operator.fromSymbol("not   like"));
    assertEquals(Operator.IS_NOT_NULL, Operator.fromSymbol("is not null"));
    assertEquals(Operator.NE, Operator.fromSymbol("<>"));
    assertEquals(Operator.GE, Operator.fromSymbol("GE"));
  }

  @Test
  void collectsKeysAndOperatorsAcrossTree() {
    WhereCondition w = WhereConditions.or(
        WhereConditions.eq("a", "1"),
        WhereConditions.and(WhereConditions.gt("b", "2"), WhereConditions.eq("a", "3")));
    assertEquals(List.of("a", "b"), List.copyOf(WhereConditions.keys(w)));
    assertEquals(Set.of(Operator.EQ, Operator.GT), WhereConditions.operators(w));
  }

  @Test
  void atomicRequiresValueUnlessNullCheck() {
    EngineException ex = assertThrows(EngineException.class, () -> new AtomicCondition(null, "a", Operator.EQ, null));
    assertEquals(ErrorKind.MALFORMED_FILTER, ex.kind());
    assertNull(WhereConditions.isNull("a").value());
  }

  @Test
  void pageValidatesBounds() {
    assertEquals(ErrorKind.MALFORMED_INPUT, assertThrows(EngineException.class, () -> OffsetPage.of(0, 0)).kind());
    assertEquals(ErrorKind.MALFORMED_INPUT, assertThrows(EngineException.class, () -> OffsetPage.of(10, -1)).kind());
    assertEquals(30, OffsetPage.of(10, 20).end());
  }
}
